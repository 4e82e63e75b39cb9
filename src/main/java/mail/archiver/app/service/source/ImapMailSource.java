package mail.archiver.app.service.source;

import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.ReceivedDateTerm;
import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.config.ArchiverProperties;
import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.entity.ProviderType;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPMessage;
import org.eclipse.angus.mail.imap.IMAPStore;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Properties;

/**
 * IMAP mailbox access through Jakarta Mail. Messages are addressed by UID, so a folder
 * stays open (read-write) while its messages are streamed and deleted. Envelopes are
 * fetched in windows of {@code archiver.batch.batch-size} messages.
 */
@Slf4j
@Component
public class ImapMailSource implements MailSourceAdapter {
    private static final int TIMEOUT_MS = 60_000;

    private final int fetchWindow;

    public ImapMailSource(ArchiverProperties properties) {
        this.fetchWindow = Math.max(1, properties.getBatch().getBatchSize());
    }

    @Override
    public ProviderType providerType() {
        return ProviderType.IMAP;
    }

    @Override
    public MailSourceSession open(MailAccount account) {
        String protocol = account.isUseSsl() ? "imaps" : "imap";
        Properties props = new Properties();
        props.setProperty("mail." + protocol + ".host", account.getImapServer());
        props.setProperty("mail." + protocol + ".port", String.valueOf(account.getImapPort()));
        props.setProperty("mail." + protocol + ".connectiontimeout", String.valueOf(TIMEOUT_MS));
        props.setProperty("mail." + protocol + ".timeout", String.valueOf(TIMEOUT_MS));
        props.setProperty("mail." + protocol + ".partialfetch", "false");
        props.setProperty("mail.mime.address.strict", "false");

        try {
            Store store = Session.getInstance(props).getStore(protocol);
            store.connect(account.getImapServer(), account.getImapPort(), account.getUsername(), account.getPassword());
            log.debug("Connected to {}:{} for account {}", account.getImapServer(), account.getImapPort(), account.getName());
            return new ImapSession(account, store, fetchWindow);
        } catch (AuthenticationFailedException e) {
            throw new MailSourceException("IMAP authentication failed for " + account.getName() + ": " + e.getMessage(), e, false);
        } catch (MessagingException e) {
            throw new MailSourceException("Cannot connect to " + account.getImapServer() + ": " + e.getMessage(), e, true);
        }
    }

    static class ImapSession implements MailSourceSession {
        private final MailAccount account;
        private final Store store;
        private final int fetchWindow;
        private final Map<String, Folder> openFolders = new HashMap<>();

        ImapSession(MailAccount account, Store store, int fetchWindow) {
            this.account = account;
            this.store = store;
            this.fetchWindow = fetchWindow;
        }

        @Override
        public List<String> listFolders() {
            try {
                List<String> names = new ArrayList<>();
                for (Folder folder : store.getDefaultFolder().list("*")) {
                    if ((folder.getType() & Folder.HOLDS_MESSAGES) != 0) {
                        names.add(folder.getFullName());
                    }
                }
                return names;
            } catch (MessagingException e) {
                throw MailSourceException.fromMessaging("Cannot list folders of " + account.getName(), e);
            }
        }

        @Override
        public MessageStream fetchMessages(String folderName, Instant since) {
            try {
                Folder folder = openFolder(folderName);
                // SEARCH SINCE is day-granular, so the result may overlap the previous pass
                Message[] messages = since == null
                    ? folder.getMessages()
                    : folder.search(new ReceivedDateTerm(ComparisonTerm.GE, Date.from(since)));
                log.debug("Folder {} of {}: {} messages to check", folderName, account.getName(), messages.length);
                return new ImapMessageStream(folder, messages, fetchWindow);
            } catch (MessagingException e) {
                throw MailSourceException.fromMessaging("Cannot read folder " + folderName, e);
            }
        }

        @Override
        public void deleteMessage(String folderName, SourceMessage message) {
            try {
                // A plain EXPUNGE would also remove messages other clients flagged as deleted
                if (!(store instanceof IMAPStore) || !((IMAPStore) store).hasCapability("UIDPLUS")) {
                    throw new UnsupportedOperationException("IMAP server of " + account.getName()
                        + " does not support UIDPLUS, messages cannot be expunged one by one");
                }
                Folder folder = openFolder(folderName);
                Message target = ((UIDFolder) folder).getMessageByUID(Long.parseLong(message.getProviderRef()));
                if (target == null) {
                    log.debug("Message UID {} is no longer in {}", message.getProviderRef(), folderName);
                    return;
                }
                target.setFlag(Flags.Flag.DELETED, true);
                ((IMAPFolder) folder).expunge(new Message[]{target});
            } catch (MessagingException e) {
                throw MailSourceException.fromMessaging("Cannot delete message " + message.getProviderRef(), e);
            }
        }

        @Override
        public boolean pushMessage(String folderName, MimeMessage message) {
            try {
                Folder folder = store.getFolder(folderName);
                if (!folder.exists() && !folder.create(Folder.HOLDS_MESSAGES)) {
                    throw new MailSourceException("Cannot create folder " + folderName, false);
                }
                message.setFlag(Flags.Flag.SEEN, true);
                folder.appendMessages(new Message[]{message});
                return true;
            } catch (MessagingException e) {
                throw MailSourceException.fromMessaging("Cannot append to " + folderName, e);
            }
        }

        private Folder openFolder(String folderName) throws MessagingException {
            Folder folder = openFolders.get(folderName);
            if (folder != null && folder.isOpen()) {
                return folder;
            }
            folder = store.getFolder(folderName);
            folder.open(Folder.READ_WRITE);
            openFolders.put(folderName, folder);
            return folder;
        }

        @Override
        public void close() {
            for (Folder folder : openFolders.values()) {
                try {
                    if (folder.isOpen()) {
                        folder.close(false);
                    }
                } catch (MessagingException e) {
                    log.warn("Error closing folder {}: {}", folder.getFullName(), e.getMessage());
                }
            }
            openFolders.clear();
            try {
                store.close();
            } catch (MessagingException e) {
                log.warn("Error closing IMAP connection of {}: {}", account.getName(), e.getMessage());
            }
        }
    }

    private static class ImapMessageStream implements MessageStream {
        private final Folder folder;
        private final Message[] messages;
        private final int window;
        private Message[] fetched = new Message[0];
        private int fetchedUpTo;
        private int index;

        ImapMessageStream(Folder folder, Message[] messages, int window) {
            this.folder = folder;
            this.messages = messages;
            this.window = window;
        }

        @Override
        public int size() {
            return messages.length;
        }

        @Override
        public boolean hasNext() {
            if (index >= messages.length) {
                return false;
            }
            if (index >= fetchedUpTo) {
                fetchWindow();
            }
            return true;
        }

        private void fetchWindow() {
            Message[] next = Arrays.copyOfRange(messages, index, Math.min(index + window, messages.length));
            FetchProfile profile = new FetchProfile();
            profile.add(FetchProfile.Item.ENVELOPE);
            profile.add(UIDFolder.FetchProfileItem.UID);
            try {
                folder.fetch(next, profile);
            } catch (MessagingException e) {
                throw MailSourceException.fromMessaging("Cannot fetch envelopes of " + folder.getFullName(), e);
            }
            // the previous window is fully processed by now
            for (Message done : fetched) {
                if (done instanceof IMAPMessage) {
                    ((IMAPMessage) done).invalidateHeaders();
                }
            }
            fetched = next;
            fetchedUpTo = index + next.length;
        }

        @Override
        public SourceMessage next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Message message = messages[index];
            messages[index++] = null;
            try {
                String uid = String.valueOf(((UIDFolder) folder).getUID(message));
                MimeMessage mime = (MimeMessage) message;
                Date sent = message.getSentDate();
                Date received = message.getReceivedDate();
                return new SourceMessage(uid, mime.getMessageID(), mime.getSubject(),
                    sent != null ? sent.toInstant() : null,
                    received != null ? received.toInstant() : null,
                    () -> copy(mime));
            } catch (MessagingException e) {
                throw MailSourceException.fromMessaging("Cannot read envelope", e);
            } catch (RuntimeException e) {
                throw new MailSourceException("Cannot read envelope: " + e.getMessage(), e, false);
            }
        }

        private static MimeMessage copy(MimeMessage message) {
            try {
                // The copy constructor pulls the whole message once instead of part by part
                return new MimeMessage(message);
            } catch (MessagingException e) {
                throw MailSourceException.fromMessaging("Cannot download message", e);
            }
        }

        @Override
        public void close() {
            // the folder stays open in the session for deletions
        }
    }
}
