package mail.archiver.app.service.source;

import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessageRemovedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.ReceivedDateTerm;
import jakarta.mail.search.SearchTerm;
import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.entity.ProviderType;
import mail.archiver.app.service.content.MimeSupport;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImapMailSourceTest {

    @Mock
    private Store store;

    private Folder inbox;
    private MailAccount account;
    private ImapMailSource.ImapSession session;

    @BeforeEach
    void setUp() {
        account = new MailAccount();
        account.setId(1L);
        account.setName("imap");
        account.setProvider(ProviderType.IMAP);
        inbox = mock(Folder.class, withSettings().extraInterfaces(UIDFolder.class));
        session = new ImapMailSource.ImapSession(account, store, 2);
    }

    @Test
    void listFolders_ShouldOnlyReturnFoldersHoldingMessages() throws Exception {
        // Given
        Folder root = mock(Folder.class);
        Folder container = mock(Folder.class);
        when(store.getDefaultFolder()).thenReturn(root);
        when(root.list("*")).thenReturn(new Folder[]{inbox, container});
        when(inbox.getType()).thenReturn(Folder.HOLDS_MESSAGES | Folder.HOLDS_FOLDERS);
        when(inbox.getFullName()).thenReturn("INBOX");
        when(container.getType()).thenReturn(Folder.HOLDS_FOLDERS);

        // When
        List<String> folders = session.listFolders();

        // Then
        assertEquals(List.of("INBOX"), folders);
    }

    @Test
    void fetchMessages_Incremental_ShouldSearchByReceivedDate() throws Exception {
        // Given
        Instant since = Instant.parse("2024-03-01T00:00:00Z");
        Date sent = Date.from(Instant.parse("2024-03-02T09:00:00Z"));
        MimeMessage message = mock(MimeMessage.class);
        when(store.getFolder("INBOX")).thenReturn(inbox);
        when(inbox.search(any(SearchTerm.class))).thenReturn(new Message[]{message});
        when(((UIDFolder) inbox).getUID(message)).thenReturn(42L);
        when(message.getMessageID()).thenReturn("<a@example.com>");
        when(message.getSubject()).thenReturn("Hello");
        when(message.getSentDate()).thenReturn(sent);

        // When
        MessageStream stream = session.fetchMessages("INBOX", since);
        SourceMessage first = stream.next();

        // Then
        verify(inbox).open(Folder.READ_WRITE);
        ArgumentCaptor<SearchTerm> term = ArgumentCaptor.forClass(SearchTerm.class);
        verify(inbox).search(term.capture());
        ReceivedDateTerm received = (ReceivedDateTerm) term.getValue();
        assertEquals(ComparisonTerm.GE, received.getComparison());
        assertEquals(Date.from(since), received.getDate());
        verify(inbox).fetch(any(Message[].class), any());

        assertEquals(1, stream.size());
        assertEquals("42", first.getProviderRef());
        assertEquals("<a@example.com>", first.getMessageId());
        assertEquals(sent.toInstant(), first.getSentDate());
        assertNull(first.getReceivedDate());
        assertFalse(stream.hasNext());
    }

    @Test
    void fetchMessages_FullPass_ShouldReadWholeFolder() throws Exception {
        // Given
        when(store.getFolder("INBOX")).thenReturn(inbox);
        when(inbox.getMessages()).thenReturn(new Message[0]);

        // When
        MessageStream stream = session.fetchMessages("INBOX", null);

        // Then
        assertEquals(0, stream.size());
        assertFalse(stream.hasNext());
        verify(inbox, never()).search(any(SearchTerm.class));
    }

    @Test
    void fetchMessages_ConnectionLost_ShouldBeTransient() throws Exception {
        // Given
        when(store.getFolder("INBOX")).thenReturn(inbox);
        doThrow(new MessagingException("socket closed", new IOException("reset")))
            .when(inbox).open(Folder.READ_WRITE);

        // When
        MailSourceException e = assertThrows(MailSourceException.class,
            () -> session.fetchMessages("INBOX", null));

        // Then
        assertTrue(e.isTransient());
    }

    @Test
    void deleteMessage_WithoutUidPlus_ShouldBeUnsupported() throws Exception {
        // Given
        SourceMessage message = new SourceMessage("42", "<a@example.com>", "Hello", null, null, () -> null);

        // When / Then
        assertThrows(UnsupportedOperationException.class, () -> session.deleteMessage("INBOX", message));
        verify(store, never()).getFolder(any(String.class));
        verify(inbox, never()).expunge();
    }

    @Test
    void deleteMessage_WithUidPlus_ShouldExpungeOnlyThatMessage() throws Exception {
        // Given
        IMAPStore imapStore = mock(IMAPStore.class);
        IMAPFolder folder = mock(IMAPFolder.class);
        Message target = mock(Message.class);
        when(imapStore.hasCapability("UIDPLUS")).thenReturn(true);
        when(imapStore.getFolder("INBOX")).thenReturn(folder);
        when(folder.getMessageByUID(42L)).thenReturn(target);
        ImapMailSource.ImapSession uidPlusSession = new ImapMailSource.ImapSession(account, imapStore, 2);
        SourceMessage message = new SourceMessage("42", "<a@example.com>", "Hello", null, null, () -> null);

        // When
        uidPlusSession.deleteMessage("INBOX", message);

        // Then
        verify(target).setFlag(Flags.Flag.DELETED, true);
        verify(folder).expunge(new Message[]{target});
        verify(folder, never()).expunge();
    }

    @Test
    void deleteMessage_AlreadyGone_ShouldDoNothing() throws Exception {
        // Given
        IMAPStore imapStore = mock(IMAPStore.class);
        IMAPFolder folder = mock(IMAPFolder.class);
        when(imapStore.hasCapability("UIDPLUS")).thenReturn(true);
        when(imapStore.getFolder("INBOX")).thenReturn(folder);
        when(folder.getMessageByUID(42L)).thenReturn(null);
        ImapMailSource.ImapSession uidPlusSession = new ImapMailSource.ImapSession(account, imapStore, 2);
        SourceMessage message = new SourceMessage("42", "<a@example.com>", "Hello", null, null, () -> null);

        // When
        uidPlusSession.deleteMessage("INBOX", message);

        // Then
        verify(folder, never()).expunge(any(Message[].class));
    }

    @Test
    void fetchMessages_ShouldFetchEnvelopesWindowByWindow() throws Exception {
        // Given
        MimeMessage first = mock(MimeMessage.class);
        MimeMessage second = mock(MimeMessage.class);
        MimeMessage third = mock(MimeMessage.class);
        when(store.getFolder("INBOX")).thenReturn(inbox);
        when(inbox.getMessages()).thenReturn(new Message[]{first, second, third});
        when(((UIDFolder) inbox).getUID(first)).thenReturn(1L);
        when(((UIDFolder) inbox).getUID(second)).thenReturn(2L);
        when(((UIDFolder) inbox).getUID(third)).thenReturn(3L);

        // When
        MessageStream stream = session.fetchMessages("INBOX", null);

        // Then
        verify(inbox, never()).fetch(any(Message[].class), any());
        assertEquals("1", stream.next().getProviderRef());
        assertEquals("2", stream.next().getProviderRef());
        verify(inbox, times(1)).fetch(any(Message[].class), any());
        assertEquals("3", stream.next().getProviderRef());
        assertFalse(stream.hasNext());
        verify(inbox).fetch(argThat((Message[] window) -> window.length == 2 && window[0] == first), any());
        verify(inbox).fetch(argThat((Message[] window) -> window.length == 1 && window[0] == third), any());
    }

    @Test
    void fetchMessages_RemovedMessage_ShouldFailAndMoveOn() throws Exception {
        // Given
        MimeMessage removed = mock(MimeMessage.class);
        MimeMessage kept = mock(MimeMessage.class);
        when(store.getFolder("INBOX")).thenReturn(inbox);
        when(inbox.getMessages()).thenReturn(new Message[]{removed, kept});
        when(((UIDFolder) inbox).getUID(removed)).thenThrow(new MessageRemovedException("expunged elsewhere"));
        when(((UIDFolder) inbox).getUID(kept)).thenReturn(8L);
        MessageStream stream = session.fetchMessages("INBOX", null);

        // When
        MailSourceException e = assertThrows(MailSourceException.class, stream::next);
        SourceMessage next = stream.next();

        // Then
        assertFalse(e.isTransient());
        assertEquals("8", next.getProviderRef());
        assertFalse(stream.hasNext());
    }

    @Test
    void pushMessage_MissingFolder_ShouldCreateAndAppendAsSeen() throws Exception {
        // Given
        Folder restored = mock(Folder.class);
        when(store.getFolder("Restored")).thenReturn(restored);
        when(restored.exists()).thenReturn(false);
        when(restored.create(Folder.HOLDS_MESSAGES)).thenReturn(true);
        MimeMessage message = MimeSupport.parse(new ByteArrayInputStream(
            "Message-ID: <r@example.com>\r\nSubject: Back\r\n\r\nbody\r\n".getBytes(StandardCharsets.UTF_8)));

        // When
        boolean pushed = session.pushMessage("Restored", message);

        // Then
        assertTrue(pushed);
        assertTrue(message.isSet(Flags.Flag.SEEN));
        verify(restored).appendMessages(new Message[]{message});
    }

    @Test
    void pushMessage_FolderCannotBeCreated_ShouldFail() throws Exception {
        // Given
        Folder restored = mock(Folder.class);
        when(store.getFolder("Restored")).thenReturn(restored);
        when(restored.exists()).thenReturn(false);
        when(restored.create(Folder.HOLDS_MESSAGES)).thenReturn(false);
        MimeMessage message = MimeSupport.parse(new ByteArrayInputStream(
            "Subject: Back\r\n\r\nbody\r\n".getBytes(StandardCharsets.UTF_8)));

        // When
        MailSourceException e = assertThrows(MailSourceException.class,
            () -> session.pushMessage("Restored", message));

        // Then
        assertFalse(e.isTransient());
        verify(restored, never()).appendMessages(any());
    }

    @Test
    void close_ShouldCloseOpenFoldersAndStore() throws Exception {
        // Given
        when(store.getFolder("INBOX")).thenReturn(inbox);
        when(inbox.getMessages()).thenReturn(new Message[0]);
        session.fetchMessages("INBOX", null);
        when(inbox.isOpen()).thenReturn(true);

        // When
        session.close();

        // Then
        verify(inbox).close(false);
        verify(store).close();
    }
}
