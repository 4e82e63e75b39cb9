package mail.archiver.app.service.source;

import jakarta.mail.internet.MimeMessage;

import java.time.Instant;
import java.util.List;

/**
 * An open connection to one account's mailbox.
 */
public interface MailSourceSession extends AutoCloseable {

    List<String> listFolders();

    /**
     * @param since only messages received at or after this instant; null for all
     */
    MessageStream fetchMessages(String folder, Instant since);

    /**
     * Permanently removes the message from the provider.
     * @throws UnsupportedOperationException if the provider cannot delete messages
     */
    void deleteMessage(String folder, SourceMessage message);

    /**
     * Appends the message to the folder, creating the folder when missing.
     * @return true once the provider accepted the message
     */
    boolean pushMessage(String folder, MimeMessage message);

    @Override
    void close();
}
