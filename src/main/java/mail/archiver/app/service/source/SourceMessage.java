package mail.archiver.app.service.source;

import jakarta.mail.internet.MimeMessage;
import lombok.Getter;

import java.time.Instant;

/**
 * A message listed by a provider. Only envelope data is held; the full MIME content is
 * fetched on demand through {@link #loadMime()}.
 */
@Getter
public class SourceMessage {
    // Provider-side identifier: IMAP UID or Graph message id
    private final String providerRef;
    private final String messageId;
    private final String subject;
    private final Instant sentDate;
    private final Instant receivedDate;
    @Getter(lombok.AccessLevel.NONE)
    private final MimeLoader loader;

    @FunctionalInterface
    public interface MimeLoader {
        MimeMessage load();
    }

    public SourceMessage(String providerRef, String messageId, String subject, Instant sentDate,
                         Instant receivedDate, MimeLoader loader) {
        this.providerRef = providerRef;
        this.messageId = messageId;
        this.subject = subject;
        this.sentDate = sentDate;
        this.receivedDate = receivedDate;
        this.loader = loader;
    }

    /**
     * @throws MailSourceException if the provider cannot deliver the message
     */
    public MimeMessage loadMime() {
        return loader.load();
    }
}
