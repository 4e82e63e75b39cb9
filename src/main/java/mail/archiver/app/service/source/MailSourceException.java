package mail.archiver.app.service.source;

import jakarta.mail.FolderClosedException;
import jakarta.mail.MessagingException;
import jakarta.mail.StoreClosedException;

import java.io.IOException;

/**
 * Failure talking to a mail provider. Transient failures (connection loss, throttling,
 * server errors) may succeed when retried; the others will not.
 */
public class MailSourceException extends RuntimeException {
    private final boolean transientFailure;

    public MailSourceException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public MailSourceException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    static MailSourceException fromMessaging(String context, MessagingException e) {
        boolean connectionLost = e instanceof FolderClosedException
            || e instanceof StoreClosedException
            || e.getCause() instanceof IOException;
        return new MailSourceException(context + ": " + e.getMessage(), e, connectionLost);
    }
}
