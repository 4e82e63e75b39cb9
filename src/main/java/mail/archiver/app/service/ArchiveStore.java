package mail.archiver.app.service;

import mail.archiver.app.entity.ArchivedEmail;

import java.util.Optional;

/**
 * Durable storage of archived emails, deduplicated by (account, message id).
 */
public interface ArchiveStore {

    enum SaveOutcome {
        ARCHIVED,
        ALREADY_EXISTS
    }

    boolean exists(Long accountId, String messageId);

    /**
     * Persists the email with its attachments. A concurrent or repeated insert of the
     * same (account, message id) pair yields {@link SaveOutcome#ALREADY_EXISTS}.
     */
    SaveOutcome save(ArchivedEmail email);

    Optional<ArchivedEmail> findWithAttachments(Long emailId);
}
