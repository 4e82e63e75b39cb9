package mail.archiver.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.entity.ArchivedEmail;
import mail.archiver.app.repository.ArchivedEmailRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
public class JpaArchiveStore implements ArchiveStore {
    private final ArchivedEmailRepository archivedEmailRepository;

    public JpaArchiveStore(ArchivedEmailRepository archivedEmailRepository) {
        this.archivedEmailRepository = archivedEmailRepository;
    }

    @Override
    public boolean exists(Long accountId, String messageId) {
        return archivedEmailRepository.existsByMailAccountIdAndMessageId(accountId, messageId);
    }

    @Override
    public SaveOutcome save(ArchivedEmail email) {
        try {
            archivedEmailRepository.saveAndFlush(email);
            log.debug("Archived email {} for account {}", email.getMessageId(), email.getMailAccountId());
            return SaveOutcome.ARCHIVED;
        } catch (DataIntegrityViolationException e) {
            // Unique (account, message id) constraint: another writer got there first
            if (!exists(email.getMailAccountId(), email.getMessageId())) {
                throw e;
            }
            log.debug("Email {} already archived for account {}", email.getMessageId(), email.getMailAccountId());
            return SaveOutcome.ALREADY_EXISTS;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ArchivedEmail> findWithAttachments(Long emailId) {
        return archivedEmailRepository.findByIdWithAttachments(emailId);
    }
}
