package mail.archiver.app.service;

import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.config.ArchiverProperties;
import mail.archiver.app.entity.ArchivedEmail;
import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.job.BatchRestoreJob;
import mail.archiver.app.job.CancellationToken;
import mail.archiver.app.job.JobCancelledException;
import mail.archiver.app.job.JobHandler;
import mail.archiver.app.job.JobType;
import mail.archiver.app.repository.MailAccountRepository;
import mail.archiver.app.service.content.ArchivedEmailMimeBuilder;
import mail.archiver.app.service.source.MailSourceAdapter;
import mail.archiver.app.service.source.MailSourceRegistry;
import mail.archiver.app.service.source.MailSourceSession;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Copies archived emails back into a folder of a live mailbox. Each email is rebuilt as
 * MIME and appended on its own; a failure only affects that email.
 */
@Slf4j
@Service
public class BatchRestoreService implements JobHandler<BatchRestoreJob> {
    private final MailAccountRepository mailAccountRepository;
    private final MailSourceRegistry mailSourceRegistry;
    private final ArchiveStore archiveStore;
    private final ArchivedEmailMimeBuilder mimeBuilder;
    private final MailSourceRetry retry;
    private final ArchiverProperties.Batch throttle;

    public BatchRestoreService(MailAccountRepository mailAccountRepository,
                               MailSourceRegistry mailSourceRegistry,
                               ArchiveStore archiveStore,
                               ArchivedEmailMimeBuilder mimeBuilder,
                               MailSourceRetry retry,
                               ArchiverProperties properties) {
        this.mailAccountRepository = mailAccountRepository;
        this.mailSourceRegistry = mailSourceRegistry;
        this.archiveStore = archiveStore;
        this.mimeBuilder = mimeBuilder;
        this.retry = retry;
        this.throttle = properties.getBatch();
    }

    @Override
    public JobType getJobType() {
        return JobType.BATCH_RESTORE;
    }

    @Override
    public Class<BatchRestoreJob> getJobClass() {
        return BatchRestoreJob.class;
    }

    @Override
    public void execute(BatchRestoreJob job, CancellationToken cancellationToken) {
        MailAccount target = resolveTarget(job.getTargetAccountId());
        restore(job, target, cancellationToken);
        log.info("Restore to {}/{} finished. Success: {}, Failed: {}",
            target.getName(), job.getTargetFolder(), job.getSucceeded(), job.getFailed());
    }

    /**
     * Restores a small selection on the calling thread, with the same per-email rules as the background job.
     */
    public RestoreResult restoreInline(List<Long> emailIds, Long targetAccountId, String targetFolder,
                                       Set<Long> allowedAccountIds) {
        BatchRestoreJob job = new BatchRestoreJob(emailIds, targetAccountId, targetFolder, allowedAccountIds);
        MailAccount target = resolveTarget(targetAccountId);
        restore(job, target, job.getCancellationToken());
        log.info("Restored {} of {} emails to {}/{}", job.getSucceeded(), emailIds.size(), target.getName(), targetFolder);
        return new RestoreResult(job.getSucceeded(), job.getFailed());
    }

    private MailAccount resolveTarget(Long accountId) {
        return mailAccountRepository.findById(accountId)
            .orElseThrow(() -> new IllegalStateException("Target account " + accountId + " not found"));
    }

    private void restore(BatchRestoreJob job, MailAccount target, CancellationToken cancellationToken) {
        MailSourceAdapter adapter = mailSourceRegistry.forAccount(target);
        try (MailSourceSession session = retry.call("connect to " + target.getName(), () -> adapter.open(target))) {
            int count = 0;
            for (Long emailId : job.getEmailIds()) {
                cancellationToken.throwIfCancellationRequested();
                restoreEmail(job, session, emailId);

                count++;
                retry.pause(throttle.getPauseBetweenEmailsMs());
                if (count % throttle.getBatchSize() == 0) {
                    log.debug("Restore {}: {}/{} processed", job.getJobId(), count, job.getTotal());
                    retry.pause(throttle.getPauseBetweenBatchesMs());
                }
            }
        }
    }

    private void restoreEmail(BatchRestoreJob job, MailSourceSession session, Long emailId) {
        job.setCurrentItem("Email " + emailId);
        try {
            Optional<ArchivedEmail> found = archiveStore.findWithAttachments(emailId);
            if (found.isEmpty()) {
                job.recordFailure();
                log.warn("Email {} not found in archive", emailId);
                return;
            }
            ArchivedEmail email = found.get();
            Set<Long> allowed = job.getAllowedAccountIds();
            if (allowed != null && !allowed.contains(email.getMailAccountId())) {
                job.recordFailure();
                log.warn("Email {} belongs to account {} which the requester may not access", emailId, email.getMailAccountId());
                return;
            }
            job.setCurrentItem(email.getSubject());

            MimeMessage message = mimeBuilder.build(email);
            boolean pushed = retry.call("append email " + emailId,
                () -> session.pushMessage(job.getTargetFolder(), message));
            if (pushed) {
                job.recordSuccess();
            } else {
                job.recordFailure();
                log.warn("Provider did not accept email {}", emailId);
            }
        } catch (JobCancelledException e) {
            throw e;
        } catch (Exception e) {
            job.recordFailure();
            log.error("Failed to restore email {}: {}", emailId, e.getMessage(), e);
        }
    }
}
