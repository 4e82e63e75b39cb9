package mail.archiver.app.service;

import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.config.ArchiverProperties;
import mail.archiver.app.entity.ArchivedEmail;
import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.entity.RetentionPolicy;
import mail.archiver.app.job.CancellationToken;
import mail.archiver.app.job.JobCancelledException;
import mail.archiver.app.job.JobHandler;
import mail.archiver.app.job.JobType;
import mail.archiver.app.job.SyncJob;
import mail.archiver.app.repository.MailAccountRepository;
import mail.archiver.app.service.content.EmailContentService;
import mail.archiver.app.service.source.MailSourceAdapter;
import mail.archiver.app.service.source.MailSourceException;
import mail.archiver.app.service.source.MailSourceRegistry;
import mail.archiver.app.service.source.MailSourceSession;
import mail.archiver.app.service.source.MessageStream;
import mail.archiver.app.service.source.SourceMessage;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Pulls new messages of one account into the archive. Messages already archived are
 * skipped, so a pass can be repeated safely; the account's sync cursor only moves
 * forward after a complete, uncancelled pass.
 */
@Slf4j
@Service
public class MailSyncService implements JobHandler<SyncJob> {
    private final MailAccountRepository mailAccountRepository;
    private final MailSourceRegistry mailSourceRegistry;
    private final ArchiveStore archiveStore;
    private final EmailContentService emailContentService;
    private final AccountLockService accountLockService;
    private final MailSourceRetry retry;
    private final ArchiverProperties.Batch throttle;

    public MailSyncService(MailAccountRepository mailAccountRepository,
                           MailSourceRegistry mailSourceRegistry,
                           ArchiveStore archiveStore,
                           EmailContentService emailContentService,
                           AccountLockService accountLockService,
                           MailSourceRetry retry,
                           ArchiverProperties properties) {
        this.mailAccountRepository = mailAccountRepository;
        this.mailSourceRegistry = mailSourceRegistry;
        this.archiveStore = archiveStore;
        this.emailContentService = emailContentService;
        this.accountLockService = accountLockService;
        this.retry = retry;
        this.throttle = properties.getBatch();
    }

    @Override
    public JobType getJobType() {
        return JobType.SYNC;
    }

    @Override
    public Class<SyncJob> getJobClass() {
        return SyncJob.class;
    }

    @Override
    public void execute(SyncJob job, CancellationToken cancellationToken) {
        MailAccount account = mailAccountRepository.findById(job.getAccountId())
            .orElseThrow(() -> new IllegalStateException("Mail account " + job.getAccountId() + " not found"));
        if (!account.isEnabled()) {
            throw new IllegalStateException("Mail account " + account.getName() + " is disabled");
        }
        MailSourceAdapter adapter = mailSourceRegistry.forAccount(account);

        if (!accountLockService.tryLock(account.getId())) {
            throw new IllegalStateException("Mail account " + account.getName() + " is already being synchronized");
        }
        try {
            syncAccount(job, account, adapter, cancellationToken);
        } finally {
            accountLockService.releaseLock(account.getId());
        }
    }

    private void syncAccount(SyncJob job, MailAccount account, MailSourceAdapter adapter,
                             CancellationToken cancellationToken) {
        Instant passStart = Instant.now();
        Instant since = job.isFullSync() ? null : account.getLastSync();
        log.info("Syncing account {} {}", account.getName(), since == null ? "(all messages)" : "since " + since);

        boolean allFoldersRead = true;
        try (MailSourceSession session = retry.call("connect to " + account.getName(), () -> adapter.open(account))) {
            List<String> folders = retry.call("list folders of " + account.getName(), session::listFolders);
            Set<String> excluded = account.getExcludedFolderSet();

            for (String folder : folders) {
                if (excluded.contains(folder)) {
                    log.debug("Skipping excluded folder {} of {}", folder, account.getName());
                    continue;
                }
                cancellationToken.throwIfCancellationRequested();
                try {
                    syncFolder(job, account, session, folder, since, cancellationToken);
                } catch (MailSourceException e) {
                    allFoldersRead = false;
                    job.recordFolderError();
                    log.error("Failed to read folder {} of account {}: {}", folder, account.getName(), e.getMessage(), e);
                }
            }
        }

        if (cancellationToken.isCancellationRequested()) {
            log.info("Sync of {} cancelled, sync cursor left at {}", account.getName(), account.getLastSync());
            return;
        }
        if (!allFoldersRead) {
            log.warn("Sync of {} could not read {} folders, sync cursor left at {}",
                account.getName(), job.getFolderErrors(), account.getLastSync());
            return;
        }
        account.setLastSync(passStart);
        mailAccountRepository.save(account);
        log.info("Synced account {}. New: {}, Existing: {}, Failed: {}, Deleted by retention: {}",
            account.getName(), job.getSucceeded(), job.getSkipped(), job.getFailed(), job.getDeletedCount());
    }

    private void syncFolder(SyncJob job, MailAccount account, MailSourceSession session, String folder,
                            Instant since, CancellationToken cancellationToken) {
        try (MessageStream messages = retry.call("read folder " + folder, () -> session.fetchMessages(folder, since))) {
            boolean sizeKnown = messages.size() >= 0;
            if (sizeKnown) {
                job.addToTotal(messages.size());
            }
            int count = 0;
            while (true) {
                cancellationToken.throwIfCancellationRequested();
                // may load the next page from the provider
                if (!retry.call("list messages of " + folder, messages::hasNext)) {
                    break;
                }
                SourceMessage message;
                try {
                    message = messages.next();
                } catch (MailSourceException e) {
                    // the stream has moved past the unreadable message
                    message = null;
                    job.recordFailure();
                    log.error("Failed to read a message envelope in {} of {}: {}", folder, account.getName(), e.getMessage(), e);
                }
                if (!sizeKnown) {
                    job.addToTotal(1);
                }
                if (message != null) {
                    processMessage(job, account, session, folder, message);
                }

                count++;
                retry.pause(throttle.getPauseBetweenEmailsMs());
                if (count % throttle.getBatchSize() == 0) {
                    retry.pause(throttle.getPauseBetweenBatchesMs());
                }
            }
            log.debug("Folder {} of {}: {} messages checked", folder, account.getName(), count);
        }
    }

    private void processMessage(SyncJob job, MailAccount account, MailSourceSession session, String folder,
                                SourceMessage message) {
        job.setCurrentItem(message.getSubject() != null ? message.getSubject() : folder);
        String messageId = dedupKey(account, folder, message);
        try {
            if (archiveStore.exists(account.getId(), messageId)) {
                job.recordSkipped();
            } else {
                MimeMessage mime = retry.call("download " + messageId, message::loadMime);
                ArchivedEmail email = emailContentService.normalize(mime, account, folder, messageId);
                if (archiveStore.save(email) == ArchiveStore.SaveOutcome.ARCHIVED) {
                    job.recordSuccess();
                } else {
                    job.recordSkipped();
                }
            }
        } catch (JobCancelledException e) {
            throw e;
        } catch (Exception e) {
            job.recordFailure();
            log.error("Failed to archive message {} from {} of {}: {}", messageId, folder, account.getName(), e.getMessage(), e);
            return;
        }
        // Reached only once the archive holds the message
        applyRetention(job, account, session, folder, message);
    }

    private void applyRetention(SyncJob job, MailAccount account, MailSourceSession session, String folder,
                                SourceMessage message) {
        RetentionPolicy retention = account.getRetention();
        Instant sent = message.getSentDate() != null ? message.getSentDate() : message.getReceivedDate();
        if (retention == null || !retention.isExpired(sent, Instant.now())) {
            return;
        }
        try {
            retry.run("delete " + message.getProviderRef(), () -> session.deleteMessage(folder, message));
            job.recordDeletion();
            log.debug("Retention: deleted message {} from {} of {}", message.getProviderRef(), folder, account.getName());
        } catch (UnsupportedOperationException e) {
            log.warn("Retention: provider of {} cannot delete messages: {}", account.getName(), e.getMessage());
        } catch (JobCancelledException e) {
            throw e;
        } catch (Exception e) {
            log.error("Retention: failed to delete message {} from {} of {}: {}",
                message.getProviderRef(), folder, account.getName(), e.getMessage(), e);
        }
    }

    private String dedupKey(MailAccount account, String folder, SourceMessage message) {
        if (message.getMessageId() != null && !message.getMessageId().isBlank()) {
            return emailContentService.cleanText(message.getMessageId().trim());
        }
        return "sync-" + account.getId() + "-" + folder + "-" + message.getProviderRef();
    }
}
