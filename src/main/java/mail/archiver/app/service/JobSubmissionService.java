package mail.archiver.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.config.ArchiverProperties;
import mail.archiver.app.dto.ImportRequest;
import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.entity.ProviderType;
import mail.archiver.app.job.BackgroundJob;
import mail.archiver.app.job.BatchRestoreJob;
import mail.archiver.app.job.ImportFormat;
import mail.archiver.app.job.ImportJob;
import mail.archiver.app.job.JobType;
import mail.archiver.app.job.SyncJob;
import mail.archiver.app.repository.MailAccountRepository;
import mail.archiver.app.service.source.MailSourceRegistry;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for starting jobs. Validates requests against the account store and the
 * caller's allowed accounts before anything reaches the queue.
 */
@Slf4j
@Service
public class JobSubmissionService {
    private static final String DEFAULT_RESTORE_FOLDER = "INBOX";

    private final JobQueueService jobQueueService;
    private final MailAccountRepository mailAccountRepository;
    private final MailSourceRegistry mailSourceRegistry;
    private final BatchRestoreService batchRestoreService;
    private final ArchiverProperties properties;

    public JobSubmissionService(JobQueueService jobQueueService,
                                MailAccountRepository mailAccountRepository,
                                MailSourceRegistry mailSourceRegistry,
                                BatchRestoreService batchRestoreService,
                                ArchiverProperties properties) {
        this.jobQueueService = jobQueueService;
        this.mailAccountRepository = mailAccountRepository;
        this.mailSourceRegistry = mailSourceRegistry;
        this.batchRestoreService = batchRestoreService;
        this.properties = properties;
    }

    /**
     * @param allowedAccountIds accounts the caller may use, null for all
     */
    public synchronized String startSync(Long accountId, boolean fullSync, Set<Long> allowedAccountIds, String requestedBy) {
        MailAccount account = requireAccount(accountId, allowedAccountIds);
        if (!account.isEnabled()) {
            throw new JobAdmissionException("Mail account " + account.getName() + " is disabled");
        }
        if (account.getProvider() == ProviderType.IMPORT) {
            throw new JobAdmissionException("Mail account " + account.getName() + " is import-only and cannot be synchronized");
        }
        if (hasActiveSync(account.getId())) {
            throw new JobAdmissionException("A sync of mail account " + account.getName() + " is already queued or running");
        }
        return enqueueSync(account, fullSync, requestedBy);
    }

    public String startImport(ImportRequest request, Set<Long> allowedAccountIds, String requestedBy) {
        if (request.getFilePath() == null || request.getFilePath().isBlank()) {
            throw new JobAdmissionException("No uploaded file given");
        }
        Path path = Paths.get(request.getFilePath()).toAbsolutePath().normalize();
        Path uploads = Paths.get(properties.getImports().getUploadsPath()).toAbsolutePath().normalize();
        if (!path.startsWith(uploads)) {
            throw new JobAdmissionException("Uploaded file must be inside " + uploads);
        }
        if (!Files.isRegularFile(path)) {
            throw new JobAdmissionException("Uploaded file not found: " + path.getFileName());
        }
        MailAccount account = requireAccount(request.getAccountId(), allowedAccountIds);

        String fileName = request.getFileName() != null && !request.getFileName().isBlank()
            ? request.getFileName()
            : path.getFileName().toString();
        String folder = request.getFolder() != null && !request.getFolder().isBlank()
            ? request.getFolder()
            : properties.getImports().getDefaultFolder();
        long fileSize = request.getFileSize();
        if (fileSize <= 0) {
            try {
                fileSize = Files.size(path);
            } catch (IOException e) {
                throw new JobAdmissionException("Cannot read uploaded file " + fileName + ": " + e.getMessage());
            }
        }

        ImportJob job = new ImportJob(account.getId(), path, fileName, fileSize, folder, ImportFormat.fromFileName(fileName));
        job.setRequestedBy(requestedBy);
        return jobQueueService.enqueue(job);
    }

    /**
     * Small selections are restored right away, larger ones run as a background job.
     */
    public RestoreSubmission startBatchRestore(List<Long> emailIds, Long targetAccountId, String targetFolder,
                                               Set<Long> allowedAccountIds, String requestedBy) {
        if (emailIds == null || emailIds.isEmpty()) {
            throw new JobAdmissionException("No emails selected for restore");
        }
        ArchiverProperties.Batch batch = properties.getBatch();
        if (emailIds.size() > batch.getMaxAsyncEmails()) {
            throw new JobAdmissionException("Too many emails selected (" + emailIds.size()
                + "), at most " + batch.getMaxAsyncEmails() + " can be restored at once");
        }
        MailAccount target = requireAccount(targetAccountId, allowedAccountIds);
        if (target.getProvider() == ProviderType.IMPORT) {
            throw new JobAdmissionException("Cannot restore into import-only account " + target.getName());
        }
        String folder = targetFolder != null && !targetFolder.isBlank() ? targetFolder : DEFAULT_RESTORE_FOLDER;

        if (emailIds.size() > batch.getAsyncThreshold()) {
            BatchRestoreJob job = new BatchRestoreJob(emailIds, target.getId(), folder, allowedAccountIds);
            job.setRequestedBy(requestedBy);
            return RestoreSubmission.queued(jobQueueService.enqueue(job));
        }
        return RestoreSubmission.completed(
            batchRestoreService.restoreInline(emailIds, target.getId(), folder, allowedAccountIds));
    }

    public List<String> listFolders(Long accountId, Set<Long> allowedAccountIds) {
        MailAccount account = requireAccount(accountId, allowedAccountIds);
        if (account.getProvider() == ProviderType.IMPORT) {
            throw new JobAdmissionException("Mail account " + account.getName() + " has no remote folders");
        }
        return mailSourceRegistry.forAccount(account).listFolders(account);
    }

    /**
     * Queues a sync of every enabled remote account that is not already being synchronized.
     */
    @Scheduled(fixedRateString = "${archiver.sync.interval-minutes:15}",
        initialDelayString = "${archiver.sync.interval-minutes:15}", timeUnit = TimeUnit.MINUTES)
    public synchronized void scheduleSyncs() {
        int queued = 0;
        for (MailAccount account : mailAccountRepository.findByEnabledTrueAndProviderNot(ProviderType.IMPORT)) {
            if (hasActiveSync(account.getId())) {
                log.debug("Sync of {} still active, not queuing another", account.getName());
                continue;
            }
            enqueueSync(account, false, "scheduler");
            queued++;
        }
        if (queued > 0) {
            log.info("Scheduled sync for {} accounts", queued);
        }
    }

    private String enqueueSync(MailAccount account, boolean fullSync, String requestedBy) {
        SyncJob job = new SyncJob(account.getId(), account.getName(), fullSync);
        job.setRequestedBy(requestedBy);
        return jobQueueService.enqueue(job);
    }

    private boolean hasActiveSync(Long accountId) {
        for (BackgroundJob job : jobQueueService.getActiveJobs()) {
            if (job.getType() == JobType.SYNC && Objects.equals(((SyncJob) job).getAccountId(), accountId)) {
                return true;
            }
        }
        return false;
    }

    private MailAccount requireAccount(Long accountId, Set<Long> allowedAccountIds) {
        if (accountId == null) {
            throw new JobAdmissionException("No mail account given");
        }
        if (allowedAccountIds != null && !allowedAccountIds.contains(accountId)) {
            throw new AccountAccessDeniedException(accountId);
        }
        return mailAccountRepository.findById(accountId)
            .orElseThrow(() -> new JobAdmissionException("Mail account " + accountId + " not found"));
    }
}
