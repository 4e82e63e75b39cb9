package mail.archiver.app.service;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.config.ArchiverProperties;
import mail.archiver.app.entity.ArchivedEmail;
import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.job.CancellationToken;
import mail.archiver.app.job.ImportFormat;
import mail.archiver.app.job.ImportJob;
import mail.archiver.app.job.JobCancelledException;
import mail.archiver.app.job.JobHandler;
import mail.archiver.app.job.JobType;
import mail.archiver.app.repository.MailAccountRepository;
import mail.archiver.app.service.content.EmailContentService;
import mail.archiver.app.service.content.MimeSupport;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Date;
import java.util.Enumeration;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Imports an uploaded zip of .eml files or an mbox file into an account's archive.
 * Entries are handled one at a time; a broken entry is counted as failed and the import
 * goes on. The uploaded file is deleted when the job ends, however it ends.
 */
@Slf4j
@Service
public class EmlImportService implements JobHandler<ImportJob> {
    private final MailAccountRepository mailAccountRepository;
    private final ArchiveStore archiveStore;
    private final EmailContentService emailContentService;
    private final MailSourceRetry retry;
    private final ArchiverProperties.Imports settings;
    private final long pauseMs;

    public EmlImportService(MailAccountRepository mailAccountRepository,
                            ArchiveStore archiveStore,
                            EmailContentService emailContentService,
                            MailSourceRetry retry,
                            ArchiverProperties properties) {
        this.mailAccountRepository = mailAccountRepository;
        this.archiveStore = archiveStore;
        this.emailContentService = emailContentService;
        this.retry = retry;
        this.settings = properties.getImports();
        this.pauseMs = properties.getBatch().getPauseBetweenEmailsMs();
    }

    @Override
    public JobType getJobType() {
        return JobType.IMPORT;
    }

    @Override
    public Class<ImportJob> getJobClass() {
        return ImportJob.class;
    }

    @Override
    public void execute(ImportJob job, CancellationToken cancellationToken) throws IOException {
        try {
            MailAccount account = mailAccountRepository.findById(job.getTargetAccountId())
                .orElseThrow(() -> new IllegalStateException("Target account " + job.getTargetAccountId() + " not found"));
            if (job.getFormat() == ImportFormat.MBOX) {
                importMbox(job, account, cancellationToken);
            } else {
                importZip(job, account, cancellationToken);
            }
            log.info("Import of {} into {} finished. Success: {}, Skipped: {}, Failed: {}",
                job.getFileName(), account.getName(), job.getSucceeded(), job.getSkipped(), job.getFailed());
        } finally {
            deleteUpload(job);
        }
    }

    private void importZip(ImportJob job, MailAccount account, CancellationToken cancellationToken) throws IOException {
        try (ZipFile zip = new ZipFile(job.getFilePath().toFile())) {
            job.setTotal((int) zip.stream().filter(this::isEmlEntry).count());
            log.info("Importing {} emails from {}", job.getTotal(), job.getFileName());

            long bytes = 0;
            int sequence = 0;
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (!isEmlEntry(entry)) {
                    continue;
                }
                cancellationToken.throwIfCancellationRequested();
                sequence++;
                try (InputStream in = zip.getInputStream(entry)) {
                    importMessage(job, account, in, folderFor(entry.getName(), job), sequence);
                } catch (IOException e) {
                    job.recordFailure();
                    log.error("Cannot read entry {} of {}: {}", entry.getName(), job.getFileName(), e.getMessage(), e);
                }
                if (entry.getCompressedSize() > 0) {
                    bytes += entry.getCompressedSize();
                    job.setProcessedBytes(bytes);
                }
                afterEntry(job, sequence);
            }
        }
    }

    private void importMbox(ImportJob job, MailAccount account, CancellationToken cancellationToken) throws IOException {
        job.setTotal(MboxReader.countMessages(job.getFilePath()));
        log.info("Importing {} emails from {}", job.getTotal(), job.getFileName());

        try (MboxReader reader = new MboxReader(Files.newInputStream(job.getFilePath()))) {
            int sequence = 0;
            while (true) {
                cancellationToken.throwIfCancellationRequested();
                byte[] raw = reader.nextMessage();
                if (raw == null) {
                    break;
                }
                sequence++;
                importMessage(job, account, new ByteArrayInputStream(raw), job.getDefaultFolder(), sequence);
                job.setProcessedBytes(reader.getBytesRead());
                afterEntry(job, sequence);
            }
        }
    }

    private void importMessage(ImportJob job, MailAccount account, InputStream in, String folder, int sequence) {
        String messageId = null;
        try {
            MimeMessage message = MimeSupport.parse(in);
            emailContentService.validate(message);
            messageId = emailContentService.resolveMessageId(message);
            if (messageId == null) {
                messageId = "eml-import-" + job.getJobId() + "-" + sequence + "-" + dateMillis(message);
            }
            job.setCurrentItem(message.getSubject() != null ? message.getSubject() : messageId);

            if (archiveStore.exists(account.getId(), messageId)) {
                job.recordSkipped();
                log.debug("Email {} already archived, skipping", messageId);
                return;
            }
            ArchivedEmail email = emailContentService.normalize(message, account, folder, messageId);
            if (archiveStore.save(email) == ArchiveStore.SaveOutcome.ARCHIVED) {
                job.recordSuccess();
            } else {
                job.recordSkipped();
            }
        } catch (JobCancelledException e) {
            throw e;
        } catch (Exception e) {
            job.recordFailure();
            log.error("Failed to import email {} (entry {}) of {}: {}",
                messageId != null ? messageId : "?", sequence, job.getFileName(), e.getMessage(), e);
        }
    }

    private void afterEntry(ImportJob job, int sequence) {
        if (sequence % settings.getLogEvery() == 0) {
            log.info("Import {}: {}/{} processed ({} ok, {} skipped, {} failed)", job.getJobId(),
                job.getProcessed(), job.getTotal(), job.getSucceeded(), job.getSkipped(), job.getFailed());
        }
        if (sequence % settings.getPauseEvery() == 0) {
            retry.pause(pauseMs);
        }
    }

    private boolean isEmlEntry(ZipEntry entry) {
        return !entry.isDirectory() && entry.getName().toLowerCase(Locale.ROOT).endsWith(".eml");
    }

    /**
     * The folder is the name of the directory that holds the entry, e.g. "Archive/Sent/1.eml" goes to "Sent".
     */
    static String folderFor(String entryName, ImportJob job) {
        String path = entryName.replace('\\', '/');
        int lastSlash = path.lastIndexOf('/');
        if (lastSlash <= 0) {
            return job.getDefaultFolder();
        }
        String directory = path.substring(0, lastSlash);
        String folder = directory.substring(directory.lastIndexOf('/') + 1).trim();
        return folder.isEmpty() ? job.getDefaultFolder() : folder;
    }

    private long dateMillis(MimeMessage message) {
        try {
            Date sent = message.getSentDate();
            return sent != null ? sent.getTime() : 0L;
        } catch (MessagingException e) {
            return 0L;
        }
    }

    private void deleteUpload(ImportJob job) {
        try {
            job.releaseResources();
            log.debug("Deleted uploaded file {}", job.getFilePath());
        } catch (IOException e) {
            log.warn("Could not delete uploaded file {}: {}", job.getFilePath(), e.getMessage());
        }
    }
}
