package mail.archiver.app.service;

import mail.archiver.app.config.ArchiverProperties;
import mail.archiver.app.dto.ImportRequest;
import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.entity.ProviderType;
import mail.archiver.app.job.BackgroundJob;
import mail.archiver.app.job.BatchRestoreJob;
import mail.archiver.app.job.ImportFormat;
import mail.archiver.app.job.ImportJob;
import mail.archiver.app.job.SyncJob;
import mail.archiver.app.repository.MailAccountRepository;
import mail.archiver.app.service.source.MailSourceAdapter;
import mail.archiver.app.service.source.MailSourceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobSubmissionServiceTest {

    @Mock
    private JobQueueService jobQueueService;

    @Mock
    private MailAccountRepository mailAccountRepository;

    @Mock
    private MailSourceRegistry mailSourceRegistry;

    @Mock
    private BatchRestoreService batchRestoreService;

    @TempDir
    Path uploads;

    private ArchiverProperties properties;
    private JobSubmissionService jobSubmissionService;
    private MailAccount imap;

    @BeforeEach
    void setUp() {
        properties = TestSupport.noDelayProperties();
        properties.getImports().setUploadsPath(uploads.toString());
        properties.getBatch().setAsyncThreshold(3);
        properties.getBatch().setMaxAsyncEmails(10);
        imap = TestSupport.account(1L, ProviderType.IMAP);

        jobSubmissionService = new JobSubmissionService(jobQueueService, mailAccountRepository, mailSourceRegistry,
            batchRestoreService, properties);
    }

    private static List<Long> ids(int count) {
        return LongStream.rangeClosed(1, count).boxed().collect(Collectors.toList());
    }

    @Test
    void startSync_ShouldQueueSyncJob() {
        // Given
        when(mailAccountRepository.findById(1L)).thenReturn(Optional.of(imap));
        when(jobQueueService.getActiveJobs()).thenReturn(List.of());
        when(jobQueueService.enqueue(any(BackgroundJob.class))).thenReturn("job-1");

        // When
        String jobId = jobSubmissionService.startSync(1L, true, Set.of(1L), "alice");

        // Then
        assertEquals("job-1", jobId);
        ArgumentCaptor<BackgroundJob> queued = ArgumentCaptor.forClass(BackgroundJob.class);
        verify(jobQueueService).enqueue(queued.capture());
        SyncJob job = (SyncJob) queued.getValue();
        assertEquals(1L, job.getAccountId());
        assertTrue(job.isFullSync());
        assertEquals("alice", job.getRequestedBy());
    }

    @Test
    void startSync_AlreadyActive_ShouldBeRejected() {
        // Given
        when(mailAccountRepository.findById(1L)).thenReturn(Optional.of(imap));
        when(jobQueueService.getActiveJobs()).thenReturn(List.of(new SyncJob(1L, imap.getName(), false)));

        // When / Then
        assertThrows(JobAdmissionException.class, () -> jobSubmissionService.startSync(1L, false, null, "alice"));
        verify(jobQueueService, never()).enqueue(any());
    }

    @Test
    void startSync_DisabledAccount_ShouldBeRejected() {
        // Given
        imap.setEnabled(false);
        when(mailAccountRepository.findById(1L)).thenReturn(Optional.of(imap));

        // When / Then
        assertThrows(JobAdmissionException.class, () -> jobSubmissionService.startSync(1L, false, null, "alice"));
    }

    @Test
    void startSync_ImportOnlyAccount_ShouldBeRejected() {
        // Given
        MailAccount imported = TestSupport.account(4L, ProviderType.IMPORT);
        when(mailAccountRepository.findById(4L)).thenReturn(Optional.of(imported));

        // When / Then
        assertThrows(JobAdmissionException.class, () -> jobSubmissionService.startSync(4L, false, null, "alice"));
    }

    @Test
    void startSync_AccountNotAllowed_ShouldBeDenied() {
        // When / Then
        AccountAccessDeniedException e = assertThrows(AccountAccessDeniedException.class,
            () -> jobSubmissionService.startSync(1L, false, Set.of(2L), "alice"));
        assertEquals(1L, e.getAccountId());
        verifyNoInteractions(mailAccountRepository);
    }

    @Test
    void startSync_UnknownAccount_ShouldBeRejected() {
        // Given
        when(mailAccountRepository.findById(9L)).thenReturn(Optional.empty());

        // When / Then
        assertThrows(JobAdmissionException.class, () -> jobSubmissionService.startSync(9L, false, null, "alice"));
    }

    @Test
    void startImport_ShouldQueueImportJobWithDefaults() throws Exception {
        // Given
        Path upload = uploads.resolve("export.mbox");
        Files.write(upload, "From a\n".getBytes(StandardCharsets.UTF_8));
        MailAccount target = TestSupport.account(5L, ProviderType.IMPORT);
        when(mailAccountRepository.findById(5L)).thenReturn(Optional.of(target));
        when(jobQueueService.enqueue(any(BackgroundJob.class))).thenReturn("job-2");
        ImportRequest request = new ImportRequest();
        request.setAccountId(5L);
        request.setFilePath(upload.toString());

        // When
        String jobId = jobSubmissionService.startImport(request, null, "alice");

        // Then
        assertEquals("job-2", jobId);
        ArgumentCaptor<BackgroundJob> queued = ArgumentCaptor.forClass(BackgroundJob.class);
        verify(jobQueueService).enqueue(queued.capture());
        ImportJob job = (ImportJob) queued.getValue();
        assertEquals("export.mbox", job.getFileName());
        assertEquals(ImportFormat.MBOX, job.getFormat());
        assertEquals("INBOX", job.getDefaultFolder());
        assertEquals(7L, job.getFileSize());
    }

    @Test
    void startImport_FileOutsideUploads_ShouldBeRejected() throws Exception {
        // Given
        Path outside = Files.createTempFile("outside", ".zip");
        ImportRequest request = new ImportRequest();
        request.setAccountId(5L);
        request.setFilePath(outside.toString());

        try {
            // When / Then
            assertThrows(JobAdmissionException.class, () -> jobSubmissionService.startImport(request, null, "alice"));
            verifyNoInteractions(jobQueueService);
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void startImport_MissingFile_ShouldBeRejected() {
        // Given
        ImportRequest request = new ImportRequest();
        request.setAccountId(5L);
        request.setFilePath(uploads.resolve("gone.zip").toString());

        // When / Then
        assertThrows(JobAdmissionException.class, () -> jobSubmissionService.startImport(request, null, "alice"));
    }

    @Test
    void startBatchRestore_SmallSelection_ShouldRunInline() {
        // Given
        when(mailAccountRepository.findById(1L)).thenReturn(Optional.of(imap));
        when(batchRestoreService.restoreInline(ids(3), 1L, "INBOX", null)).thenReturn(new RestoreResult(2, 1));

        // When
        RestoreSubmission submission = jobSubmissionService.startBatchRestore(ids(3), 1L, " ", null, "alice");

        // Then
        assertFalse(submission.isQueued());
        assertEquals(2, submission.getResult().getSucceeded());
        assertEquals(1, submission.getResult().getFailed());
        verify(jobQueueService, never()).enqueue(any());
    }

    @Test
    void startBatchRestore_LargeSelection_ShouldQueueJob() {
        // Given
        when(mailAccountRepository.findById(1L)).thenReturn(Optional.of(imap));
        when(jobQueueService.enqueue(any(BackgroundJob.class))).thenReturn("job-3");

        // When
        RestoreSubmission submission = jobSubmissionService.startBatchRestore(ids(4), 1L, "Restored",
            Set.of(1L), "alice");

        // Then
        assertTrue(submission.isQueued());
        assertEquals("job-3", submission.getJobId());
        ArgumentCaptor<BackgroundJob> queued = ArgumentCaptor.forClass(BackgroundJob.class);
        verify(jobQueueService).enqueue(queued.capture());
        BatchRestoreJob job = (BatchRestoreJob) queued.getValue();
        assertEquals(4, job.getTotal());
        assertEquals("Restored", job.getTargetFolder());
        assertEquals(Set.of(1L), job.getAllowedAccountIds());
        verifyNoInteractions(batchRestoreService);
    }

    @Test
    void startBatchRestore_EmptyOrTooLarge_ShouldBeRejected() {
        assertThrows(JobAdmissionException.class,
            () -> jobSubmissionService.startBatchRestore(List.of(), 1L, "INBOX", null, "alice"));
        assertThrows(JobAdmissionException.class,
            () -> jobSubmissionService.startBatchRestore(ids(11), 1L, "INBOX", null, "alice"));
        verifyNoInteractions(mailAccountRepository, jobQueueService, batchRestoreService);
    }

    @Test
    void startBatchRestore_ImportOnlyTarget_ShouldBeRejected() {
        // Given
        MailAccount imported = TestSupport.account(4L, ProviderType.IMPORT);
        when(mailAccountRepository.findById(4L)).thenReturn(Optional.of(imported));

        // When / Then
        assertThrows(JobAdmissionException.class,
            () -> jobSubmissionService.startBatchRestore(ids(2), 4L, "INBOX", null, "alice"));
    }

    @Test
    void listFolders_ShouldAskProvider() {
        // Given
        MailSourceAdapter adapter = mock(MailSourceAdapter.class);
        when(mailAccountRepository.findById(1L)).thenReturn(Optional.of(imap));
        when(mailSourceRegistry.forAccount(imap)).thenReturn(adapter);
        when(adapter.listFolders(imap)).thenReturn(List.of("INBOX", "Sent"));

        // When
        List<String> folders = jobSubmissionService.listFolders(1L, null);

        // Then
        assertEquals(List.of("INBOX", "Sent"), folders);
    }

    @Test
    void scheduleSyncs_ShouldSkipAccountsWithActiveSync() {
        // Given
        MailAccount graph = TestSupport.account(2L, ProviderType.M365);
        when(mailAccountRepository.findByEnabledTrueAndProviderNot(ProviderType.IMPORT)).thenReturn(List.of(imap, graph));
        when(jobQueueService.getActiveJobs()).thenReturn(List.of(new SyncJob(1L, imap.getName(), false)));
        when(jobQueueService.enqueue(any(BackgroundJob.class))).thenReturn("job-4");

        // When
        jobSubmissionService.scheduleSyncs();

        // Then
        ArgumentCaptor<BackgroundJob> queued = ArgumentCaptor.forClass(BackgroundJob.class);
        verify(jobQueueService, times(1)).enqueue(queued.capture());
        SyncJob job = (SyncJob) queued.getValue();
        assertEquals(2L, job.getAccountId());
        assertEquals("scheduler", job.getRequestedBy());
    }
}
