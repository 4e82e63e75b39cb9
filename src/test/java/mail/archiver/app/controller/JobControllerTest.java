package mail.archiver.app.controller;

import mail.archiver.app.job.SyncJob;
import mail.archiver.app.service.AccountAccessDeniedException;
import mail.archiver.app.service.AccountAccessPolicy;
import mail.archiver.app.service.JobAdmissionException;
import mail.archiver.app.service.JobQueueService;
import mail.archiver.app.service.JobSubmissionService;
import mail.archiver.app.service.RestoreResult;
import mail.archiver.app.service.RestoreSubmission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class JobControllerTest {

    @Mock
    private JobQueueService jobQueueService;

    @Mock
    private JobSubmissionService jobSubmissionService;

    private final AccountAccessPolicy accessPolicy = new AccountAccessPolicy() {
        @Override
        public Set<Long> allowedAccountIds() {
            return Set.of(1L);
        }

        @Override
        public String currentUser() {
            return "alice";
        }
    };

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
            .standaloneSetup(new JobController(jobQueueService, jobSubmissionService, accessPolicy))
            .build();
    }

    @Test
    void getJob_Known_ShouldReturnStatus() throws Exception {
        // Given
        SyncJob job = new SyncJob(1L, "work", false);
        when(jobQueueService.getJob(job.getJobId())).thenReturn(Optional.of(job));

        // When / Then
        mockMvc.perform(get("/api/jobs/{id}", job.getJobId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobId").value(job.getJobId()))
            .andExpect(jsonPath("$.type").value("SYNC"))
            .andExpect(jsonPath("$.status").value("QUEUED"))
            .andExpect(jsonPath("$.description").value("Sync of work"));
    }

    @Test
    void getJob_Unknown_ShouldReturn404() throws Exception {
        when(jobQueueService.getJob("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/jobs/missing"))
            .andExpect(status().isNotFound());
    }

    @Test
    void listJobs_ActiveOnly_ShouldUseActiveJobs() throws Exception {
        when(jobQueueService.getActiveJobs()).thenReturn(List.of(new SyncJob(1L, "work", false)));

        mockMvc.perform(get("/api/jobs").param("activeOnly", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
        verify(jobQueueService, never()).getAllJobs();
    }

    @Test
    void cancelJob_AlreadyFinished_ShouldReturnConflict() throws Exception {
        // Given
        SyncJob job = new SyncJob(1L, "work", false);
        job.markRunning();
        job.markCompleted();
        when(jobQueueService.getJob(job.getJobId())).thenReturn(Optional.of(job));
        when(jobQueueService.cancelJob(job.getJobId())).thenReturn(false);

        // When / Then
        mockMvc.perform(delete("/api/jobs/{id}", job.getJobId()))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void startSync_ShouldPassCallerAndReturnAccepted() throws Exception {
        // Given
        when(jobSubmissionService.startSync(1L, true, Set.of(1L), "alice")).thenReturn("job-1");

        // When / Then
        mockMvc.perform(post("/api/accounts/1/sync").param("full", "true"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.jobId").value("job-1"));
    }

    @Test
    void startSync_Rejected_ShouldReturnBadRequest() throws Exception {
        when(jobSubmissionService.startSync(eq(1L), anyBoolean(), any(), any()))
            .thenThrow(new JobAdmissionException("A sync of mail account work is already queued or running"));

        mockMvc.perform(post("/api/accounts/1/sync"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("A sync of mail account work is already queued or running"));
    }

    @Test
    void startSync_ForeignAccount_ShouldReturnForbidden() throws Exception {
        when(jobSubmissionService.startSync(eq(2L), anyBoolean(), any(), any()))
            .thenThrow(new AccountAccessDeniedException(2L));

        mockMvc.perform(post("/api/accounts/2/sync"))
            .andExpect(status().isForbidden());
    }

    @Test
    void startRestore_SmallSelection_ShouldReturnCounts() throws Exception {
        // Given
        when(jobSubmissionService.startBatchRestore(List.of(5L, 6L), 1L, "INBOX", Set.of(1L), "alice"))
            .thenReturn(RestoreSubmission.completed(new RestoreResult(1, 1)));

        // When / Then
        mockMvc.perform(post("/api/restores")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"emailIds\":[5,6],\"targetAccountId\":1,\"targetFolder\":\"INBOX\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.succeeded").value(1))
            .andExpect(jsonPath("$.failed").value(1));
    }

    @Test
    void startRestore_LargeSelection_ShouldReturnJobId() throws Exception {
        when(jobSubmissionService.startBatchRestore(anyList(), eq(1L), any(), any(), any()))
            .thenReturn(RestoreSubmission.queued("job-9"));

        mockMvc.perform(post("/api/restores")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"emailIds\":[5,6,7],\"targetAccountId\":1}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.jobId").value("job-9"));
    }
}
