package mail.archiver.app.controller;

import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.dto.BatchRestoreRequest;
import mail.archiver.app.dto.ImportRequest;
import mail.archiver.app.dto.JobStatusResponse;
import mail.archiver.app.service.AccountAccessDeniedException;
import mail.archiver.app.service.AccountAccessPolicy;
import mail.archiver.app.service.JobAdmissionException;
import mail.archiver.app.service.JobQueueService;
import mail.archiver.app.service.JobSubmissionService;
import mail.archiver.app.service.RestoreSubmission;
import mail.archiver.app.service.source.MailSourceException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api")
public class JobController {
    private final JobQueueService jobQueueService;
    private final JobSubmissionService jobSubmissionService;
    private final AccountAccessPolicy accountAccessPolicy;

    public JobController(
            JobQueueService jobQueueService,
            JobSubmissionService jobSubmissionService,
            AccountAccessPolicy accountAccessPolicy) {
        this.jobQueueService = jobQueueService;
        this.jobSubmissionService = jobSubmissionService;
        this.accountAccessPolicy = accountAccessPolicy;
    }

    @GetMapping("/jobs")
    public List<JobStatusResponse> listJobs(@RequestParam(name = "activeOnly", defaultValue = "false") boolean activeOnly) {
        return (activeOnly ? jobQueueService.getActiveJobs() : jobQueueService.getAllJobs()).stream()
            .map(JobStatusResponse::from)
            .collect(Collectors.toList());
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobStatusResponse> getJob(@PathVariable("jobId") String jobId) {
        return jobQueueService.getJob(jobId)
            .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<Map<String, Object>> cancelJob(@PathVariable("jobId") String jobId) {
        if (jobQueueService.getJob(jobId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean cancelled = jobQueueService.cancelJob(jobId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId", jobId);
        body.put("cancelled", cancelled);
        return cancelled ? ResponseEntity.ok(body) : ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @PostMapping("/accounts/{accountId}/sync")
    public ResponseEntity<Map<String, Object>> startSync(
            @PathVariable("accountId") Long accountId,
            @RequestParam(name = "full", defaultValue = "false") boolean fullSync) {
        String jobId = jobSubmissionService.startSync(accountId, fullSync,
            accountAccessPolicy.allowedAccountIds(), accountAccessPolicy.currentUser());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId));
    }

    @GetMapping("/accounts/{accountId}/folders")
    public List<String> listFolders(@PathVariable("accountId") Long accountId) {
        return jobSubmissionService.listFolders(accountId, accountAccessPolicy.allowedAccountIds());
    }

    @PostMapping("/imports")
    public ResponseEntity<Map<String, Object>> startImport(@RequestBody ImportRequest request) {
        String jobId = jobSubmissionService.startImport(request,
            accountAccessPolicy.allowedAccountIds(), accountAccessPolicy.currentUser());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId));
    }

    @PostMapping("/restores")
    public ResponseEntity<Map<String, Object>> startRestore(@RequestBody BatchRestoreRequest request) {
        RestoreSubmission submission = jobSubmissionService.startBatchRestore(
            request.getEmailIds(), request.getTargetAccountId(), request.getTargetFolder(),
            accountAccessPolicy.allowedAccountIds(), accountAccessPolicy.currentUser());

        Map<String, Object> body = new LinkedHashMap<>();
        if (submission.isQueued()) {
            body.put("jobId", submission.getJobId());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }
        body.put("succeeded", submission.getResult().getSucceeded());
        body.put("failed", submission.getResult().getFailed());
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(JobAdmissionException.class)
    public ResponseEntity<Map<String, String>> handleAdmission(JobAdmissionException e) {
        log.warn("Job request rejected: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(AccountAccessDeniedException.class)
    public ResponseEntity<Map<String, String>> handleAccessDenied(AccountAccessDeniedException e) {
        log.warn("Job request denied: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(MailSourceException.class)
    public ResponseEntity<Map<String, String>> handleMailSource(MailSourceException e) {
        log.error("Mail provider error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
    }
}
