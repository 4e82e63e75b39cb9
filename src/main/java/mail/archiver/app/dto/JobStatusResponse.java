package mail.archiver.app.dto;

import lombok.Data;
import mail.archiver.app.job.BackgroundJob;
import mail.archiver.app.job.JobStatus;
import mail.archiver.app.job.JobType;

import java.time.Instant;

/**
 * Snapshot of a job for status polling.
 */
@Data
public class JobStatusResponse {
    private String jobId;
    private JobType type;
    private JobStatus status;
    private String description;
    private int total;
    private int processed;
    private int succeeded;
    private int failed;
    private int skipped;
    private int progressPercent;
    private Instant created;
    private Instant started;
    private Instant completed;
    private String currentItem;
    private String errorMessage;
    private String requestedBy;

    public static JobStatusResponse from(BackgroundJob job) {
        JobStatusResponse response = new JobStatusResponse();
        response.setJobId(job.getJobId());
        response.setType(job.getType());
        response.setStatus(job.getStatus());
        response.setDescription(job.getDescription());
        response.setTotal(job.getTotal());
        response.setProcessed(job.getProcessed());
        response.setSucceeded(job.getSucceeded());
        response.setFailed(job.getFailed());
        response.setSkipped(job.getSkipped());
        response.setProgressPercent(job.getProgressPercent());
        response.setCreated(job.getCreated());
        response.setStarted(job.getStarted());
        response.setCompleted(job.getCompleted());
        response.setCurrentItem(job.getCurrentItem());
        response.setErrorMessage(job.getErrorMessage());
        response.setRequestedBy(job.getRequestedBy());
        return response;
    }
}
