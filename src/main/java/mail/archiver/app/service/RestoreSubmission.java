package mail.archiver.app.service;

import lombok.Getter;

/**
 * Outcome of a restore request: either a queued background job or the result of an
 * inline restore.
 */
@Getter
public class RestoreSubmission {
    private final String jobId;
    private final RestoreResult result;

    private RestoreSubmission(String jobId, RestoreResult result) {
        this.jobId = jobId;
        this.result = result;
    }

    public static RestoreSubmission queued(String jobId) {
        return new RestoreSubmission(jobId, null);
    }

    public static RestoreSubmission completed(RestoreResult result) {
        return new RestoreSubmission(null, result);
    }

    public boolean isQueued() {
        return jobId != null;
    }
}
