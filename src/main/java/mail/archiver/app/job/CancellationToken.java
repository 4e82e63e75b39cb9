package mail.archiver.app.job;

/**
 * Cooperative cancellation signal shared between the caller that cancels a job
 * and the job body that polls it at its checkpoints.
 */
public class CancellationToken {
    private volatile boolean cancellationRequested;

    public void cancel() {
        this.cancellationRequested = true;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }

    public void throwIfCancellationRequested() {
        if (cancellationRequested) {
            throw new JobCancelledException("Job was cancelled");
        }
    }
}
