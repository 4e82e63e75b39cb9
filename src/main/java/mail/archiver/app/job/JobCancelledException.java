package mail.archiver.app.job;

/**
 * Thrown at a checkpoint once cancellation of the running job was requested.
 * The queue turns it into {@link JobStatus#CANCELLED}, not a failure.
 */
public class JobCancelledException extends RuntimeException {
    public JobCancelledException(String message) {
        super(message);
    }
}
