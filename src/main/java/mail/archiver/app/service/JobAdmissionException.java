package mail.archiver.app.service;

/**
 * A job request that was refused before anything was queued.
 */
public class JobAdmissionException extends RuntimeException {
    public JobAdmissionException(String message) {
        super(message);
    }
}
