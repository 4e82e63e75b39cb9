package mail.archiver.app.job;

/**
 * Body of one job variant. The queue selects the handler once per job by {@link #getJobType()}.
 * @param <J> the job variant this handler runs
 */
public interface JobHandler<J extends BackgroundJob> {

    JobType getJobType();

    Class<J> getJobClass();

    /**
     * Runs the job to the end. Returning normally completes the job; throwing fails it,
     * except for {@link JobCancelledException} which cancels it.
     * @param job the job, already in {@link JobStatus#RUNNING}
     * @param cancellationToken checked before every processed item
     * @throws Exception any failure that invalidates the whole job
     */
    void execute(J job, CancellationToken cancellationToken) throws Exception;
}
