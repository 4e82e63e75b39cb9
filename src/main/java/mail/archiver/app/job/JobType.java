package mail.archiver.app.job;

public enum JobType {
    SYNC,
    IMPORT,
    BATCH_RESTORE
}
