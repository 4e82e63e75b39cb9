package mail.archiver.app.job;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicInteger;

@Getter
public class SyncJob extends BackgroundJob {
    private final Long accountId;
    private final String accountName;
    private final boolean fullSync;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicInteger deleted = new AtomicInteger();
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicInteger folderErrors = new AtomicInteger();

    public SyncJob(Long accountId, String accountName, boolean fullSync) {
        super(JobType.SYNC);
        this.accountId = accountId;
        this.accountName = accountName;
        this.fullSync = fullSync;
    }

    public int getDeletedCount() {
        return deleted.get();
    }

    public void recordDeletion() {
        deleted.incrementAndGet();
    }

    public int getFolderErrors() {
        return folderErrors.get();
    }

    public void recordFolderError() {
        folderErrors.incrementAndGet();
    }

    public void addToTotal(int count) {
        setTotal(getTotal() + count);
    }

    @Override
    public String getDescription() {
        return (fullSync ? "Full sync of " : "Sync of ") + accountName;
    }
}
