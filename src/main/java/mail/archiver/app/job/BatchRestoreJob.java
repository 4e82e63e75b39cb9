package mail.archiver.app.job;

import lombok.Getter;

import java.util.List;
import java.util.Set;

@Getter
public class BatchRestoreJob extends BackgroundJob {
    private final List<Long> emailIds;
    private final Long targetAccountId;
    private final String targetFolder;
    // null means every account is allowed
    private final Set<Long> allowedAccountIds;

    public BatchRestoreJob(List<Long> emailIds, Long targetAccountId, String targetFolder,
                           Set<Long> allowedAccountIds) {
        super(JobType.BATCH_RESTORE);
        this.emailIds = List.copyOf(emailIds);
        this.targetAccountId = targetAccountId;
        this.targetFolder = targetFolder;
        this.allowedAccountIds = allowedAccountIds == null ? null : Set.copyOf(allowedAccountIds);
        setTotal(this.emailIds.size());
    }

    @Override
    public String getDescription() {
        return "Restore of " + emailIds.size() + " emails to " + targetFolder;
    }
}
