package mail.archiver.app.dto;

import lombok.Data;

import java.util.List;

@Data
public class BatchRestoreRequest {
    private List<Long> emailIds;
    private Long targetAccountId;
    private String targetFolder;
}
