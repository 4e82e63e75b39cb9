package mail.archiver.app.dto;

import lombok.Data;

/**
 * An upload that was already saved to disk and should be imported.
 */
@Data
public class ImportRequest {
    private Long accountId;
    private String filePath;
    private String fileName;
    private long fileSize;
    // Folder for entries that are not inside a directory; the configured default when empty
    private String folder;
}
