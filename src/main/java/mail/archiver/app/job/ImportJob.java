package mail.archiver.app.job;

import lombok.Getter;
import lombok.Setter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Getter
public class ImportJob extends BackgroundJob {
    private final Long targetAccountId;
    private final Path filePath;
    private final String fileName;
    private final long fileSize;
    private final String defaultFolder;
    private final ImportFormat format;

    @Setter
    private volatile long processedBytes;

    public ImportJob(Long targetAccountId, Path filePath, String fileName, long fileSize,
                     String defaultFolder, ImportFormat format) {
        super(JobType.IMPORT);
        this.targetAccountId = targetAccountId;
        this.filePath = filePath;
        this.fileName = fileName;
        this.fileSize = fileSize;
        this.defaultFolder = defaultFolder;
        this.format = format;
    }

    @Override
    public void releaseResources() throws IOException {
        Files.deleteIfExists(filePath);
    }

    @Override
    public String getDescription() {
        return "Import of " + fileName;
    }
}
