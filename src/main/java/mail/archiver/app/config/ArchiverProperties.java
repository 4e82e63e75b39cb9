package mail.archiver.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the job core, bound from the {@code archiver.*} keys.
 */
@Data
@ConfigurationProperties(prefix = "archiver")
public class ArchiverProperties {
    private Jobs jobs = new Jobs();
    private Batch batch = new Batch();
    private Sync sync = new Sync();
    private Imports imports = new Imports();
    private Graph graph = new Graph();

    @Data
    public static class Jobs {
        private long idlePollMs = 100;
        private long errorBackoffMs = 1000;
        private int completedJobRetentionDays = 7;
    }

    @Data
    public static class Batch {
        // Restores above this size run as a background job, smaller ones inline
        private int asyncThreshold = 50;
        private int maxAsyncEmails = 50_000;
        private int batchSize = 50;
        private long pauseBetweenEmailsMs = 50;
        private long pauseBetweenBatchesMs = 250;
    }

    @Data
    public static class Sync {
        private long intervalMinutes = 15;
        private int maxRetries = 2;
        private long retryBaseDelayMs = 1000;
        private int lockTimeoutMinutes = 120;
        private String nodeId;
    }

    @Data
    public static class Imports {
        private String uploadsPath = "uploads/eml";
        private String defaultFolder = "INBOX";
        private int logEvery = 100;
        private int pauseEvery = 10;
    }

    @Data
    public static class Graph {
        private String baseUrl = "https://graph.microsoft.com/v1.0";
        private String tokenUrl = "https://login.microsoftonline.com/%s/oauth2/v2.0/token";
        private String scope = "https://graph.microsoft.com/.default";
        private int pageSize = 50;
    }
}
