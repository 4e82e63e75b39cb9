package mail.archiver.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.config.ArchiverProperties;
import mail.archiver.app.job.JobCancelledException;
import mail.archiver.app.service.source.MailSourceException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retries provider calls that failed transiently, with exponential backoff, and provides
 * the throttling pauses used between messages.
 */
@Slf4j
@Component
public class MailSourceRetry {
    private final int maxRetries;
    private final long baseDelayMs;

    public MailSourceRetry(ArchiverProperties properties) {
        this.maxRetries = properties.getSync().getMaxRetries();
        this.baseDelayMs = properties.getSync().getRetryBaseDelayMs();
    }

    public <T> T call(String operation, Supplier<T> action) {
        for (int attempt = 0; ; attempt++) {
            try {
                return action.get();
            } catch (MailSourceException e) {
                if (!e.isTransient() || attempt >= maxRetries) {
                    throw e;
                }
                long delayMs = baseDelayMs * (long) Math.pow(2, attempt);
                log.info("Retrying {} (attempt {} of {}) in {}ms after: {}",
                    operation, attempt + 2, maxRetries + 1, delayMs, e.getMessage());
                pause(delayMs);
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Sleeps for the given time. An interrupt ends the running job.
     */
    public void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException("Interrupted while waiting");
        }
    }
}
