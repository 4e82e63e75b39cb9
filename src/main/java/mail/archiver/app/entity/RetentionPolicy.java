package mail.archiver.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Per-account rule for deleting archived messages from the live mailbox
 * once they are older than {@code days}.
 */
@Embeddable
@Data
public class RetentionPolicy {
    @Column(name = "retention_enabled")
    private boolean enabled;

    @Column(name = "retention_days")
    private int days;

    /**
     * @return true when a message sent at {@code sentDate} may be removed from the provider
     */
    public boolean isExpired(Instant sentDate, Instant now) {
        if (!enabled || days <= 0 || sentDate == null) {
            return false;
        }
        return sentDate.isBefore(now.minus(days, ChronoUnit.DAYS));
    }
}
