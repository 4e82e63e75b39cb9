package mail.archiver.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.config.ArchiverProperties;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Per-account sync lock kept in the database, so that two nodes (or a scheduled and a
 * manual sync) never work on the same mailbox at once. Locks expire, which frees
 * accounts of a node that died mid-sync.
 */
@Slf4j
@Service
public class AccountLockService {
    private static final String LOCK_TABLE = "account_sync_locks";

    private final JdbcTemplate jdbcTemplate;
    private final int lockTimeoutMinutes;
    private final String nodeId;

    public AccountLockService(JdbcTemplate jdbcTemplate, ArchiverProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeoutMinutes = properties.getSync().getLockTimeoutMinutes();
        this.nodeId = resolveNodeId(properties.getSync().getNodeId());
        initializeLockTable();
    }

    private void initializeLockTable() {
        try {
            jdbcTemplate.execute(
                "CREATE TABLE IF NOT EXISTS " + LOCK_TABLE + " (" +
                "account_id BIGINT PRIMARY KEY, " +
                "locked_by VARCHAR(255) NOT NULL, " +
                "locked_at TIMESTAMP NOT NULL, " +
                "expires_at TIMESTAMP NOT NULL" +
                ")"
            );
            log.debug("Lock table initialized");
        } catch (Exception e) {
            log.warn("Could not initialize lock table (may already exist): {}", e.getMessage());
        }
    }

    /**
     * @return true if this node now holds the lock for the account
     */
    public boolean tryLock(Long accountId) {
        Timestamp now = Timestamp.from(Instant.now());
        Timestamp expiresAt = Timestamp.from(now.toInstant().plusSeconds(TimeUnit.MINUTES.toSeconds(lockTimeoutMinutes)));

        if (insertLock(accountId, now, expiresAt)) {
            log.debug("Acquired sync lock for account {}", accountId);
            return true;
        }

        int expired = jdbcTemplate.update(
            "DELETE FROM " + LOCK_TABLE + " WHERE account_id = ? AND expires_at < ?",
            accountId, now
        );
        if (expired > 0 && insertLock(accountId, now, expiresAt)) {
            log.info("Acquired sync lock for account {} after removing an expired lock", accountId);
            return true;
        }

        log.debug("Sync lock for account {} is held by another worker", accountId);
        return false;
    }

    public void releaseLock(Long accountId) {
        try {
            int rows = jdbcTemplate.update(
                "DELETE FROM " + LOCK_TABLE + " WHERE account_id = ? AND locked_by = ?",
                accountId, nodeId
            );
            if (rows > 0) {
                log.debug("Released sync lock for account {}", accountId);
            } else {
                log.warn("Sync lock for account {} was not held by this node", accountId);
            }
        } catch (Exception e) {
            log.error("Error releasing sync lock for account {}: {}", accountId, e.getMessage(), e);
        }
    }

    private boolean insertLock(Long accountId, Timestamp now, Timestamp expiresAt) {
        try {
            return jdbcTemplate.update(
                "INSERT INTO " + LOCK_TABLE + " (account_id, locked_by, locked_at, expires_at) VALUES (?, ?, ?, ?)",
                accountId, nodeId, now, expiresAt
            ) > 0;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    public String getNodeId() {
        return nodeId;
    }

    private static String resolveNodeId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String nodeId = System.getenv("HOSTNAME");
        if (nodeId == null || nodeId.isEmpty()) {
            nodeId = System.getProperty("user.name") + "-" + ProcessHandle.current().pid();
        }
        return nodeId;
    }
}
