package mail.archiver.app.service;

import java.util.Set;

/**
 * Tells which mail accounts the current caller may work with.
 */
public interface AccountAccessPolicy {

    /**
     * @return ids of the accessible accounts, or null when every account is accessible
     */
    Set<Long> allowedAccountIds();

    /**
     * Name recorded as the requester of submitted jobs.
     */
    default String currentUser() {
        return "system";
    }
}
