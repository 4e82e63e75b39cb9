package mail.archiver.app.service;

import lombok.Getter;

@Getter
public class AccountAccessDeniedException extends RuntimeException {
    private final Long accountId;

    public AccountAccessDeniedException(Long accountId) {
        super("Access to mail account " + accountId + " is not allowed");
        this.accountId = accountId;
    }
}
