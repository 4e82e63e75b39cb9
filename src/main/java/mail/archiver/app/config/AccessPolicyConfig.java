package mail.archiver.app.config;

import mail.archiver.app.service.AccountAccessPolicy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AccessPolicyConfig {

    // Without user management every account is accessible
    @Bean
    @ConditionalOnMissingBean(AccountAccessPolicy.class)
    public AccountAccessPolicy unrestrictedAccountAccessPolicy() {
        return () -> null;
    }
}
