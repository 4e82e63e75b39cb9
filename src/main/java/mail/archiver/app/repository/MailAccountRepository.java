package mail.archiver.app.repository;

import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.entity.ProviderType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MailAccountRepository extends JpaRepository<MailAccount, Long> {
    List<MailAccount> findByEnabledTrueAndProviderNot(ProviderType provider);
}
