package mail.archiver.app.service.source;

import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.entity.ProviderType;

import java.util.List;

public interface MailSourceAdapter {

    ProviderType providerType();

    MailSourceSession open(MailAccount account);

    default List<String> listFolders(MailAccount account) {
        try (MailSourceSession session = open(account)) {
            return session.listFolders();
        }
    }
}
