package mail.archiver.app.service.source;

import mail.archiver.app.entity.MailAccount;
import mail.archiver.app.entity.ProviderType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class MailSourceRegistry {
    private final Map<ProviderType, MailSourceAdapter> adapters = new EnumMap<>(ProviderType.class);

    public MailSourceRegistry(List<MailSourceAdapter> mailSourceAdapters) {
        for (MailSourceAdapter adapter : mailSourceAdapters) {
            adapters.put(adapter.providerType(), adapter);
        }
    }

    /**
     * @throws UnsupportedOperationException for accounts without a remote mailbox (IMPORT)
     */
    public MailSourceAdapter forAccount(MailAccount account) {
        MailSourceAdapter adapter = adapters.get(account.getProvider());
        if (adapter == null) {
            throw new UnsupportedOperationException(
                "Account " + account.getName() + " (" + account.getProvider() + ") has no remote mailbox");
        }
        return adapter;
    }
}
