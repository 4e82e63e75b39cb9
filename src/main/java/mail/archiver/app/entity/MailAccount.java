package mail.archiver.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.stream.Collectors;

@Entity
@Table(name = "mail_accounts")
@Getter
@Setter
@ToString(exclude = {"password", "clientSecret"})
public class MailAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String name;

    private String emailAddress;

    @Enumerated(EnumType.STRING)
    private ProviderType provider;

    private boolean enabled;

    // IMAP
    private String imapServer;
    private int imapPort;
    private boolean useSsl;
    private String username;
    @Column(length = 4000)
    private String password;

    // Microsoft Graph (app registration, client credentials)
    private String tenantId;
    private String clientId;
    @Column(length = 4000)
    private String clientSecret;

    private Instant lastSync;

    @Embedded
    private RetentionPolicy retention = new RetentionPolicy();

    @Column(columnDefinition = "TEXT")
    private String excludedFolders;

    public Set<String> getExcludedFolderSet() {
        if (excludedFolders == null || excludedFolders.isBlank()) {
            return Collections.emptySet();
        }
        return Arrays.stream(excludedFolders.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toSet());
    }
}
