package mail.archiver.app.entity;

public enum ProviderType {
    IMAP,
    M365,
    IMPORT
}
