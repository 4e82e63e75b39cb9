package mail.archiver.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "archived_emails",
    uniqueConstraints = @UniqueConstraint(name = "uk_archived_email_account_message",
        columnNames = {"mail_account_id", "message_id"}))
@Getter
@Setter
@ToString(exclude = {"attachments", "body", "htmlBody"})
public class ArchivedEmail {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "mail_account_id", nullable = false)
    private Long mailAccountId;

    @Column(name = "message_id", nullable = false, length = 1000)
    private String messageId;

    @Column(columnDefinition = "TEXT")
    private String subject;

    @Column(name = "from_address", columnDefinition = "TEXT")
    private String from;

    @Column(name = "to_address", columnDefinition = "TEXT")
    private String to;

    @Column(columnDefinition = "TEXT")
    private String cc;

    @Column(columnDefinition = "TEXT")
    private String bcc;

    private Instant sentDate;

    private Instant receivedDate;

    private boolean outgoing;

    private String folderName;

    @Column(columnDefinition = "TEXT")
    private String body;

    @Column(columnDefinition = "TEXT")
    private String htmlBody;

    private boolean bodyTruncated;

    private boolean htmlTruncated;

    private boolean hasAttachments;

    @OneToMany(mappedBy = "archivedEmail", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<EmailAttachment> attachments = new ArrayList<>();

    public void addAttachment(EmailAttachment attachment) {
        attachment.setArchivedEmail(this);
        attachments.add(attachment);
    }
}
