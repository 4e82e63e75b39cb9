package mail.archiver.app.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "email_attachments")
@Getter
@Setter
@ToString(exclude = {"archivedEmail", "content"})
public class EmailAttachment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "archived_email_id")
    private ArchivedEmail archivedEmail;

    @Column(length = 1000)
    private String fileName;

    private String contentType;

    // Set for inline parts referenced from the HTML body (cid:...)
    private String contentId;

    private byte[] content;

    private long size;

    public boolean isInline() {
        return contentId != null && !contentId.isBlank();
    }
}
