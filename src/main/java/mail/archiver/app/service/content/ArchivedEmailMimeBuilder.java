package mail.archiver.app.service.content;

import jakarta.activation.DataHandler;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimePart;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.util.ByteArrayDataSource;
import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.entity.ArchivedEmail;
import mail.archiver.app.entity.EmailAttachment;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Rebuilds a MIME message from an archived email so it can be appended to a live mailbox.
 * The original Message-ID and sent date are kept; inline parts are placed next to the
 * HTML body in a multipart/related so that their cid: references resolve.
 */
@Slf4j
@Component
public class ArchivedEmailMimeBuilder {
    private static final String UTF_8 = "UTF-8";

    public MimeMessage build(ArchivedEmail email) throws MessagingException {
        MimeMessage message = new ArchivedMimeMessage(MimeSupport.getSession(), email.getMessageId());

        setAddressHeader(message, "From", email.getFrom());
        setAddressHeader(message, "To", email.getTo());
        setAddressHeader(message, "Cc", email.getCc());
        setAddressHeader(message, "Bcc", email.getBcc());
        message.setSubject(email.getSubject() != null ? email.getSubject() : "", UTF_8);
        if (email.getSentDate() != null) {
            message.setSentDate(Date.from(email.getSentDate()));
        }

        String text = email.getBody();
        String html = email.getHtmlBody();
        List<EmailAttachment> inline = new ArrayList<>();
        List<EmailAttachment> regular = new ArrayList<>();
        for (EmailAttachment attachment : email.getAttachments()) {
            String fileName = attachment.getFileName() != null ? attachment.getFileName() : "";
            if (email.isHtmlTruncated() && fileName.startsWith(EmailContentService.ORIGINAL_HTML_PREFIX)) {
                html = new String(attachment.getContent(), StandardCharsets.UTF_8);
            } else if (email.isBodyTruncated() && fileName.startsWith(EmailContentService.ORIGINAL_TEXT_PREFIX)) {
                text = new String(attachment.getContent(), StandardCharsets.UTF_8);
            } else if (attachment.isInline()) {
                inline.add(attachment);
            } else {
                regular.add(attachment);
            }
        }
        if (isEmpty(html)) {
            // Without an HTML body nothing references the inline parts
            regular.addAll(inline);
            inline.clear();
        }

        if (regular.isEmpty()) {
            fillBody(message, text, html, inline);
        } else {
            MimeMultipart mixed = new MimeMultipart("mixed");
            MimeBodyPart content = new MimeBodyPart();
            fillBody(content, text, html, inline);
            mixed.addBodyPart(content);
            for (EmailAttachment attachment : regular) {
                mixed.addBodyPart(attachmentPart(attachment, false));
            }
            message.setContent(mixed);
        }
        message.saveChanges();
        log.debug("Rebuilt email {} with {} inline and {} regular attachments",
            email.getId(), inline.size(), regular.size());
        return message;
    }

    private void fillBody(MimePart target, String text, String html, List<EmailAttachment> inline)
            throws MessagingException {
        if (isEmpty(html)) {
            target.setText(text != null ? text : "", UTF_8);
            return;
        }

        MimePart htmlTarget = target;
        if (!isEmpty(text)) {
            MimeMultipart alternative = new MimeMultipart("alternative");
            MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(text, UTF_8);
            alternative.addBodyPart(textPart);
            MimeBodyPart htmlPart = new MimeBodyPart();
            alternative.addBodyPart(htmlPart);
            target.setContent(alternative);
            htmlTarget = htmlPart;
        }

        if (inline.isEmpty()) {
            htmlTarget.setText(html, UTF_8, "html");
            return;
        }
        MimeMultipart related = new MimeMultipart("related");
        MimeBodyPart htmlPart = new MimeBodyPart();
        htmlPart.setText(html, UTF_8, "html");
        related.addBodyPart(htmlPart);
        for (EmailAttachment attachment : inline) {
            related.addBodyPart(attachmentPart(attachment, true));
        }
        htmlTarget.setContent(related);
    }

    private MimeBodyPart attachmentPart(EmailAttachment attachment, boolean inline) throws MessagingException {
        String contentType = attachment.getContentType() != null ? attachment.getContentType() : "application/octet-stream";
        byte[] content = attachment.getContent() != null ? attachment.getContent() : new byte[0];

        MimeBodyPart part = new MimeBodyPart();
        part.setDataHandler(new DataHandler(new ByteArrayDataSource(content, contentType)));
        if (attachment.getFileName() != null) {
            part.setFileName(attachment.getFileName());
        }
        part.setDisposition(inline ? Part.INLINE : Part.ATTACHMENT);
        if (attachment.isInline()) {
            String contentId = attachment.getContentId().trim();
            part.setContentID(contentId.startsWith("<") ? contentId : "<" + contentId + ">");
        }
        return part;
    }

    private void setAddressHeader(MimeMessage message, String name, String value) throws MessagingException {
        if (isEmpty(value)) {
            return;
        }
        try {
            InternetAddress[] addresses = InternetAddress.parseHeader(value, false);
            message.setHeader(name, MimeUtility.fold(name.length() + 2, InternetAddress.toString(addresses)));
        } catch (AddressException e) {
            log.debug("Keeping unparseable {} header as text: {}", name, e.getMessage());
            message.setHeader(name, encode(value));
        }
    }

    private String encode(String value) {
        try {
            return MimeUtility.encodeText(value, UTF_8, null);
        } catch (UnsupportedEncodingException e) {
            return value;
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    /**
     * Keeps the archived Message-ID instead of generating a new one on saveChanges().
     */
    private static class ArchivedMimeMessage extends MimeMessage {
        private final String messageId;

        ArchivedMimeMessage(Session session, String messageId) {
            super(session);
            this.messageId = messageId;
        }

        @Override
        protected void updateMessageID() throws MessagingException {
            if (messageId == null || messageId.isBlank()) {
                super.updateMessageID();
                return;
            }
            String id = messageId.trim();
            setHeader("Message-ID", id.startsWith("<") ? id : "<" + id + ">");
        }
    }
}
