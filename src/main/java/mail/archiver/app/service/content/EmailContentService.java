package mail.archiver.app.service.content;

import jakarta.mail.Address;
import jakarta.mail.Header;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimePart;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.internet.ParseException;
import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.entity.ArchivedEmail;
import mail.archiver.app.entity.EmailAttachment;
import mail.archiver.app.entity.MailAccount;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Turns a parsed MIME message into an {@link ArchivedEmail} that fits the storage limits:
 * strips control characters, truncates oversized bodies (keeping the original as an
 * attachment) and collects attachments including inline content.
 */
@Slf4j
@Service
public class EmailContentService {
    static final int MAX_TEXT_BODY_BYTES = 800_000;
    static final int MAX_HTML_BODY_CHARS = 1_000_000;

    static final String TEXT_TRUNCATION_NOTICE = "\n\n[CONTENT TRUNCATED - This email contains very large text content "
        + "that has been truncated for better performance. The complete original content has been saved as an attachment.]";

    static final String HTML_TRUNCATION_NOTICE =
        "<div style='background-color: #f8f9fa; border: 1px solid #dee2e6; border-radius: 5px; padding: 15px; margin: 10px 0; font-family: Arial, sans-serif;'>"
            + "<h4 style='color: #495057; margin-top: 0;'>Email content has been truncated</h4>"
            + "<p style='color: #6c757d; margin-bottom: 10px;'>This email contains very large HTML content (over 1 MB) that has been truncated for better performance.</p>"
            + "<p style='color: #6c757d; margin-bottom: 0;'><strong>The complete original HTML content has been saved as an attachment.</strong><br>"
            + "Look for a file named 'original_content_*.html' in the attachments.</p>"
            + "</div>";

    static final String ORIGINAL_HTML_PREFIX = "original_content_";
    static final String ORIGINAL_TEXT_PREFIX = "original_text_content_";

    // worst case: both <html> and <body> have to be added around the kept content
    private static final int HTML_TRUNCATION_OVERHEAD = ("<html><body>" + HTML_TRUNCATION_NOTICE + "</body></html>").length();
    private static final Set<String> ENVELOPE_HEADERS = Set.of(
        "from", "to", "cc", "date", "subject", "message-id", "sender", "received", "return-path", "mime-version");
    private static final Pattern GENERIC_IMAGE_NAME = Pattern.compile("^(img|pic|photo)\\d*\\.", Pattern.CASE_INSENSITIVE);
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
    private static final DateTimeFormatter FILE_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    /**
     * @return the Message-ID header, or null when the message has none
     */
    public String resolveMessageId(MimeMessage message) throws MessagingException {
        String messageId = message.getMessageID();
        if (messageId == null || messageId.isBlank()) {
            return null;
        }
        return cleanText(messageId.trim());
    }

    /**
     * Rejects input that parsed without a single recognisable email header.
     */
    public void validate(MimeMessage message) throws MessagingException {
        Enumeration<Header> headers = message.getAllHeaders();
        while (headers.hasMoreElements()) {
            String name = headers.nextElement().getName();
            if (name != null && ENVELOPE_HEADERS.contains(name.trim().toLowerCase(Locale.ROOT))) {
                return;
            }
        }
        throw new MalformedMessageException("No email headers found");
    }

    public ArchivedEmail normalize(MimeMessage message, MailAccount account, String folderName, String messageId)
            throws MessagingException, IOException {
        validate(message);

        BodyExtractionResult bodies = new BodyExtractionResult();
        extractBodies(message, bodies);

        String body = "";
        boolean bodyTruncated = false;
        String originalText = null;
        if (bodies.plainText != null && !bodies.plainText.isEmpty()) {
            originalText = bodies.plainText;
            body = cleanText(bodies.plainText);
        } else if (bodies.htmlText != null && !bodies.htmlText.isEmpty()) {
            originalText = bodies.htmlText;
            body = cleanText(HTML_TAG.matcher(bodies.htmlText).replaceAll(" "));
        }
        if (utf8Length(body) > MAX_TEXT_BODY_BYTES) {
            bodyTruncated = true;
            body = truncateTextForStorage(body);
        }

        String htmlBody = "";
        boolean htmlTruncated = false;
        if (bodies.htmlText != null && !bodies.htmlText.isEmpty()) {
            htmlTruncated = bodies.htmlText.length() > MAX_HTML_BODY_CHARS;
            htmlBody = htmlTruncated ? cleanHtmlForStorage(bodies.htmlText) : cleanText(bodies.htmlText);
        }

        List<Part> parts = new ArrayList<>();
        collectAttachments(message, parts, bodies);

        Instant now = Instant.now();
        ArchivedEmail email = new ArchivedEmail();
        email.setMailAccountId(account.getId());
        email.setMessageId(messageId);
        email.setSubject(cleanText(message.getSubject() != null ? message.getSubject() : "(No Subject)"));
        email.setFrom(cleanText(addresses(message, "From", null)));
        email.setTo(cleanText(addresses(message, "To", Message.RecipientType.TO)));
        email.setCc(cleanText(addresses(message, "Cc", Message.RecipientType.CC)));
        email.setBcc(cleanText(addresses(message, "Bcc", Message.RecipientType.BCC)));
        email.setSentDate(sentDate(message, now));
        email.setReceivedDate(now);
        email.setOutgoing(isOutgoing(message, account));
        email.setFolderName(folderName);
        email.setBody(body);
        email.setHtmlBody(htmlBody);
        email.setBodyTruncated(bodyTruncated);
        email.setHtmlTruncated(htmlTruncated);

        for (Part part : parts) {
            try {
                email.addAttachment(toAttachment(part));
            } catch (Exception e) {
                log.warn("Failed to read attachment of email {}: {}", messageId, e.getMessage());
            }
        }
        if (htmlTruncated) {
            email.addAttachment(textAttachment(ORIGINAL_HTML_PREFIX + FILE_STAMP.format(now) + ".html",
                "text/html", bodies.htmlText));
            log.info("Stored original HTML of email {} as attachment", messageId);
        }
        if (bodyTruncated && originalText != null) {
            email.addAttachment(textAttachment(ORIGINAL_TEXT_PREFIX + FILE_STAMP.format(now) + ".txt",
                "text/plain", originalText));
            log.info("Stored original text of email {} as attachment", messageId);
        }
        email.setHasAttachments(!email.getAttachments().isEmpty());
        return email;
    }

    /**
     * Helper class to store the parts chosen as text and HTML body
     */
    private static class BodyExtractionResult {
        Part plainPart;
        Part htmlPart;
        String plainText;
        String htmlText;
    }

    private void extractBodies(Part part, BodyExtractionResult result) throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                extractBodies(multipart.getBodyPart(i), result);
            }
            return;
        }
        if (isAttachmentDisposition(part)) {
            return;
        }
        if (result.plainPart == null && part.isMimeType("text/plain")) {
            result.plainPart = part;
            result.plainText = readText(part);
        } else if (result.htmlPart == null && part.isMimeType("text/html")) {
            result.htmlPart = part;
            result.htmlText = readText(part);
        }
    }

    private void collectAttachments(Part part, List<Part> attachments, BodyExtractionResult bodies)
            throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                collectAttachments(multipart.getBodyPart(i), attachments, bodies);
            }
        } else if (part.isMimeType("message/rfc822")) {
            // Look inside embedded messages as well
            Object content = part.getContent();
            if (content instanceof Part) {
                collectAttachments((Part) content, attachments, bodies);
            }
        } else if (part == bodies.plainPart || part == bodies.htmlPart) {
            log.trace("Skipping body part {}", part.getContentType());
        } else if (isAttachmentDisposition(part) || isInlineContent(part)) {
            attachments.add(part);
        }
    }

    /**
     * Inline content is anything the HTML body may reference: parts with inline
     * disposition, parts with a Content-ID, and images that look embedded.
     */
    boolean isInlineContent(Part part) throws MessagingException {
        String disposition = part.getDisposition();
        if (Part.INLINE.equalsIgnoreCase(disposition)) {
            return true;
        }
        String contentId = contentId(part);
        if (contentId != null && !contentId.isEmpty()) {
            return true;
        }

        String contentType = baseType(part.getContentType());
        String fileName = fileName(part);
        if (fileName == null) {
            fileName = "";
        }
        if (contentType.startsWith("image/")) {
            if (disposition == null) {
                return true;
            }
            String lower = fileName.toLowerCase(Locale.ROOT);
            if (fileName.isEmpty() || lower.startsWith("image") || lower.contains("inline") || lower.contains("embed")
                    || GENERIC_IMAGE_NAME.matcher(fileName).find()) {
                return true;
            }
        }
        return contentType.startsWith("text/") && contentType.contains("related");
    }

    private boolean isAttachmentDisposition(Part part) throws MessagingException {
        return Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition());
    }

    private EmailAttachment toAttachment(Part part) throws MessagingException, IOException {
        byte[] data;
        try (InputStream in = part.getInputStream()) {
            data = in.readAllBytes();
        }
        String contentType = baseType(part.getContentType());
        String contentId = contentId(part);
        String fileName = fileName(part);
        if (fileName == null || fileName.isBlank()) {
            String extension = extensionFor(contentType);
            if (contentId != null && !contentId.isEmpty()) {
                fileName = "inline_" + contentId.replace("<", "").replace(">", "") + extension;
            } else {
                fileName = "attachment_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8) + extension;
            }
        }

        EmailAttachment attachment = new EmailAttachment();
        attachment.setFileName(cleanText(fileName));
        attachment.setContentType(cleanText(contentType));
        attachment.setContentId(contentId != null && !contentId.isEmpty() ? cleanText(contentId) : null);
        attachment.setContent(data);
        attachment.setSize(data.length);
        return attachment;
    }

    private EmailAttachment textAttachment(String fileName, String contentType, String text) {
        byte[] data = text.getBytes(StandardCharsets.UTF_8);
        EmailAttachment attachment = new EmailAttachment();
        attachment.setFileName(fileName);
        attachment.setContentType(contentType);
        attachment.setContent(data);
        attachment.setSize(data.length);
        return attachment;
    }

    private String readText(Part part) throws MessagingException, IOException {
        try {
            Object content = part.getContent();
            if (content instanceof String) {
                return (String) content;
            }
        } catch (UnsupportedEncodingException e) {
            log.debug("Unknown charset in {}, reading as UTF-8", part.getContentType());
        }
        try (InputStream in = part.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String addresses(MimeMessage message, String header, Message.RecipientType type) throws MessagingException {
        try {
            Address[] addresses = type == null ? message.getFrom() : message.getRecipients(type);
            if (addresses == null || addresses.length == 0) {
                return "";
            }
            return InternetAddress.toUnicodeString(addresses);
        } catch (AddressException e) {
            // Keep the raw header when the address list does not parse
            String raw = message.getHeader(header, ", ");
            return raw != null ? decode(raw) : "";
        }
    }

    private Instant sentDate(MimeMessage message, Instant fallback) {
        try {
            Date sent = message.getSentDate();
            if (sent != null) {
                return sent.toInstant();
            }
            Date received = message.getReceivedDate();
            return received != null ? received.toInstant() : fallback;
        } catch (MessagingException e) {
            log.debug("Unreadable Date header: {}", e.getMessage());
            return fallback;
        }
    }

    private boolean isOutgoing(MimeMessage message, MailAccount account) {
        if (account.getEmailAddress() == null) {
            return false;
        }
        try {
            Address[] from = message.getFrom();
            if (from == null || from.length == 0 || !(from[0] instanceof InternetAddress)) {
                return false;
            }
            return account.getEmailAddress().equalsIgnoreCase(((InternetAddress) from[0]).getAddress());
        } catch (MessagingException e) {
            return false;
        }
    }

    private String contentId(Part part) throws MessagingException {
        if (part instanceof MimePart) {
            String contentId = ((MimePart) part).getContentID();
            return contentId != null ? contentId.trim() : null;
        }
        return null;
    }

    private String fileName(Part part) {
        try {
            String fileName = part.getFileName();
            return fileName != null ? decode(fileName) : null;
        } catch (MessagingException e) {
            return null;
        }
    }

    private String decode(String text) {
        try {
            return MimeUtility.decodeText(text);
        } catch (UnsupportedEncodingException e) {
            return text;
        }
    }

    static String baseType(String rawContentType) {
        if (rawContentType == null) {
            return "application/octet-stream";
        }
        try {
            return new ContentType(rawContentType).getBaseType().toLowerCase(Locale.ROOT);
        } catch (ParseException e) {
            return "application/octet-stream";
        }
    }

    static String extensionFor(String contentType) {
        switch (contentType == null ? "" : contentType) {
            case "image/jpeg":
            case "image/jpg":
                return ".jpg";
            case "image/png":
                return ".png";
            case "image/gif":
                return ".gif";
            case "image/bmp":
                return ".bmp";
            case "image/webp":
                return ".webp";
            case "image/svg+xml":
                return ".svg";
            default:
                return ".dat";
        }
    }

    /**
     * Removes NUL bytes and replaces other control characters (except CR, LF, TAB) with a space.
     */
    public String cleanText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder cleaned = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\0') {
                continue;
            }
            if (c < 32 && c != '\r' && c != '\n' && c != '\t') {
                cleaned.append(' ');
            } else {
                cleaned.append(c);
            }
        }
        return cleaned.toString();
    }

    /**
     * Cuts text to {@link #MAX_TEXT_BODY_BYTES} UTF-8 bytes including the truncation notice,
     * preferring a word or sentence boundary within the last 100 characters.
     */
    public String truncateTextForStorage(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        if (utf8Length(text) <= MAX_TEXT_BODY_BYTES) {
            return text;
        }
        int maxContentBytes = MAX_TEXT_BODY_BYTES - utf8Length(TEXT_TRUNCATION_NOTICE);

        int position = 0;
        int bytes = 0;
        while (position < text.length()) {
            int codePoint = text.codePointAt(position);
            int size = utf8Length(codePoint);
            if (bytes + size > maxContentBytes) {
                break;
            }
            bytes += size;
            position += Character.charCount(codePoint);
        }

        int searchFrom = Math.max(0, position - 100);
        int breakPoint = -1;
        for (int i = position - 1; i > searchFrom; i--) {
            char c = text.charAt(i);
            if (c == ' ' || c == '\n' || c == '.' || c == '!' || c == '?' || c == ';') {
                breakPoint = i;
                break;
            }
        }
        if (breakPoint > searchFrom) {
            position = breakPoint + 1;
        }
        return text.substring(0, position) + TEXT_TRUNCATION_NOTICE;
    }

    /**
     * Cuts oversized HTML at a tag boundary and appends a notice, keeping the document well formed.
     */
    public String cleanHtmlForStorage(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        if (html.indexOf('\0') >= 0) {
            html = html.replace("\0", "");
        }
        if (html.length() <= MAX_HTML_BODY_CHARS) {
            return html;
        }

        int truncatePosition = Math.min(MAX_HTML_BODY_CHARS - HTML_TRUNCATION_OVERHEAD, html.length());
        int lastLessThan = html.lastIndexOf('<', truncatePosition - 1);
        int lastGreaterThan = html.lastIndexOf('>', truncatePosition - 1);
        if (lastLessThan > lastGreaterThan && lastLessThan >= 0) {
            // inside a tag, cut before it starts
            truncatePosition = lastLessThan;
        } else if (lastGreaterThan >= 0) {
            truncatePosition = lastGreaterThan + 1;
        }

        String base = html.substring(0, truncatePosition);
        String lower = base.toLowerCase(Locale.ROOT);
        boolean hasHtml = lower.contains("<html");
        boolean hasBody = lower.contains("<body");

        StringBuilder result = new StringBuilder(truncatePosition + HTML_TRUNCATION_OVERHEAD + 32);
        if (!hasHtml) {
            result.append("<html>");
        }
        if (hasBody) {
            result.append(base);
        } else {
            int htmlStart = lower.indexOf("<html");
            int htmlTagEnd = htmlStart >= 0 ? base.indexOf('>', htmlStart) : -1;
            if (htmlTagEnd >= 0) {
                result.append(base, 0, htmlTagEnd + 1).append("<body>").append(base.substring(htmlTagEnd + 1));
            } else {
                result.append("<body>").append(base);
            }
        }
        result.append(HTML_TRUNCATION_NOTICE);
        result.append("</body></html>");
        return result.toString();
    }

    static int utf8Length(String text) {
        int length = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            length += utf8Length(codePoint);
            i += Character.charCount(codePoint);
        }
        return length;
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        } else if (codePoint < 0x800) {
            return 2;
        } else if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }
}
