package mail.archiver.app.service.content;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Jakarta Mail session shared by parsing and message reconstruction.
 */
public final class MimeSupport {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        props.setProperty("mail.mime.address.strict", "false");
        props.setProperty("mail.mime.parameters.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private MimeSupport() {}

    /**
     * Parse a message from a stream. The stream is consumed but not closed.
     */
    public static MimeMessage parse(InputStream in) throws MessagingException {
        return new MimeMessage(SESSION, in);
    }

    public static byte[] toBytes(MimeMessage message) throws MessagingException, IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        message.writeTo(outputStream);
        return outputStream.toByteArray();
    }

    public static Session getSession() {
        return SESSION;
    }
}
