package mail.archiver.app.service.source;

import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.StoreClosedException;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class MailSourceExceptionTest {

    @Test
    void fromMessaging_ConnectionLoss_ShouldBeTransient() {
        assertTrue(MailSourceException.fromMessaging("fetch", new StoreClosedException(null, "closed")).isTransient());
        assertTrue(MailSourceException.fromMessaging("fetch",
            new MessagingException("read failed", new SocketTimeoutException("timeout"))).isTransient());
    }

    @Test
    void fromMessaging_ProtocolError_ShouldNotBeTransient() {
        MailSourceException e = MailSourceException.fromMessaging("login", new AuthenticationFailedException("denied"));

        assertFalse(e.isTransient());
        assertEquals("login: denied", e.getMessage());
    }
}
