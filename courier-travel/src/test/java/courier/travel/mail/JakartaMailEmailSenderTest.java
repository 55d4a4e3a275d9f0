package courier.travel.mail;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JakartaMailEmailSenderTest {

    private static int closedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static JakartaMailEmailSender sender(int port) {
        return JakartaMailEmailSender.builder()
                .host("127.0.0.1")
                .port(port)
                .startTls(false)
                .timeout(Duration.ofSeconds(2))
                .build();
    }

    @Test
    void malformedRecipientIsPermanent() throws IOException {
        EmailMessage message = EmailMessage.html("no-reply@travel.example", "<unterminated", "Hi", "<p>Hi</p>");

        SendResult result = sender(closedPort()).send(message);

        SendResult.PermanentError error = assertInstanceOf(SendResult.PermanentError.class, result);
        assertTrue(error.reason().startsWith("Invalid address"));
    }

    @Test
    void unreachableServerIsTransient() throws IOException {
        EmailMessage message = EmailMessage.html("no-reply@travel.example", "abebe@example.com", "Hi", "<p>Hi</p>");

        SendResult result = sender(closedPort()).send(message);

        assertInstanceOf(SendResult.TransientError.class, result);
    }

    @Test
    void builderRequiresHost() {
        assertThrows(NullPointerException.class, () -> JakartaMailEmailSender.builder().build());
    }

    @Test
    void builderRejectsInvalidPort() {
        assertThrows(IllegalArgumentException.class, () -> JakartaMailEmailSender.builder().port(0));
        assertThrows(IllegalArgumentException.class, () -> JakartaMailEmailSender.builder().port(70000));
    }
}
