package courier.spring.mail;

import courier.travel.mail.EmailMessage;
import courier.travel.mail.SendResult;
import jakarta.mail.Address;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.Test;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JavaMailSenderEmailSenderTest {
    private static final EmailMessage MESSAGE = EmailMessage.html(
            "no-reply@travel.example", "abebe@example.com", "Booking Confirmed - Lakeside Cabin",
            "<p>Dear Abebe,</p>");

    /**
     * Records sent messages instead of talking SMTP, or throws a scripted exception.
     */
    static class ScriptedMailSender extends JavaMailSenderImpl {
        final List<MimeMessage> sent = new ArrayList<>();
        MailException failure;

        @Override
        public void send(MimeMessage mimeMessage) {
            if (failure != null) {
                throw failure;
            }
            sent.add(mimeMessage);
        }
    }

    private final ScriptedMailSender mailSender = new ScriptedMailSender();
    private final JavaMailSenderEmailSender sender = new JavaMailSenderEmailSender(mailSender);

    @Test
    void sendsMultipartMessage() throws Exception {
        assertEquals(SendResult.sent(), sender.send(MESSAGE));

        MimeMessage mime = mailSender.sent.get(0);
        assertEquals("Booking Confirmed - Lakeside Cabin", mime.getSubject());
        assertEquals("abebe@example.com", ((InternetAddress) mime.getAllRecipients()[0]).getAddress());
        assertEquals("no-reply@travel.example", ((InternetAddress) mime.getFrom()[0]).getAddress());
        assertInstanceOf(MimeMultipart.class, mime.getContent());
    }

    @Test
    void malformedRecipientIsPermanent() {
        EmailMessage bad = EmailMessage.html("no-reply@travel.example", "<unterminated", "Hi", "<p>Hi</p>");

        assertInstanceOf(SendResult.PermanentError.class, sender.send(bad));
        assertTrue(mailSender.sent.isEmpty());
    }

    @Test
    void rejectedRecipientIsPermanent() throws Exception {
        Address[] invalid = {new InternetAddress("ghost@example.com")};
        mailSender.failure = new MailSendException(Map.<Object, Exception>of(new Object(),
                new SendFailedException("550 No such user", null, new Address[0], new Address[0], invalid)));

        SendResult result = sender.send(MESSAGE);

        SendResult.PermanentError error = assertInstanceOf(SendResult.PermanentError.class, result);
        assertTrue(error.reason().contains("abebe@example.com"));
    }

    @Test
    void connectionFailureIsTransient() {
        mailSender.failure = new MailSendException("Mail server connection failed");

        assertInstanceOf(SendResult.TransientError.class, sender.send(MESSAGE));
    }

    @Test
    void authenticationFailureIsTransient() {
        mailSender.failure = new MailAuthenticationException("535 Authentication failed");

        assertInstanceOf(SendResult.TransientError.class, sender.send(MESSAGE));
    }
}
