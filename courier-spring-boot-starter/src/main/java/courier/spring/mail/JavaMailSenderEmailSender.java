package courier.spring.mail;

import courier.travel.mail.EmailMessage;
import courier.travel.mail.EmailSender;
import courier.travel.mail.SendResult;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.MimeMessage;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EmailSender} over Spring's {@link JavaMailSender}, for applications that configure
 * SMTP through {@code spring.mail.*}.
 *
 * <p>Unparseable addresses and recipients refused by the server are permanent. Authentication
 * failures and every other {@link MailException} are transient.
 */
public final class JavaMailSenderEmailSender implements EmailSender {
    private static final Logger logger = Logger.getLogger(JavaMailSenderEmailSender.class.getName());

    private final JavaMailSender mailSender;

    public JavaMailSenderEmailSender(JavaMailSender mailSender) {
        this.mailSender = Objects.requireNonNull(mailSender, "mailSender");
    }

    @Override
    public SendResult send(EmailMessage message) {
        Objects.requireNonNull(message, "message");
        MimeMessage mime;
        try {
            mime = toMime(message);
        } catch (MessagingException | MailParseException e) {
            return SendResult.permanentError("Invalid address: " + e.getMessage());
        }
        try {
            mailSender.send(mime);
            logger.log(Level.FINE, "Sent \"{0}\" to {1}", new Object[] {message.subject(), message.to()});
            return SendResult.sent();
        } catch (MailSendException e) {
            if (rejectsRecipient(e)) {
                return SendResult.permanentError("Recipient rejected: " + message.to());
            }
            return SendResult.transientError("Send failed: " + e.getMessage());
        } catch (MailParseException | MailPreparationException e) {
            return SendResult.permanentError("Cannot build message: " + e.getMessage());
        } catch (MailAuthenticationException e) {
            logger.log(Level.WARNING, "SMTP authentication failed; check spring.mail credentials", e);
            return SendResult.transientError("SMTP authentication failed");
        } catch (MailException e) {
            return SendResult.transientError("SMTP error: " + e.getMessage());
        }
    }

    private MimeMessage toMime(EmailMessage message) throws MessagingException {
        MimeMessage mime = mailSender.createMimeMessage();
        MimeMessageHelper helper = new MimeMessageHelper(mime, true, StandardCharsets.UTF_8.name());
        helper.setFrom(message.from());
        helper.setTo(message.to());
        helper.setSubject(message.subject());
        helper.setText(message.textBody(), message.htmlBody());
        return mime;
    }

    private static boolean rejectsRecipient(MailSendException e) {
        for (Exception failure : e.getFailedMessages().values()) {
            if (failure instanceof SendFailedException sendFailed
                    && sendFailed.getInvalidAddresses() != null
                    && sendFailed.getInvalidAddresses().length > 0) {
                return true;
            }
        }
        return false;
    }
}
