package courier.travel.mail;

import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EmailSender} that talks SMTP through Jakarta Mail.
 *
 * <p>Address syntax errors and recipients refused by the server are permanent; every other
 * {@link MessagingException} (connection refused, timeout, temporary rejection) is transient.
 *
 * <pre>{@code
 * EmailSender sender = JakartaMailEmailSender.builder()
 *     .host("smtp.example.com")
 *     .credentials("notifications@example.com", password)
 *     .build();
 * }</pre>
 */
public final class JakartaMailEmailSender implements EmailSender {
    private static final Logger logger = Logger.getLogger(JakartaMailEmailSender.class.getName());

    private final Session session;

    public JakartaMailEmailSender(Session session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public SendResult send(EmailMessage message) {
        Objects.requireNonNull(message, "message");
        MimeMessage mime;
        try {
            mime = toMime(message);
        } catch (AddressException e) {
            return SendResult.permanentError("Invalid address: " + e.getMessage());
        } catch (MessagingException e) {
            return SendResult.permanentError("Cannot build message: " + e.getMessage());
        }
        try {
            Transport.send(mime);
            logger.log(Level.FINE, "Sent \"{0}\" to {1}", new Object[] {message.subject(), message.to()});
            return SendResult.sent();
        } catch (SendFailedException e) {
            if (e.getInvalidAddresses() != null && e.getInvalidAddresses().length > 0) {
                return SendResult.permanentError("Recipient rejected: " + message.to());
            }
            return SendResult.transientError("Send failed: " + e.getMessage());
        } catch (MessagingException e) {
            return SendResult.transientError("SMTP error: " + e.getMessage());
        }
    }

    private MimeMessage toMime(EmailMessage message) throws MessagingException {
        MimeMessage mime = new MimeMessage(session);
        mime.setFrom(new InternetAddress(message.from(), true));
        mime.setRecipients(Message.RecipientType.TO, InternetAddress.parse(message.to(), true));
        mime.setSubject(message.subject(), StandardCharsets.UTF_8.name());

        MimeBodyPart text = new MimeBodyPart();
        text.setText(message.textBody(), StandardCharsets.UTF_8.name());
        MimeBodyPart html = new MimeBodyPart();
        html.setContent(message.htmlBody(), "text/html; charset=UTF-8");

        MimeMultipart alternative = new MimeMultipart("alternative");
        alternative.addBodyPart(text);
        alternative.addBodyPart(html);
        mime.setContent(alternative);
        return mime;
    }

    /**
     * Builder for an SMTP-backed sender.
     */
    public static final class Builder {
        private String host;
        private int port = 587;
        private String username;
        private String password;
        private boolean startTls = true;
        private Duration timeout = Duration.ofSeconds(30);

        private Builder() {
        }

        /**
         * <b>Required.</b> SMTP host.
         */
        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /**
         * Optional. Defaults to 587.
         */
        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("port must be in 1..65535, got " + port);
            }
            this.port = port;
            return this;
        }

        /**
         * Optional. Enables SMTP authentication when set.
         */
        public Builder credentials(String username, String password) {
            this.username = Objects.requireNonNull(username, "username");
            this.password = Objects.requireNonNull(password, "password");
            return this;
        }

        /**
         * Optional. Defaults to {@code true}.
         */
        public Builder startTls(boolean startTls) {
            this.startTls = startTls;
            return this;
        }

        /**
         * Optional. Connect, read and write timeout. Defaults to 30 seconds.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public JakartaMailEmailSender build() {
            Objects.requireNonNull(host, "host");
            Properties props = new Properties();
            props.put("mail.smtp.host", host);
            props.put("mail.smtp.port", Integer.toString(port));
            props.put("mail.smtp.starttls.enable", Boolean.toString(startTls));
            String millis = Long.toString(timeout.toMillis());
            props.put("mail.smtp.connectiontimeout", millis);
            props.put("mail.smtp.timeout", millis);
            props.put("mail.smtp.writetimeout", millis);
            Session session;
            if (username != null) {
                props.put("mail.smtp.auth", "true");
                String user = username;
                String secret = password;
                session = Session.getInstance(props, new Authenticator() {
                    @Override
                    protected PasswordAuthentication getPasswordAuthentication() {
                        return new PasswordAuthentication(user, secret);
                    }
                });
            } else {
                session = Session.getInstance(props);
            }
            return new JakartaMailEmailSender(session);
        }
    }
}
