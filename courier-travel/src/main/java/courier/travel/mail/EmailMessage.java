package courier.travel.mail;

import java.util.Objects;

/**
 * A single-recipient email with an HTML body and its plain-text alternative.
 *
 * @param from     sender address
 * @param to       recipient address
 * @param subject  subject line
 * @param htmlBody HTML body
 * @param textBody plain-text alternative
 */
public record EmailMessage(String from, String to, String subject, String htmlBody, String textBody) {

    public EmailMessage {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(htmlBody, "htmlBody");
        Objects.requireNonNull(textBody, "textBody");
    }

    /**
     * Creates a message whose text body is derived from the HTML body.
     */
    public static EmailMessage html(String from, String to, String subject, String htmlBody) {
        return new EmailMessage(from, to, subject, htmlBody, HtmlText.strip(htmlBody));
    }
}
