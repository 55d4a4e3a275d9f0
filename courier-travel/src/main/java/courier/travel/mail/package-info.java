/**
 * Outbound email boundary. Handlers depend on {@link courier.travel.mail.EmailSender} only;
 * {@link courier.travel.mail.JakartaMailEmailSender} is the SMTP implementation.
 */
package courier.travel.mail;
