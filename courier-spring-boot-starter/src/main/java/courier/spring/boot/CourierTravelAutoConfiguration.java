package courier.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import courier.TaskDispatcher;
import courier.jdbc.DataSourceConnectionProvider;
import courier.retry.RetryPolicy;
import courier.spring.mail.JavaMailSenderEmailSender;
import courier.travel.TravelNotifications;
import courier.travel.booking.BookingDirectory;
import courier.travel.mail.EmailSender;
import courier.travel.notification.EmailTemplates;
import courier.travel.payment.InMemoryReconciliationStore;
import courier.travel.payment.JdbcReconciliationStore;
import courier.travel.payment.PaymentGateway;
import courier.travel.payment.PaymentReconciler;
import courier.travel.payment.ReconciliationListener;
import courier.travel.payment.ReconciliationStore;
import courier.travel.payment.WebhookSignatureVerifier;
import courier.travel.payment.chapa.ChapaPaymentGateway;
import courier.travel.payment.chapa.ChapaWebhookHandler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import javax.sql.DataSource;
import java.time.ZoneId;

/**
 * Auto-configuration for the travel notification handlers and payment reconciliation.
 *
 * <p>Notification tasks are registered when the application defines a {@link BookingDirectory}
 * bean and {@code courier.notifications.enabled} is true (default). Mail goes through an
 * {@link EmailSender} bean, or through Spring's {@link JavaMailSender} when no sender is
 * defined. Chapa reconciliation is enabled by {@code courier.chapa.secret-key}; the webhook
 * handler additionally needs {@code courier.chapa.webhook-secret}.
 *
 * <p>Runs before {@link CourierAutoConfiguration} so the registrations reach the task registry.
 */
@AutoConfiguration(before = CourierAutoConfiguration.class,
        after = DataSourceAutoConfiguration.class,
        afterName = "org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration")
@ConditionalOnClass(TravelNotifications.class)
@EnableConfigurationProperties(CourierProperties.class)
public class CourierTravelAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JavaMailSender.class)
    static class JavaMailConfiguration {

        @Bean
        @ConditionalOnBean(JavaMailSender.class)
        @ConditionalOnMissingBean(EmailSender.class)
        public JavaMailSenderEmailSender courierEmailSender(JavaMailSender mailSender) {
            return new JavaMailSenderEmailSender(mailSender);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(BookingDirectory.class)
    @ConditionalOnProperty(prefix = "courier.notifications", name = "enabled", matchIfMissing = true)
    static class NotificationConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EmailTemplates courierEmailTemplates(CourierProperties props) {
            CourierProperties.Notifications notifications = props.getNotifications();
            String from = notifications.getFromAddress();
            if (from == null || from.isBlank()) {
                throw new IllegalStateException(
                        "courier.notifications.from-address must be set when notifications are enabled");
            }
            return new EmailTemplates(from, notifications.getSignature(), ZoneId.of(notifications.getTimeZone()));
        }

        @Bean
        public TaskRegistryCustomizer travelNotificationTasks(CourierProperties props,
                                                              BookingDirectory directory,
                                                              ObjectProvider<EmailSender> senderProvider,
                                                              EmailTemplates templates) {
            CourierProperties.Notifications notifications = props.getNotifications();
            RetryPolicy policy = new RetryPolicy(notifications.getMaxRetries(),
                    notifications.getBaseDelay(), notifications.getBackoff());
            EmailSender sender = senderProvider.getIfAvailable();
            if (sender == null) {
                throw new IllegalStateException(
                        "Notifications need an EmailSender bean or spring.mail.host for JavaMailSender");
            }
            return registry -> TravelNotifications.register(registry, directory, sender, templates,
                    policy, notifications.getQueue());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "courier.chapa", name = "secret-key")
    static class ChapaConfiguration {

        @Bean
        @ConditionalOnMissingBean(PaymentGateway.class)
        public ChapaPaymentGateway chapaPaymentGateway(CourierProperties props,
                                                       ObjectProvider<ObjectMapper> objectMapper) {
            CourierProperties.Chapa chapa = props.getChapa();
            return ChapaPaymentGateway.builder()
                    .secretKey(chapa.getSecretKey())
                    .baseUrl(chapa.getBaseUrl())
                    .timeout(chapa.getTimeout())
                    .objectMapper(objectMapper.getIfAvailable())
                    .build();
        }

        @Bean
        @ConditionalOnMissingBean
        public ReconciliationStore courierReconciliationStore(ObjectProvider<DataSource> dataSource) {
            DataSource ds = dataSource.getIfAvailable();
            return ds != null
                    ? new JdbcReconciliationStore(new DataSourceConnectionProvider(ds))
                    : new InMemoryReconciliationStore();
        }

        @Bean
        @ConditionalOnMissingBean
        public PaymentReconciler paymentReconciler(PaymentGateway gateway,
                                                   TaskDispatcher dispatcher,
                                                   ReconciliationStore store,
                                                   ObjectProvider<BookingDirectory> directory,
                                                   ObjectProvider<ReconciliationListener> listener) {
            return PaymentReconciler.builder()
                    .gateway(gateway)
                    .dispatcher(dispatcher)
                    .store(store)
                    .directory(directory.getIfAvailable())
                    .listener(listener.getIfAvailable(() -> ReconciliationListener.NOOP))
                    .build();
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(prefix = "courier.chapa", name = "webhook-secret")
        public ChapaWebhookHandler chapaWebhookHandler(PaymentReconciler reconciler,
                                                       CourierProperties props,
                                                       ObjectProvider<ObjectMapper> objectMapper) {
            return new ChapaWebhookHandler(reconciler,
                    new WebhookSignatureVerifier(props.getChapa().getWebhookSecret()),
                    objectMapper.getIfAvailable(ObjectMapper::new));
        }
    }
}
