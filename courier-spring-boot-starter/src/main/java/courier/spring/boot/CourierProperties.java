package courier.spring.boot;

import courier.retry.BackoffStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for courier, bound from the {@code courier} prefix.
 *
 * @see CourierAutoConfiguration
 * @see CourierTravelAutoConfiguration
 */
@ConfigurationProperties(prefix = "courier")
public class CourierProperties {

    private final Broker broker = new Broker();
    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final Dispatch dispatch = new Dispatch();
    private final Notifications notifications = new Notifications();
    private final Chapa chapa = new Chapa();
    private final Metrics metrics = new Metrics();

    public Broker getBroker() {
        return broker;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public Chapa getChapa() {
        return chapa;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum BrokerType {
        /** Process-local queues; tasks are lost on restart. */
        MEMORY,
        /** Queue table in the application's {@code DataSource}. */
        JDBC
    }

    public static class Broker {
        private BrokerType type = BrokerType.MEMORY;
        private String tableName = "courier_message";
        private Duration leaseTimeout = Duration.ofMinutes(5);
        private Duration pollInterval = Duration.ofMillis(200);

        public BrokerType getType() {
            return type;
        }

        public void setType(BrokerType type) {
            this.type = type;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public Duration getLeaseTimeout() {
            return leaseTimeout;
        }

        public void setLeaseTimeout(Duration leaseTimeout) {
            this.leaseTimeout = leaseTimeout;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    public static class Worker {
        /**
         * When false the application only dispatches; tasks are consumed by another process.
         */
        private boolean enabled = true;
        private int concurrency = 4;
        private List<String> queues = new ArrayList<>(List.of("emails"));
        private Duration gracePeriod = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public List<String> getQueues() {
            return queues;
        }

        public void setQueues(List<String> queues) {
            this.queues = queues;
        }

        public Duration getGracePeriod() {
            return gracePeriod;
        }

        public void setGracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
        }
    }

    public static class Retry {
        /**
         * Ceiling applied to every computed redelivery delay.
         */
        private Duration maxDelay = Duration.ofMinutes(10);

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Dispatch {
        private int enqueueAttempts = 3;
        private Duration enqueueBackoff = Duration.ofMillis(200);

        public int getEnqueueAttempts() {
            return enqueueAttempts;
        }

        public void setEnqueueAttempts(int enqueueAttempts) {
            this.enqueueAttempts = enqueueAttempts;
        }

        public Duration getEnqueueBackoff() {
            return enqueueBackoff;
        }

        public void setEnqueueBackoff(Duration enqueueBackoff) {
            this.enqueueBackoff = enqueueBackoff;
        }
    }

    public static class Notifications {
        private boolean enabled = true;
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(60);
        private BackoffStrategy backoff = BackoffStrategy.EXPONENTIAL;
        private String queue = "emails";
        private String fromAddress;
        private String signature = "The Travel Team";
        private String timeZone = "UTC";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public BackoffStrategy getBackoff() {
            return backoff;
        }

        public void setBackoff(BackoffStrategy backoff) {
            this.backoff = backoff;
        }

        public String getQueue() {
            return queue;
        }

        public void setQueue(String queue) {
            this.queue = queue;
        }

        public String getFromAddress() {
            return fromAddress;
        }

        public void setFromAddress(String fromAddress) {
            this.fromAddress = fromAddress;
        }

        public String getSignature() {
            return signature;
        }

        public void setSignature(String signature) {
            this.signature = signature;
        }

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }
    }

    public static class Chapa {
        private String secretKey;
        private String webhookSecret;
        private String baseUrl = "https://api.chapa.co/v1";
        private Duration timeout = Duration.ofSeconds(30);

        public String getSecretKey() {
            return secretKey;
        }

        public void setSecretKey(String secretKey) {
            this.secretKey = secretKey;
        }

        public String getWebhookSecret() {
            return webhookSecret;
        }

        public void setWebhookSecret(String webhookSecret) {
            this.webhookSecret = webhookSecret;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "courier";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
