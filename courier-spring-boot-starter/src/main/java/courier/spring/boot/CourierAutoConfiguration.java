package courier.spring.boot;

import courier.Courier;
import courier.TaskDispatcher;
import courier.broker.InMemoryBroker;
import courier.jdbc.DataSourceConnectionProvider;
import courier.jdbc.broker.AbstractJdbcQueueStore;
import courier.jdbc.broker.JdbcBroker;
import courier.jdbc.broker.JdbcQueueStores;
import courier.registry.DefaultTaskRegistry;
import courier.registry.TaskRegistry;
import courier.spi.BrokerTransport;
import courier.spi.ConnectionProvider;
import courier.spi.MetricsExporter;
import courier.spi.TxContext;
import courier.spring.SpringTxContext;
import courier.worker.DeliveryObserver;
import courier.worker.TaskInterceptor;
import org.springframework.beans.factory.ListableBeanFactory;
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
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;

/**
 * Auto-configuration for courier.
 *
 * <p>Wires a {@link Courier} from {@link CourierProperties}: the broker selected by
 * {@code courier.broker.type}, a task registry filled by {@link TaskRegistryCustomizer} beans
 * and {@link CourierTask @CourierTask} handlers, and a worker pool unless
 * {@code courier.worker.enabled} is false.
 *
 * @see CourierProperties
 * @see CourierMicrometerAutoConfiguration
 * @see CourierTravelAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Courier.class)
@EnableConfigurationProperties(CourierProperties.class)
public class CourierAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "courier.broker", name = "type", havingValue = "MEMORY", matchIfMissing = true)
    static class MemoryBrokerConfiguration {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean(BrokerTransport.class)
        public InMemoryBroker courierBroker() {
            return new InMemoryBroker();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "courier.broker", name = "type", havingValue = "JDBC")
    @ConditionalOnBean(DataSource.class)
    static class JdbcBrokerConfiguration {

        @Bean
        @ConditionalOnMissingBean(ConnectionProvider.class)
        public DataSourceConnectionProvider courierConnectionProvider(DataSource dataSource) {
            return new DataSourceConnectionProvider(dataSource);
        }

        @Bean
        @ConditionalOnMissingBean
        public AbstractJdbcQueueStore courierQueueStore(ConnectionProvider connectionProvider,
                                                        CourierProperties props) {
            AbstractJdbcQueueStore detected = JdbcQueueStores.detect(connectionProvider);
            String tableName = props.getBroker().getTableName();
            return tableName.equals(detected.tableName()) ? detected : detected.withTableName(tableName);
        }

        @Bean
        @ConditionalOnMissingBean(BrokerTransport.class)
        public JdbcBroker courierBroker(ConnectionProvider connectionProvider,
                                        AbstractJdbcQueueStore store,
                                        CourierProperties props) {
            return JdbcBroker.builder()
                    .connectionProvider(connectionProvider)
                    .store(store)
                    .leaseTimeout(props.getBroker().getLeaseTimeout())
                    .pollInterval(props.getBroker().getPollInterval())
                    .build();
        }
    }

    @Bean
    @ConditionalOnMissingBean(TxContext.class)
    @ConditionalOnClass(TransactionSynchronizationManager.class)
    public SpringTxContext courierTxContext() {
        return new SpringTxContext();
    }

    @Bean
    @ConditionalOnMissingBean
    public CourierTaskScanner courierTaskScanner(ListableBeanFactory beanFactory) {
        return new CourierTaskScanner(beanFactory);
    }

    @Bean
    @ConditionalOnMissingBean(TaskRegistry.class)
    public DefaultTaskRegistry courierTaskRegistry(ObjectProvider<TaskRegistryCustomizer> customizers,
                                                   CourierTaskScanner scanner) {
        DefaultTaskRegistry.Builder builder = DefaultTaskRegistry.builder();
        customizers.orderedStream().forEach(customizer -> customizer.customize(builder));
        scanner.registerAll(builder);
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Courier courier(CourierProperties props,
                           BrokerTransport broker,
                           TaskRegistry registry,
                           ObjectProvider<MetricsExporter> metricsProvider,
                           ObjectProvider<TaskInterceptor> interceptorProvider,
                           ObjectProvider<DeliveryObserver> observerProvider) {
        CourierProperties.Worker worker = props.getWorker();
        Courier.Builder builder = Courier.builder()
                .broker(broker)
                .registry(registry)
                .concurrency(worker.isEnabled() ? worker.getConcurrency() : 0)
                .queues(worker.getQueues())
                .gracePeriod(worker.getGracePeriod())
                .maxRetryDelay(props.getRetry().getMaxDelay())
                .enqueueAttempts(props.getDispatch().getEnqueueAttempts())
                .enqueueBackoff(props.getDispatch().getEnqueueBackoff());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        interceptorProvider.orderedStream().forEach(builder::interceptor);
        observerProvider.orderedStream().forEach(builder::observer);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskDispatcher courierDispatcher(Courier courier) {
        return courier.dispatcher();
    }
}
