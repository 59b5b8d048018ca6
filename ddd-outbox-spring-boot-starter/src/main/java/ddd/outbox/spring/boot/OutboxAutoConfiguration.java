package ddd.outbox.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import ddd.outbox.Outbox;
import ddd.outbox.handler.DefaultHandlerRegistry;
import ddd.outbox.jdbc.ConnectionProvider;
import ddd.outbox.jdbc.DataSourceConnectionProvider;
import ddd.outbox.jdbc.JacksonPayloadCodec;
import ddd.outbox.jdbc.JdbcOutboxRepository;
import ddd.outbox.jdbc.PayloadCodec;
import ddd.outbox.jdbc.TxContext;
import ddd.outbox.jdbc.store.AbstractJdbcOutboxStore;
import ddd.outbox.jdbc.store.JdbcOutboxStores;
import ddd.outbox.processor.MessageProcessor;
import ddd.outbox.processor.Middlewares;
import ddd.outbox.processor.OutboxMiddleware;
import ddd.outbox.requeue.ExponentialBackoffRetryPolicy;
import ddd.outbox.spi.MetricsExporter;
import ddd.outbox.spi.OutboxRepository;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the outbox message processor.
 *
 * <p>Wires a {@link JdbcOutboxRepository} over the application's {@link DataSource}, joins
 * Spring-managed transactions through {@link SpringTxContext}, registers annotated handlers and
 * starts an {@link Outbox} composite configured from {@link OutboxProperties}.
 *
 * @see OutboxProperties
 * @see OutboxMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Outbox.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(OutboxProperties.class)
public class OutboxAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public PayloadCodec outboxPayloadCodec(ObjectProvider<ObjectMapper> objectMapper) {
    return JacksonPayloadCodec.builder()
        .objectMapper(objectMapper.getIfAvailable(JacksonPayloadCodec::defaultObjectMapper))
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcOutboxStore outboxStore(DataSource dataSource, OutboxProperties props,
      PayloadCodec payloadCodec) {
    return JdbcOutboxStores.detect(dataSource)
        .withTableName(props.getTableName())
        .withPayloadCodec(payloadCodec);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(OutboxRepository.class)
  public JdbcOutboxRepository outboxRepository(ConnectionProvider connectionProvider,
      TxContext txContext, AbstractJdbcOutboxStore outboxStore) {
    return JdbcOutboxRepository.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .store(outboxStore)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultHandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public OutboxHandlerRegistrar outboxHandlerRegistrar(ListableBeanFactory beanFactory,
      DefaultHandlerRegistry handlerRegistry) {
    return new OutboxHandlerRegistrar(beanFactory, handlerRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Outbox outbox(OutboxProperties props,
                       OutboxRepository outboxRepository,
                       DefaultHandlerRegistry handlerRegistry,
                       ObjectProvider<MetricsExporter> metricsProvider,
                       ObjectProvider<OutboxMiddleware> middlewareProvider) {
    OutboxProperties.Processor processor = props.getProcessor();
    var builder = Outbox.builder()
        .repository(outboxRepository)
        .handlerRegistry(handlerRegistry)
        .batchSize(processor.getDefaultBatchSize())
        .intervalMs(processor.getInterval().toMillis())
        .priorityOrder(processor.getPriorityOrder());

    if (processor.isLogDeliveries()) {
      builder.middleware(Middlewares.logging());
    }
    middlewareProvider.orderedStream().forEach(builder::middleware);
    // innermost, so the timeout bounds only the handler call
    if (processor.getHandlerTimeout() != null) {
      builder.middleware(Middlewares.timeout(processor.getHandlerTimeout()));
    }

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }

    OutboxProperties.Requeue requeue = props.getRequeue();
    if (requeue.isEnabled()) {
      builder.requeue(requeue.getMaxAttempts(), new ExponentialBackoffRetryPolicy(
              requeue.getBaseDelay().toMillis(), requeue.getMaxDelay().toMillis()))
          .requeueIntervalMs(requeue.getInterval().toMillis())
          .stuckTimeout(requeue.getStuckTimeout());
    }

    OutboxProperties.Purge purge = props.getPurge();
    if (purge.isEnabled()) {
      builder.purge(purge.getRetention())
          .purgeIntervalSeconds(purge.getInterval().toSeconds());
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageProcessor messageProcessor(Outbox outbox) {
    return outbox.processor();
  }

  @Bean
  @ConditionalOnMissingBean
  public OutboxLifecycle outboxLifecycle(Outbox outbox, OutboxProperties props) {
    return new OutboxLifecycle(outbox, props.getProcessor().isAutoStart());
  }
}
