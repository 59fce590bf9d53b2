package io.mediaplatform.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.mediaplatform.jdbc.DataSourceConnectionProvider;
import io.mediaplatform.jdbc.TableNames;
import io.mediaplatform.jdbc.media.JdbcMediaStore;
import io.mediaplatform.jdbc.store.AbstractJdbcOutboxStore;
import io.mediaplatform.jdbc.store.JdbcOutboxStores;
import io.mediaplatform.jdbc.tx.JdbcTransactionManager;
import io.mediaplatform.kafka.KafkaBrokerClient;
import io.mediaplatform.micrometer.ProducerMetricsBinder;
import io.mediaplatform.outbox.OutboxPublisher;
import io.mediaplatform.producer.BrokerClient;
import io.mediaplatform.producer.MessageProducer;
import io.mediaplatform.producer.ProducerConfig;
import io.mediaplatform.service.MediaService;
import io.mediaplatform.spi.ConnectionProvider;
import io.mediaplatform.spi.MediaStore;
import io.mediaplatform.spi.MetricsExporter;
import io.mediaplatform.spi.OutboxStore;
import io.mediaplatform.spi.TransactionManager;

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

import javax.sql.DataSource;

/**
 * Auto-configuration for the media outbox.
 *
 * <p>Wires the media write path ({@link MediaService}), the Kafka-backed
 * {@link MessageProducer} and the background {@link OutboxPublisher} from a
 * {@link DataSource} and {@link MediaOutboxProperties}. Every bean backs off when the
 * application defines its own.
 *
 * @see MediaOutboxProperties
 * @see MediaOutboxMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(MediaService.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MediaOutboxProperties.class)
public class MediaOutboxAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TransactionManager.class)
  public JdbcTransactionManager mediaTransactionManager(ConnectionProvider connectionProvider) {
    return new JdbcTransactionManager(connectionProvider);
  }

  @Bean
  @ConditionalOnMissingBean(MediaStore.class)
  public JdbcMediaStore mediaStore(MediaOutboxProperties props) {
    return new JdbcMediaStore(props.getMediaTable());
  }

  @Bean
  @ConditionalOnMissingBean(OutboxStore.class)
  public AbstractJdbcOutboxStore outboxStore(DataSource dataSource, MediaOutboxProperties props) {
    AbstractJdbcOutboxStore detected = JdbcOutboxStores.detect(dataSource);
    if (!TableNames.DEFAULT_OUTBOX_TABLE.equals(props.getOutboxTable())) {
      return detected.withTableName(props.getOutboxTable());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean
  public ProducerConfig mediaProducerConfig(MediaOutboxProperties props) {
    MediaOutboxProperties.Kafka kafka = props.getKafka();
    return ProducerConfig.builder()
        .brokers(kafka.getBrokers())
        .topic(kafka.getTopic())
        .maxRetries(kafka.getMaxRetries())
        .retryBackoff(kafka.getRetryBackoff())
        .writeTimeout(kafka.getWriteTimeout())
        .batchSize(kafka.getBatchSize())
        .async(kafka.isAsync())
        .closeTimeout(kafka.getCloseTimeout())
        .clientProperties(kafka.getProperties())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean(BrokerClient.class)
  public KafkaBrokerClient brokerClient(ProducerConfig producerConfig) {
    return new KafkaBrokerClient(producerConfig);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MessageProducer messageProducer(ProducerConfig producerConfig, BrokerClient brokerClient) {
    return new MessageProducer(producerConfig, brokerClient);
  }

  @Bean
  @ConditionalOnMissingBean
  public MediaService mediaService(MediaStore mediaStore, OutboxStore outboxStore,
      TransactionManager mediaTransactionManager, ConnectionProvider connectionProvider) {
    return new MediaService(mediaStore, outboxStore, mediaTransactionManager, connectionProvider);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "media.outbox.publisher", name = "enabled", matchIfMissing = true)
  public OutboxPublisher outboxPublisher(MediaOutboxProperties props,
      ConnectionProvider connectionProvider,
      OutboxStore outboxStore,
      MessageProducer messageProducer,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = OutboxPublisher.builder()
        .connectionProvider(connectionProvider)
        .outboxStore(outboxStore)
        .producer(messageProducer)
        .interval(props.getPublisher().getInterval())
        .batchSize(props.getPublisher().getBatchSize());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    var cl = props.getClaimLocking();
    if (cl.isEnabled()) {
      if (cl.getOwnerId() != null && !cl.getOwnerId().isEmpty()) {
        builder.claimLocking(cl.getOwnerId(), cl.getLockTimeout());
      } else {
        builder.claimLocking(cl.getLockTimeout());
      }
    }
    return builder.build();
  }

  /**
   * Producer meters, bound by Spring Boot's meter registry post-processing.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass({ProducerMetricsBinder.class, MeterRegistry.class})
  @ConditionalOnProperty(prefix = "media.outbox.metrics", name = "enabled", matchIfMissing = true)
  static class ProducerMetricsConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ProducerMetricsBinder producerMetricsBinder(MessageProducer messageProducer) {
      return new ProducerMetricsBinder(messageProducer);
    }
  }
}
