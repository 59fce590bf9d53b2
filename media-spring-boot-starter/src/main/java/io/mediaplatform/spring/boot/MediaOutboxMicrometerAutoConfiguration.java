package io.mediaplatform.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.mediaplatform.micrometer.MicrometerMetricsExporter;
import io.mediaplatform.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the publisher's Micrometer metrics.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code media.outbox.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link MediaOutboxAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the publisher.
 */
@AutoConfiguration(before = MediaOutboxAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "media.outbox.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MediaOutboxProperties.class)
public class MediaOutboxMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, MediaOutboxProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
