package io.mediaplatform.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MediaOutboxPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(MediaOutboxProperties.class);
            assertEquals("outbox", props.getOutboxTable());
            assertEquals("media", props.getMediaTable());
            assertTrue(props.getKafka().getBrokers().isEmpty());
            assertNull(props.getKafka().getTopic());
            assertEquals(3, props.getKafka().getMaxRetries());
            assertEquals(Duration.ofMillis(100), props.getKafka().getRetryBackoff());
            assertEquals(Duration.ofSeconds(10), props.getKafka().getWriteTimeout());
            assertEquals(100, props.getKafka().getBatchSize());
            assertFalse(props.getKafka().isAsync());
            assertEquals(Duration.ofSeconds(30), props.getKafka().getCloseTimeout());
            assertTrue(props.getPublisher().isEnabled());
            assertEquals(Duration.ofSeconds(5), props.getPublisher().getInterval());
            assertEquals(100, props.getPublisher().getBatchSize());
            assertFalse(props.getClaimLocking().isEnabled());
            assertEquals(Duration.ofMinutes(5), props.getClaimLocking().getLockTimeout());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("media.outbox", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void bindsCustomValues() {
        runner.withPropertyValues(
                "media.outbox.outbox-table=media_outbox",
                "media.outbox.kafka.brokers=kafka-1:9092,kafka-2:9092",
                "media.outbox.kafka.topic=media-events",
                "media.outbox.kafka.max-retries=0",
                "media.outbox.publisher.interval=500ms",
                "media.outbox.publisher.batch-size=25",
                "media.outbox.claim-locking.enabled=true",
                "media.outbox.claim-locking.owner-id=pod-7",
                "media.outbox.metrics.name-prefix=assets.outbox").run(ctx -> {
            var props = ctx.getBean(MediaOutboxProperties.class);
            assertEquals("media_outbox", props.getOutboxTable());
            assertEquals(List.of("kafka-1:9092", "kafka-2:9092"), props.getKafka().getBrokers());
            assertEquals("media-events", props.getKafka().getTopic());
            assertEquals(0, props.getKafka().getMaxRetries());
            assertEquals(Duration.ofMillis(500), props.getPublisher().getInterval());
            assertEquals(25, props.getPublisher().getBatchSize());
            assertTrue(props.getClaimLocking().isEnabled());
            assertEquals("pod-7", props.getClaimLocking().getOwnerId());
            assertEquals("assets.outbox", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(MediaOutboxProperties.class)
    static class PropsConfig {
    }
}
