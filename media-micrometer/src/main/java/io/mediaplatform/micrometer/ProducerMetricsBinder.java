package io.mediaplatform.micrometer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.TimeGauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.mediaplatform.producer.MessageProducer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Exposes a {@link MessageProducer}'s counters and health through Micrometer.
 *
 * <ul>
 *   <li>{@code media.producer.messages.published} / {@code .messages.failed} / {@code .retries}</li>
 *   <li>{@code media.producer.publish.time.avg} - average duration of a successful publish call</li>
 *   <li>{@code media.producer.broker.writes} / {@code .broker.errors} - lifetime broker client counters</li>
 *   <li>{@code media.producer.healthy} - 1 when {@link MessageProducer#healthCheck()} passes, else 0</li>
 * </ul>
 *
 * <p>Meters read the producer on scrape; nothing is pushed.
 */
public final class ProducerMetricsBinder implements MeterBinder {
    public static final String DEFAULT_PREFIX = "media.producer";

    private final MessageProducer producer;
    private final String namePrefix;

    public ProducerMetricsBinder(MessageProducer producer) {
        this(producer, DEFAULT_PREFIX);
    }

    public ProducerMetricsBinder(MessageProducer producer, String namePrefix) {
        this.producer = Objects.requireNonNull(producer, "producer");
        MeterNames.validatePrefix(namePrefix);
        this.namePrefix = namePrefix;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        String topic = producer.config().topic();
        FunctionCounter.builder(namePrefix + ".messages.published", producer, p -> p.metrics().messagesPublished())
                .description("Messages published successfully")
                .tag("topic", topic)
                .register(registry);
        FunctionCounter.builder(namePrefix + ".messages.failed", producer, p -> p.metrics().messagesFailed())
                .description("Messages that could not be published")
                .tag("topic", topic)
                .register(registry);
        FunctionCounter.builder(namePrefix + ".retries", producer, p -> p.metrics().retriesTotal())
                .description("Retry attempts")
                .tag("topic", topic)
                .register(registry);
        TimeGauge.builder(namePrefix + ".publish.time.avg", producer, TimeUnit.NANOSECONDS,
                        p -> p.metrics().averagePublishTime().toNanos())
                .description("Average duration of a successful publish call")
                .tag("topic", topic)
                .register(registry);
        FunctionCounter.builder(namePrefix + ".broker.writes", producer, p -> p.healthCheck().writes())
                .description("Broker write calls")
                .tag("topic", topic)
                .register(registry);
        FunctionCounter.builder(namePrefix + ".broker.errors", producer, p -> p.healthCheck().errors())
                .description("Failed broker write calls")
                .tag("topic", topic)
                .register(registry);
        Gauge.builder(namePrefix + ".healthy", producer, p -> p.healthCheck().healthy() ? 1 : 0)
                .description("1 when the producer is healthy, 0 otherwise")
                .tag("topic", topic)
                .register(registry);
    }
}
