package io.mediaplatform.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.mediaplatform.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of the outbox publisher's {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code media.outbox.published} - records published and marked processed</li>
 *   <li>{@code media.outbox.publish.failed} - records whose publish failed (left pending)</li>
 *   <li>{@code media.outbox.mark.failed} - records published but not marked (will be republished)</li>
 *   <li>{@code media.outbox.tick.failed} - publisher ticks that aborted</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code media.outbox.lag.oldest.ms} - age of the oldest record in the last batch</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
    public static final String DEFAULT_PREFIX = "media.outbox";

    private final MeterRegistry registry;
    private final Counter published;
    private final Counter publishFailed;
    private final Counter markFailed;
    private final Counter tickFailed;
    private final Gauge lagGauge;

    private final AtomicLong oldestLagMs = new AtomicLong();
    private volatile boolean closed;

    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "media.outbox"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        MeterNames.validatePrefix(namePrefix);

        this.registry = registry;
        this.published = Counter.builder(namePrefix + ".published")
                .description("Outbox records published and marked processed")
                .register(registry);
        this.publishFailed = Counter.builder(namePrefix + ".publish.failed")
                .description("Outbox records whose publish failed; they stay pending")
                .register(registry);
        this.markFailed = Counter.builder(namePrefix + ".mark.failed")
                .description("Outbox records published but not marked processed")
                .register(registry);
        this.tickFailed = Counter.builder(namePrefix + ".tick.failed")
                .description("Publisher ticks that aborted")
                .register(registry);
        this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
                .description("Age of the oldest pending record in the last batch")
                .register(registry);
    }

    @Override
    public void incrementPublished() {
        if (closed) return;
        published.increment();
    }

    @Override
    public void incrementPublishFailed() {
        if (closed) return;
        publishFailed.increment();
    }

    @Override
    public void incrementMarkFailed() {
        if (closed) return;
        markFailed.increment();
    }

    @Override
    public void incrementTickFailed() {
        if (closed) return;
        tickFailed.increment();
    }

    @Override
    public void recordOldestLagMs(long lagMs) {
        if (closed) return;
        oldestLagMs.set(lagMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        MeterNames.removeAll(registry, List.<Meter>of(published, publishFailed, markFailed, tickFailed, lagGauge));
    }
}
