package io.mediaplatform.producer;

import java.time.Duration;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters owned by one {@link MessageProducer}. Safe for concurrent updates.
 */
final class ProducerMetrics {
  private final LongAdder published = new LongAdder();
  private final LongAdder failed = new LongAdder();
  private final LongAdder retries = new LongAdder();
  private final LongAdder publishNanos = new LongAdder();

  void recordPublished(int messages, long elapsedNanos) {
    published.add(messages);
    publishNanos.add(elapsedNanos);
  }

  void recordFailed(int messages) {
    failed.add(messages);
  }

  void recordRetry() {
    retries.increment();
  }

  MetricsSnapshot snapshot() {
    long publishedCount = published.sum();
    long totalNanos = publishNanos.sum();
    Duration average = publishedCount == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / publishedCount);
    return new MetricsSnapshot(publishedCount, failed.sum(), retries.sum(), Duration.ofNanos(totalNanos), average);
  }
}
