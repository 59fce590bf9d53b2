package io.mediaplatform.producer;

/**
 * Result of {@link MessageProducer#healthCheck()}.
 *
 * <p>The error rate is computed over the broker client's lifetime counters, not a
 * sliding window. A burst of early failures keeps the producer unhealthy until
 * enough successful writes dilute it.
 *
 * @param healthy whether the producer should be considered usable
 * @param reason  why it is unhealthy, {@code null} when healthy
 * @param writes  lifetime write calls reported by the broker client
 * @param errors  lifetime failed write calls reported by the broker client
 */
public record ProducerHealth(boolean healthy, String reason, long writes, long errors) {

  static ProducerHealth up(BrokerStats stats) {
    return new ProducerHealth(true, null, stats.writes(), stats.errors());
  }

  static ProducerHealth down(String reason, BrokerStats stats) {
    return new ProducerHealth(false, reason, stats.writes(), stats.errors());
  }
}
