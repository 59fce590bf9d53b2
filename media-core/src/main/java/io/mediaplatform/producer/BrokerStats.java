package io.mediaplatform.producer;

/**
 * Lifetime counters reported by a {@link BrokerClient}.
 *
 * @param writes   write calls issued
 * @param messages messages handed to the broker
 * @param errors   write calls that failed
 */
public record BrokerStats(long writes, long messages, long errors) {
  public static final BrokerStats EMPTY = new BrokerStats(0, 0, 0);
}
