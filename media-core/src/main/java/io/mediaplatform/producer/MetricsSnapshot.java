package io.mediaplatform.producer;

import java.time.Duration;

/**
 * Point-in-time view of a producer's counters.
 *
 * @param messagesPublished  messages accepted by the broker
 * @param messagesFailed     messages that failed terminally (after retries, non-retriable, or cancelled)
 * @param retriesTotal       retry attempts issued
 * @param totalPublishTime   cumulative time spent in successful publish calls
 * @param averagePublishTime {@code totalPublishTime / messagesPublished}, zero when nothing was published
 */
public record MetricsSnapshot(
    long messagesPublished,
    long messagesFailed,
    long retriesTotal,
    Duration totalPublishTime,
    Duration averagePublishTime
) {}
