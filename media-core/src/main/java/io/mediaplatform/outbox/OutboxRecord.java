package io.mediaplatform.outbox;

import java.time.Instant;

/**
 * Read-only view of one outbox row.
 *
 * @param id          store-assigned sequence id; delivery follows ascending id
 * @param eventId     unique event id, used as the message key
 * @param eventType   event type tag
 * @param aggregateId id of the aggregate the event belongs to
 * @param payload     serialized event, published as the message value
 * @param occurredAt  when the event happened
 * @param processedAt when the record was delivered, {@code null} while pending
 */
public record OutboxRecord(
    long id,
    String eventId,
    String eventType,
    String aggregateId,
    String payload,
    Instant occurredAt,
    Instant processedAt
) {
  public boolean isPending() {
    return processedAt == null;
  }
}
