package io.mediaplatform.event;

import java.time.Instant;
import java.util.Map;

/**
 * A fact about an aggregate that downstream systems must eventually learn about.
 *
 * <p>Implementations are immutable. The {@link #attributes()} map carries the
 * type-specific part of the payload and is merged into the serialized event by
 * {@link EventSerializer}.
 */
public interface DomainEvent {

    /** Unique, caller-generated identifier. Consumers deduplicate on it. */
    String eventId();

    /** Type tag, e.g. {@code StatusChanged}. */
    String eventType();

    /** Identifier of the aggregate this event belongs to. */
    String aggregateId();

    Instant occurredAt();

    /**
     * Type-specific payload fields.
     *
     * @return an unmodifiable map, never {@code null}
     */
    Map<String, String> attributes();
}
