package io.mediaplatform.event;

import io.mediaplatform.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a {@link DomainEvent} into the flat JSON object stored in the outbox and
 * published to the broker:
 *
 * <pre>{@code
 * {"event_id":"01H...","event_type":"StatusChanged","aggregate_id":"3f2a...",
 *  "occurred_at":"2024-01-01T00:00:00Z","from":"uploaded","to":"processing"}
 * }</pre>
 */
public final class EventSerializer {
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB

    public static final String EVENT_ID = "event_id";
    public static final String EVENT_TYPE = "event_type";
    public static final String AGGREGATE_ID = "aggregate_id";
    public static final String OCCURRED_AT = "occurred_at";

    private static final Set<String> RESERVED = Set.of(EVENT_ID, EVENT_TYPE, AGGREGATE_ID, OCCURRED_AT);

    private final JsonCodec jsonCodec;

    public EventSerializer() {
        this(JsonCodec.getDefault());
    }

    public EventSerializer(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    /**
     * @throws EventSerializationException if an attribute clashes with an envelope field,
     *                                     the codec fails, or the result exceeds
     *                                     {@value #MAX_PAYLOAD_BYTES} bytes
     */
    public String serialize(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(EVENT_ID, event.eventId());
        fields.put(EVENT_TYPE, event.eventType());
        fields.put(AGGREGATE_ID, event.aggregateId());
        fields.put(OCCURRED_AT, event.occurredAt().toString());
        for (Map.Entry<String, String> attribute : event.attributes().entrySet()) {
            if (RESERVED.contains(attribute.getKey())) {
                throw new EventSerializationException(
                    "Attribute '" + attribute.getKey() + "' of event " + event.eventId() + " clashes with an envelope field");
            }
            fields.put(attribute.getKey(), attribute.getValue());
        }

        String json;
        try {
            json = jsonCodec.toJson(fields);
        } catch (RuntimeException e) {
            throw new EventSerializationException("Failed to serialize event " + event.eventId(), e);
        }
        if (json.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
            throw new EventSerializationException(
                "Payload of event " + event.eventId() + " exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
        }
        return json;
    }

    /**
     * Parses a payload produced by {@link #serialize}.
     *
     * @throws EventSerializationException if the payload is not a flat JSON object
     *                                     carrying the envelope fields
     */
    public Map<String, String> parse(String payload) {
        Map<String, String> fields;
        try {
            fields = jsonCodec.parseObject(payload);
        } catch (RuntimeException e) {
            throw new EventSerializationException("Malformed event payload", e);
        }
        for (String field : RESERVED) {
            if (!fields.containsKey(field)) {
                throw new EventSerializationException("Event payload is missing '" + field + "'");
            }
        }
        try {
            Instant.parse(fields.get(OCCURRED_AT));
        } catch (DateTimeParseException e) {
            throw new EventSerializationException("Event payload has an invalid '" + OCCURRED_AT + "'", e);
        }
        return fields;
    }
}
