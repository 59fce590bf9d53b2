package io.mediaplatform.event;

import com.github.f4b6a3.ulid.UlidCreator;
import io.mediaplatform.domain.MediaStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Emitted once for every committed status change of a media asset.
 *
 * <p>Payload attributes are {@code from} and {@code to}, holding the lowercase
 * status codes.
 */
public final class MediaStatusChanged implements DomainEvent {
    public static final String EVENT_TYPE = "StatusChanged";

    private final String eventId;
    private final UUID mediaId;
    private final MediaStatus from;
    private final MediaStatus to;
    private final Instant occurredAt;

    public MediaStatusChanged(String eventId, UUID mediaId, MediaStatus from, MediaStatus to, Instant occurredAt) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
        if (eventId.isEmpty()) {
            throw new IllegalArgumentException("eventId cannot be empty");
        }
        this.mediaId = Objects.requireNonNull(mediaId, "mediaId");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt");
    }

    /**
     * Creates an event with a fresh monotonic ULID as its identifier.
     */
    public static MediaStatusChanged of(UUID mediaId, MediaStatus from, MediaStatus to, Instant occurredAt) {
        return new MediaStatusChanged(UlidCreator.getMonotonicUlid().toString(), mediaId, from, to, occurredAt);
    }

    @Override
    public String eventId() {
        return eventId;
    }

    @Override
    public String eventType() {
        return EVENT_TYPE;
    }

    @Override
    public String aggregateId() {
        return mediaId.toString();
    }

    @Override
    public Instant occurredAt() {
        return occurredAt;
    }

    @Override
    public Map<String, String> attributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("from", from.code());
        attributes.put("to", to.code());
        return Collections.unmodifiableMap(attributes);
    }

    public UUID mediaId() {
        return mediaId;
    }

    public MediaStatus from() {
        return from;
    }

    public MediaStatus to() {
        return to;
    }

    @Override
    public String toString() {
        return "MediaStatusChanged{eventId=" + eventId + ", mediaId=" + mediaId
            + ", from=" + from.code() + ", to=" + to.code() + ", occurredAt=" + occurredAt + '}';
    }
}
