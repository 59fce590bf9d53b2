package io.mediaplatform.event;

/**
 * Thrown when a domain event cannot be turned into an outbox payload.
 */
public class EventSerializationException extends RuntimeException {

    public EventSerializationException(String message) {
        super(message);
    }

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
