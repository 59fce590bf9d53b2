package io.mediaplatform.producer;

import java.util.Objects;

/**
 * Terminal failure of a publish call.
 */
public class PublishException extends Exception {

  public enum Reason {
    /** The producer was closed before the call. No attempt was made. */
    CLOSED,
    /** Every allowed attempt failed with a retriable error. */
    RETRIES_EXHAUSTED,
    /** The broker reported an error that retrying cannot fix. */
    NON_RETRIABLE,
    /** The calling thread was interrupted while waiting. */
    CANCELLED
  }

  private final Reason reason;
  private final int attempts;

  public PublishException(Reason reason, String message, int attempts, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.attempts = attempts;
  }

  public Reason reason() {
    return reason;
  }

  /** Broker write attempts made before giving up. */
  public int attempts() {
    return attempts;
  }
}
