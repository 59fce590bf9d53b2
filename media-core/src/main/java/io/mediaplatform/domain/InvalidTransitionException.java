package io.mediaplatform.domain;

/**
 * Thrown when a status change is not permitted by {@link StatusTransitions}.
 */
public class InvalidTransitionException extends RuntimeException {
  private final MediaStatus from;
  private final MediaStatus to;

  public InvalidTransitionException(MediaStatus from, MediaStatus to) {
    super("Invalid status transition: " + from.code() + " -> " + to.code());
    this.from = from;
    this.to = to;
  }

  public MediaStatus from() {
    return from;
  }

  public MediaStatus to() {
    return to;
  }
}
