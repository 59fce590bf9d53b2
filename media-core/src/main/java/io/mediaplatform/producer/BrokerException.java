package io.mediaplatform.producer;

import java.util.Objects;

/**
 * Failure reported by a {@link BrokerClient} for one write call, tagged with the
 * client's own classification of the error.
 */
public class BrokerException extends Exception {
  private final ErrorKind kind;

  public BrokerException(String message, ErrorKind kind) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public BrokerException(String message, ErrorKind kind, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }
}
