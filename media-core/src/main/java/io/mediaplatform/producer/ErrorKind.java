package io.mediaplatform.producer;

/**
 * How a broker failure should be treated by the retry loop.
 */
public enum ErrorKind {
  /** Transient: connection loss, timeouts, leader elections. Retry with backoff. */
  RETRIABLE,
  /** Permanent for this message: oversized, malformed, not authorized. Give up. */
  NON_RETRIABLE,
  /** The broker client could not tell. Resolved by {@link ErrorClassifier} from the error text. */
  UNKNOWN
}
