package io.mediaplatform.producer;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a failed broker write may be retried.
 *
 * <p>A {@link BrokerException} carrying {@link ErrorKind#RETRIABLE} or
 * {@link ErrorKind#NON_RETRIABLE} is taken at its word. Anything else is matched
 * against well-known error texts across the cause chain, outermost first, with the
 * retriable texts checked before the non-retriable ones. An untyped
 * {@link BrokerException} that wraps a cause is matched from that cause, since its own
 * message carries context such as the topic name. Errors that match nothing are
 * treated as retriable.
 */
public final class ErrorClassifier {
  private static final List<String> NON_RETRIABLE_PATTERNS = List.of(
      "invalid message",
      "invalid record",
      "message too large",
      "record too large",
      "authorization failed",
      "not authorized",
      "authentication failed",
      "invalid topic");

  private static final List<String> RETRIABLE_PATTERNS = List.of(
      "connection refused",
      "connection reset",
      "broken pipe",
      "timeout",
      "timed out",
      "temporary failure",
      "leader not available",
      "not leader",
      "not controller");

  private ErrorClassifier() {}

  public static ErrorKind classify(Throwable error) {
    if (error == null) {
      return ErrorKind.UNKNOWN;
    }
    if (error instanceof BrokerException broker && broker.kind() != ErrorKind.UNKNOWN) {
      return broker.kind();
    }
    if (error instanceof BrokerException && error.getCause() != null) {
      return classifyText(error.getCause());
    }
    return classifyText(error);
  }

  public static boolean isRetriable(Throwable error) {
    return classify(error) != ErrorKind.NON_RETRIABLE;
  }

  static ErrorKind classifyText(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
      String message = t.getMessage();
      if (message == null) {
        continue;
      }
      String text = message.toLowerCase(Locale.ROOT);
      if (containsAny(text, RETRIABLE_PATTERNS)) {
        return ErrorKind.RETRIABLE;
      }
      if (containsAny(text, NON_RETRIABLE_PATTERNS)) {
        return ErrorKind.NON_RETRIABLE;
      }
    }
    return ErrorKind.RETRIABLE;
  }

  private static boolean containsAny(String text, List<String> patterns) {
    for (String pattern : patterns) {
      if (text.contains(pattern)) {
        return true;
      }
    }
    return false;
  }
}
