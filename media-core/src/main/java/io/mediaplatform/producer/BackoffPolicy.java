package io.mediaplatform.producer;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff without jitter: the wait before retry {@code n} (1-based) is
 * {@code min(base * 2^(n-1), cap)}.
 *
 * <p>With a 100 ms base the schedule is 100, 200, 400, 800 ms ... capped at {@link #MAX_BACKOFF}.
 */
public final class BackoffPolicy {
  public static final Duration MAX_BACKOFF = Duration.ofSeconds(5);

  private final long baseNanos;
  private final long capNanos;

  public BackoffPolicy(Duration base) {
    this(base, MAX_BACKOFF);
  }

  public BackoffPolicy(Duration base, Duration cap) {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(cap, "cap");
    if (base.isNegative()) {
      throw new IllegalArgumentException("base cannot be negative, got: " + base);
    }
    if (cap.isNegative()) {
      throw new IllegalArgumentException("cap cannot be negative, got: " + cap);
    }
    this.baseNanos = base.toNanos();
    this.capNanos = cap.toNanos();
  }

  /**
   * @param retry the retry number, 1 for the first retry
   * @return the wait before that retry; zero for {@code retry <= 0}
   */
  public Duration delayBefore(long retry) {
    if (retry <= 0 || baseNanos == 0) {
      return Duration.ZERO;
    }
    long delayNanos;
    if (retry >= 63) {
      delayNanos = capNanos;
    } else {
      long factor = 1L << (retry - 1);
      // overflow guard
      delayNanos = factor > capNanos / baseNanos ? capNanos : Math.min(capNanos, baseNanos * factor);
    }
    return Duration.ofNanos(delayNanos);
  }
}
