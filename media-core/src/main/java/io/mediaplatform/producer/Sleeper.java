package io.mediaplatform.producer;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Interruptible wait used between publish attempts.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> {
    if (!duration.isZero() && !duration.isNegative()) {
      TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    } else if (Thread.interrupted()) {
      throw new InterruptedException();
    }
  };

  /**
   * @throws InterruptedException if the calling thread is interrupted before or while waiting
   */
  void sleep(Duration duration) throws InterruptedException;
}
