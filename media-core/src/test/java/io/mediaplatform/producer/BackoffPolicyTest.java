package io.mediaplatform.producer;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

  @Test
  void doublesFromBase() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100));

    assertEquals(Duration.ofMillis(100), policy.delayBefore(1));
    assertEquals(Duration.ofMillis(200), policy.delayBefore(2));
    assertEquals(Duration.ofMillis(400), policy.delayBefore(3));
    assertEquals(Duration.ofMillis(800), policy.delayBefore(4));
  }

  @Test
  void cappedAtFiveSeconds() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100));

    assertEquals(Duration.ofMillis(3200), policy.delayBefore(6));
    assertEquals(BackoffPolicy.MAX_BACKOFF, policy.delayBefore(7));
    assertEquals(BackoffPolicy.MAX_BACKOFF, policy.delayBefore(40));
  }

  @Test
  void handlesOverflowBoundary() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100));

    assertEquals(BackoffPolicy.MAX_BACKOFF, policy.delayBefore(62));
    assertEquals(BackoffPolicy.MAX_BACKOFF, policy.delayBefore(63));
    assertEquals(BackoffPolicy.MAX_BACKOFF, policy.delayBefore(Integer.MAX_VALUE));
  }

  @Test
  void zeroBaseMeansNoWait() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ZERO);

    assertEquals(Duration.ZERO, policy.delayBefore(1));
    assertEquals(Duration.ZERO, policy.delayBefore(10));
  }

  @Test
  void subMillisecondBaseIsKept() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofNanos(500_000));

    assertEquals(Duration.ofNanos(500_000), policy.delayBefore(1));
    assertEquals(Duration.ofMillis(1), policy.delayBefore(2));
    assertEquals(Duration.ofMillis(2), policy.delayBefore(3));
  }

  @Test
  void nonPositiveRetryMeansNoWait() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100));

    assertEquals(Duration.ZERO, policy.delayBefore(0));
    assertEquals(Duration.ZERO, policy.delayBefore(-1));
  }

  @Test
  void baseAboveCapIsCapped() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(10));

    assertEquals(BackoffPolicy.MAX_BACKOFF, policy.delayBefore(1));
  }

  @Test
  void negativeBaseIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(Duration.ofMillis(-1)));
  }
}
