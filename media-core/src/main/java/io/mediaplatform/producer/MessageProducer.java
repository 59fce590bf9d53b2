package io.mediaplatform.producer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes messages through a {@link BrokerClient} with bounded retries,
 * exponential backoff, error classification, metrics and a health check.
 *
 * <p>Each call makes one immediate attempt plus up to {@link ProducerConfig#maxRetries()}
 * retries, waiting {@link BackoffPolicy#delayBefore(long)} before each retry. Errors
 * classified {@link ErrorKind#NON_RETRIABLE} end the call at once. Interrupting the
 * calling thread cancels the call with {@link PublishException.Reason#CANCELLED}.
 *
 * <p>This class is thread-safe. Concurrent {@link #publish} and {@link #publishBatch}
 * calls share the same lock-free counters.
 *
 * @see ProducerConfig
 */
public final class MessageProducer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MessageProducer.class.getName());

  private final ProducerConfig config;
  private final BrokerClient client;
  private final BackoffPolicy backoff;
  private final Sleeper sleeper;
  private final ProducerMetrics metrics = new ProducerMetrics();

  private final AtomicBoolean closed = new AtomicBoolean();
  private final Object inFlightLock = new Object();
  private int inFlight;

  public MessageProducer(ProducerConfig config, BrokerClient client) {
    this(config, client, Sleeper.SYSTEM);
  }

  MessageProducer(ProducerConfig config, BrokerClient client, Sleeper sleeper) {
    this.config = Objects.requireNonNull(config, "config");
    this.client = Objects.requireNonNull(client, "client");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.backoff = new BackoffPolicy(config.retryBackoff());
    logger.log(Level.INFO, "Message producer created: {0}", config);
  }

  /**
   * Publishes one message.
   *
   * @param key   message key, typically the event id
   * @param value message body
   * @throws PublishException if the producer is closed, the broker rejected the
   *                          message, all attempts failed, or the thread was interrupted
   */
  public void publish(String key, byte[] value) throws PublishException {
    Message message = new Message(key, value);
    enter();
    try {
      send(List.of(message), "message key=" + key);
    } finally {
      exit();
    }
  }

  /**
   * Publishes all messages in one broker call per attempt. The batch succeeds or
   * fails as a whole. An empty batch is a no-op.
   *
   * @throws IllegalArgumentException if the batch is larger than {@link ProducerConfig#batchSize()}
   * @throws PublishException         see {@link #publish}
   */
  public void publishBatch(List<Message> messages) throws PublishException {
    Objects.requireNonNull(messages, "messages");
    if (closed.get()) {
      throw closedException();
    }
    if (messages.isEmpty()) {
      return;
    }
    if (messages.size() > config.batchSize()) {
      throw new IllegalArgumentException(
          "batch of " + messages.size() + " messages exceeds batchSize " + config.batchSize());
    }
    List<Message> batch = List.copyOf(messages);
    enter();
    try {
      send(batch, "batch size=" + batch.size());
    } finally {
      exit();
    }
  }

  private void send(List<Message> messages, String description) throws PublishException {
    long start = System.nanoTime();
    long maxAttempts = config.maxRetries() + 1L;
    int attempts = 0;
    Exception lastError = null;

    for (long attempt = 0; attempt < maxAttempts; attempt++) {
      if (attempt > 0) {
        Duration wait = backoff.delayBefore(attempt);
        logger.log(Level.FINE, "Retrying {0}, retry {1} after {2} ms",
            new Object[] {description, attempt, wait.toMillis()});
        metrics.recordRetry();
        try {
          sleeper.sleep(wait);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw cancelled(messages, description, attempts, e);
        }
      }

      attempts++;
      try {
        client.write(messages);
        long elapsed = System.nanoTime() - start;
        metrics.recordPublished(messages.size(), elapsed);
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Published " + description + " in " + TimeUnit.NANOSECONDS.toMillis(elapsed)
              + " ms after " + attempts + " attempt(s)");
        }
        return;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw cancelled(messages, description, attempts, e);
      } catch (BrokerException | RuntimeException e) {
        lastError = e;
        if (ErrorClassifier.classify(e) == ErrorKind.NON_RETRIABLE) {
          metrics.recordFailed(messages.size());
          logger.log(Level.WARNING, "Non-retriable error publishing " + description
              + " on attempt " + attempts + ", giving up", e);
          throw new PublishException(PublishException.Reason.NON_RETRIABLE,
              "non-retriable error after " + attempts + " attempt(s): " + e.getMessage(), attempts, e);
        }
        logger.log(Level.WARNING, "Retriable error publishing {0} on attempt {1}: {2}",
            new Object[] {description, attempts, e.getMessage()});
      }
    }

    metrics.recordFailed(messages.size());
    logger.log(Level.SEVERE, "Failed to publish " + description + " after " + attempts + " attempt(s) in "
        + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) + " ms", lastError);
    throw new PublishException(PublishException.Reason.RETRIES_EXHAUSTED,
        "failed after " + attempts + " attempts", attempts, lastError);
  }

  private PublishException cancelled(List<Message> messages, String description, int attempts, InterruptedException e) {
    metrics.recordFailed(messages.size());
    logger.log(Level.WARNING, "Publish of {0} cancelled after {1} attempt(s)", new Object[] {description, attempts});
    return new PublishException(PublishException.Reason.CANCELLED,
        "publish cancelled after " + attempts + " attempt(s)", attempts, e);
  }

  private void enter() throws PublishException {
    synchronized (inFlightLock) {
      if (closed.get()) {
        throw closedException();
      }
      inFlight++;
    }
  }

  private void exit() {
    synchronized (inFlightLock) {
      inFlight--;
      if (inFlight == 0) {
        inFlightLock.notifyAll();
      }
    }
  }

  private static PublishException closedException() {
    return new PublishException(PublishException.Reason.CLOSED, "producer is closed", 0, null);
  }

  /**
   * @return a snapshot of this producer's counters
   */
  public MetricsSnapshot metrics() {
    return metrics.snapshot();
  }

  /**
   * Evaluates the broker client's lifetime counters. Unhealthy when closed, or when
   * writes happened and more than half of them failed.
   */
  public ProducerHealth healthCheck() {
    BrokerStats stats = client.stats();
    if (closed.get()) {
      return ProducerHealth.down("producer is closed", stats);
    }
    logger.log(Level.FINE, "Producer health: writes={0} messages={1} errors={2}",
        new Object[] {stats.writes(), stats.messages(), stats.errors()});
    if (stats.writes() > 0 && stats.errors() * 2 > stats.writes()) {
      return ProducerHealth.down(
          "high error rate: " + stats.errors() + " errors out of " + stats.writes() + " writes", stats);
    }
    return ProducerHealth.up(stats);
  }

  public boolean isClosed() {
    return closed.get();
  }

  public ProducerConfig config() {
    return config;
  }

  /**
   * Rejects new publish calls, waits up to {@link ProducerConfig#closeTimeout()} for
   * in-flight calls to finish, closes the broker client and logs final metrics.
   *
   * @throws IllegalStateException if the producer was already closed
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      throw new IllegalStateException("producer already closed");
    }
    logger.info("Closing message producer");

    long deadline = System.nanoTime() + config.closeTimeout().toNanos();
    boolean interrupted = false;
    synchronized (inFlightLock) {
      while (inFlight > 0) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMs <= 0) {
          logger.log(Level.WARNING, "Timed out waiting for {0} in-flight publish call(s)", inFlight);
          break;
        }
        try {
          inFlightLock.wait(remainingMs);
        } catch (InterruptedException e) {
          interrupted = true;
          logger.warning("Interrupted while waiting for in-flight publish calls");
          break;
        }
      }
    }

    try {
      long remainingNanos = Math.max(0L, deadline - System.nanoTime());
      client.close(Duration.ofNanos(remainingNanos));
    } finally {
      MetricsSnapshot snapshot = metrics.snapshot();
      logger.log(Level.INFO,
          "Message producer closed: published={0} failed={1} retries={2} avgPublishTime={3} ms",
          new Object[] {snapshot.messagesPublished(), snapshot.messagesFailed(), snapshot.retriesTotal(),
              snapshot.averagePublishTime().toMillis()});
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
