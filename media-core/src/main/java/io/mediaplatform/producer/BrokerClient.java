package io.mediaplatform.producer;

import java.time.Duration;
import java.util.List;

/**
 * Network publish primitive wrapped by {@link MessageProducer}. Bound to one topic.
 *
 * <p>A {@link #write} call is atomic from the producer's point of view: it either
 * accepts every message or fails as a whole. Implementations classify their own
 * failures through {@link BrokerException#kind()}.
 *
 * @see io.mediaplatform.producer.MessageProducer
 */
public interface BrokerClient {

  /**
   * Writes the messages, blocking until the broker acknowledged them (synchronous
   * mode) or they were handed to the client's send buffer (asynchronous mode).
   *
   * @throws BrokerException      if the broker rejected the write
   * @throws InterruptedException if the calling thread was interrupted while waiting
   */
  void write(List<Message> messages) throws BrokerException, InterruptedException;

  BrokerStats stats();

  /**
   * Flushes buffered messages and releases resources, waiting at most {@code timeout}.
   */
  void close(Duration timeout);
}
