package io.mediaplatform.outbox;

import io.mediaplatform.producer.BrokerClient;
import io.mediaplatform.producer.BrokerException;
import io.mediaplatform.producer.BrokerStats;
import io.mediaplatform.producer.ErrorKind;
import io.mediaplatform.producer.Message;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Broker stand-in that records published keys and rejects keys on demand.
 */
class RecordingBrokerClient implements BrokerClient {
  final List<String> keys = new CopyOnWriteArrayList<>();
  final List<String> values = new CopyOnWriteArrayList<>();
  final Set<String> rejectKeys = ConcurrentHashMap.newKeySet();
  final AtomicLong writes = new AtomicLong();
  final AtomicLong errors = new AtomicLong();
  volatile boolean down;

  @Override
  public void write(List<Message> messages) throws BrokerException {
    writes.incrementAndGet();
    if (down) {
      errors.incrementAndGet();
      throw new BrokerException("connection refused", ErrorKind.RETRIABLE);
    }
    for (Message message : messages) {
      if (rejectKeys.contains(message.key())) {
        errors.incrementAndGet();
        throw new BrokerException("record too large", ErrorKind.NON_RETRIABLE);
      }
    }
    for (Message message : messages) {
      keys.add(message.key());
      values.add(new String(message.value(), StandardCharsets.UTF_8));
    }
  }

  @Override
  public BrokerStats stats() {
    return new BrokerStats(writes.get(), keys.size(), errors.get());
  }

  @Override
  public void close(Duration timeout) {
  }
}
