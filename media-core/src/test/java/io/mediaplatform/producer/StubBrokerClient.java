package io.mediaplatform.producer;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scripted {@link BrokerClient} for unit tests. Each write consumes the next scripted
 * failure; once the script is empty writes succeed.
 */
class StubBrokerClient implements BrokerClient {
  private final Deque<Exception> script = new ArrayDeque<>();
  final List<List<Message>> accepted = new CopyOnWriteArrayList<>();
  final AtomicLong writes = new AtomicLong();
  final AtomicLong messages = new AtomicLong();
  final AtomicLong errors = new AtomicLong();
  final AtomicInteger closeCalls = new AtomicInteger();
  volatile Exception alwaysFail;

  synchronized StubBrokerClient failNext(Exception... failures) {
    script.addAll(List.of(failures));
    return this;
  }

  StubBrokerClient failAlways(Exception failure) {
    this.alwaysFail = failure;
    return this;
  }

  @Override
  public void write(List<Message> batch) throws BrokerException, InterruptedException {
    writes.incrementAndGet();
    Exception failure;
    synchronized (this) {
      failure = script.isEmpty() ? alwaysFail : script.poll();
    }
    if (failure != null) {
      errors.incrementAndGet();
      if (failure instanceof BrokerException e) {
        throw e;
      }
      if (failure instanceof InterruptedException e) {
        throw e;
      }
      throw (RuntimeException) failure;
    }
    messages.addAndGet(batch.size());
    accepted.add(new ArrayList<>(batch));
  }

  @Override
  public BrokerStats stats() {
    return new BrokerStats(writes.get(), messages.get(), errors.get());
  }

  @Override
  public void close(Duration timeout) {
    closeCalls.incrementAndGet();
  }

  static BrokerException retriable(String message) {
    return new BrokerException(message, ErrorKind.RETRIABLE);
  }

  static BrokerException nonRetriable(String message) {
    return new BrokerException(message, ErrorKind.NON_RETRIABLE);
  }
}
