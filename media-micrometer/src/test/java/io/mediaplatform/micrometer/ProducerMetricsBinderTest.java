package io.mediaplatform.micrometer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.mediaplatform.producer.BrokerClient;
import io.mediaplatform.producer.BrokerException;
import io.mediaplatform.producer.BrokerStats;
import io.mediaplatform.producer.ErrorKind;
import io.mediaplatform.producer.Message;
import io.mediaplatform.producer.MessageProducer;
import io.mediaplatform.producer.ProducerConfig;
import io.mediaplatform.producer.PublishException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ProducerMetricsBinderTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final ToggleBrokerClient broker = new ToggleBrokerClient();
  private MessageProducer producer;

  @BeforeEach
  void setUp() {
    producer = new MessageProducer(ProducerConfig.builder()
        .brokers("localhost:9092")
        .topic("media-events")
        .maxRetries(1)
        .retryBackoff(Duration.ofMillis(1))
        .build(), broker);
    new ProducerMetricsBinder(producer).bindTo(registry);
  }

  @AfterEach
  void tearDown() {
    if (!producer.isClosed()) {
      producer.close();
    }
  }

  @Test
  void reflectsProducerCounters() throws Exception {
    producer.publish("e1", new byte[] {1});
    producer.publish("e2", new byte[] {2});
    broker.down = true;
    assertThrows(PublishException.class, () -> producer.publish("e3", new byte[] {3}));

    assertEquals(2.0, functionCounter("media.producer.messages.published").count());
    assertEquals(1.0, functionCounter("media.producer.messages.failed").count());
    assertEquals(1.0, functionCounter("media.producer.retries").count());
    assertEquals(4.0, functionCounter("media.producer.broker.writes").count());
    assertEquals(2.0, functionCounter("media.producer.broker.errors").count());
    assertEquals("media-events", registry.find("media.producer.retries").functionCounter().getId().getTag("topic"));
  }

  @Test
  void healthGaugeFollowsHealthCheck() throws Exception {
    assertEquals(1.0, gauge("media.producer.healthy").value());

    broker.down = true;
    assertThrows(PublishException.class, () -> producer.publish("e1", new byte[] {1}));
    assertEquals(0.0, gauge("media.producer.healthy").value());
  }

  @Test
  void closedProducerIsUnhealthy() {
    producer.close();
    assertEquals(0.0, gauge("media.producer.healthy").value());
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(NullPointerException.class, () -> new ProducerMetricsBinder(null));
    assertThrows(IllegalArgumentException.class, () -> new ProducerMetricsBinder(producer, "media."));
  }

  private FunctionCounter functionCounter(String name) {
    FunctionCounter c = registry.find(name).functionCounter();
    assertNotNull(c, "FunctionCounter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }

  static final class ToggleBrokerClient implements BrokerClient {
    final AtomicLong writes = new AtomicLong();
    final AtomicLong messages = new AtomicLong();
    final AtomicLong errors = new AtomicLong();
    volatile boolean down;

    @Override
    public void write(List<Message> batch) throws BrokerException {
      writes.incrementAndGet();
      if (down) {
        errors.incrementAndGet();
        throw new BrokerException("connection refused", ErrorKind.RETRIABLE);
      }
      messages.addAndGet(batch.size());
    }

    @Override
    public BrokerStats stats() {
      return new BrokerStats(writes.get(), messages.get(), errors.get());
    }

    @Override
    public void close(Duration timeout) {
    }
  }
}
