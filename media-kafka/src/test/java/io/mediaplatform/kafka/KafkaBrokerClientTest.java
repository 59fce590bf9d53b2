package io.mediaplatform.kafka;

import io.mediaplatform.producer.BrokerException;
import io.mediaplatform.producer.BrokerStats;
import io.mediaplatform.producer.ErrorKind;
import io.mediaplatform.producer.Message;
import io.mediaplatform.producer.MessageProducer;
import io.mediaplatform.producer.ProducerConfig;
import io.mediaplatform.producer.PublishException;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.NotLeaderOrFollowerException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class KafkaBrokerClientTest {
  private static final String TOPIC = "media-events";

  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static ProducerConfig.Builder config() {
    return ProducerConfig.builder().brokers("kafka-1:9092", "kafka-2:9092").topic(TOPIC);
  }

  private static MockProducer<String, byte[]> mock(boolean autoComplete) {
    return new MockProducer<>(autoComplete, new StringSerializer(), new ByteArraySerializer());
  }

  private static List<Message> messages(String... keys) {
    return Arrays.stream(keys)
        .map(k -> new Message(k, ("{\"event_id\":\"" + k + "\"}").getBytes(StandardCharsets.UTF_8)))
        .toList();
  }

  @Test
  void syncWriteSendsKeyedRecordsToTopic() throws Exception {
    MockProducer<String, byte[]> mock = mock(true);
    KafkaBrokerClient client = new KafkaBrokerClient(config().build(), mock);

    client.write(messages("e1", "e2"));

    List<ProducerRecord<String, byte[]>> sent = mock.history();
    assertEquals(2, sent.size());
    assertEquals(TOPIC, sent.get(0).topic());
    assertEquals("e1", sent.get(0).key());
    assertEquals("{\"event_id\":\"e1\"}", new String(sent.get(0).value(), StandardCharsets.UTF_8));
    assertEquals("e2", sent.get(1).key());
    assertEquals(new BrokerStats(1, 2, 0), client.stats());
  }

  @Test
  void syncWriteReportsPermanentDeliveryFailure() throws Exception {
    MockProducer<String, byte[]> mock = mock(false);
    KafkaBrokerClient client = new KafkaBrokerClient(config().build(), mock);

    Future<Exception> result = writeInBackground(client, messages("e1"));
    awaitSent(mock, 1);
    assertTrue(mock.errorNext(new RecordTooLargeException("record too large")));

    BrokerException e = assertInstanceOf(BrokerException.class, result.get(5, TimeUnit.SECONDS));
    assertEquals(ErrorKind.NON_RETRIABLE, e.kind());
    assertInstanceOf(RecordTooLargeException.class, e.getCause());
    assertEquals(new BrokerStats(1, 0, 1), client.stats());
  }

  @Test
  void syncWriteReportsTransientDeliveryFailure() throws Exception {
    MockProducer<String, byte[]> mock = mock(false);
    KafkaBrokerClient client = new KafkaBrokerClient(config().build(), mock);

    Future<Exception> result = writeInBackground(client, messages("e1"));
    awaitSent(mock, 1);
    mock.errorNext(new NotLeaderOrFollowerException("leader moved"));

    BrokerException e = assertInstanceOf(BrokerException.class, result.get(5, TimeUnit.SECONDS));
    assertEquals(ErrorKind.RETRIABLE, e.kind());
  }

  @Test
  void syncWriteTimesOutWithoutAck() {
    KafkaBrokerClient client = new KafkaBrokerClient(config().writeTimeout(Duration.ofMillis(50)).build(), mock(false));

    BrokerException e = assertThrows(BrokerException.class, () -> client.write(messages("e1")));

    assertEquals(ErrorKind.RETRIABLE, e.kind());
    assertTrue(e.getMessage().contains("timed out"), e.getMessage());
    assertEquals(1, client.stats().errors());
  }

  @Test
  void sendFailureIsClassified() {
    MockProducer<String, byte[]> mock = mock(true);
    mock.sendException = new SerializationException("cannot serialize key");
    KafkaBrokerClient client = new KafkaBrokerClient(config().build(), mock);

    BrokerException e = assertThrows(BrokerException.class, () -> client.write(messages("e1")));
    assertEquals(ErrorKind.NON_RETRIABLE, e.kind());
  }

  @Test
  void interruptedSendSurfacesAsInterruptedException() {
    MockProducer<String, byte[]> mock = mock(true);
    mock.sendException = new InterruptException("interrupted");
    KafkaBrokerClient client = new KafkaBrokerClient(config().build(), mock);
    try {
      assertThrows(InterruptedException.class, () -> client.write(messages("e1")));
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void asyncWriteReturnsBeforeAckAndCountsLaterFailures() throws Exception {
    MockProducer<String, byte[]> mock = mock(false);
    KafkaBrokerClient client = new KafkaBrokerClient(config().async(true).build(), mock);

    client.write(messages("e1", "e2"));
    assertEquals(new BrokerStats(1, 2, 0), client.stats());

    mock.completeNext();
    mock.errorNext(new NotLeaderOrFollowerException("leader moved"));
    assertEquals(1, client.stats().errors());
  }

  @Test
  void closeClosesUnderlyingProducer() {
    MockProducer<String, byte[]> mock = mock(true);
    KafkaBrokerClient client = new KafkaBrokerClient(config().build(), mock);

    client.close(Duration.ofSeconds(1));

    assertTrue(mock.closed());
  }

  @Test
  void producerPropertiesFromConfig() {
    Properties props = KafkaBrokerClient.producerProperties(config()
        .writeTimeout(Duration.ofSeconds(3))
        .clientProperty("client.id", "media-service")
        .clientProperty("compression.type", "lz4")
        .build());

    assertEquals("kafka-1:9092,kafka-2:9092", props.get("bootstrap.servers"));
    assertEquals("all", props.get("acks"));
    assertEquals("10", props.get("linger.ms"));
    assertEquals("3000", props.get("request.timeout.ms"));
    assertEquals("3010", props.get("delivery.timeout.ms"));
    assertEquals("media-service", props.get("client.id"));
    assertEquals("lz4", props.get("compression.type"));
  }

  @Test
  void messageProducerRetriesUnknownKafkaErrorsByText() throws Exception {
    MockProducer<String, byte[]> mock = mock(false);
    KafkaBrokerClient client = new KafkaBrokerClient(config().build(), mock);
    MessageProducer producer = new MessageProducer(config()
        .maxRetries(1)
        .retryBackoff(Duration.ofMillis(1))
        .build(), client);

    Future<Exception> result = executor.submit(() -> {
      try {
        producer.publish("e1", new byte[] {1});
        return null;
      } catch (PublishException e) {
        return e;
      }
    });
    awaitSent(mock, 1);
    mock.errorNext(new KafkaException("connection reset by peer"));
    awaitSent(mock, 2);
    mock.completeNext();

    assertNull(result.get(5, TimeUnit.SECONDS));
    assertEquals(1, producer.metrics().messagesPublished());
    assertEquals(1, producer.metrics().retriesTotal());
    producer.close();
    assertTrue(mock.closed());
  }

  private Future<Exception> writeInBackground(KafkaBrokerClient client, List<Message> batch) {
    return executor.submit(() -> {
      try {
        client.write(batch);
        return null;
      } catch (BrokerException | InterruptedException e) {
        return e;
      }
    });
  }

  private static void awaitSent(MockProducer<String, byte[]> mock, int count) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (mock.history().size() < count) {
      if (System.nanoTime() > deadline) {
        fail("expected " + count + " records, saw " + mock.history().size());
      }
      Thread.sleep(5);
    }
  }
}
