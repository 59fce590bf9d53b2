package io.mediaplatform.kafka;

import io.mediaplatform.producer.BrokerClient;
import io.mediaplatform.producer.BrokerException;
import io.mediaplatform.producer.BrokerStats;
import io.mediaplatform.producer.ErrorKind;
import io.mediaplatform.producer.Message;
import io.mediaplatform.producer.ProducerConfig;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BrokerClient} on top of the Kafka Java client, bound to {@link ProducerConfig#topic()}.
 *
 * <p>Synchronous mode waits for every record of a write to be acknowledged, up to
 * {@link ProducerConfig#writeTimeout()} for the whole write. Asynchronous mode returns
 * once the records are in the client's buffer; delivery failures are then only
 * counted and logged.
 *
 * <p>Messages are keyed, so all events of one key land on one partition in order.
 */
public final class KafkaBrokerClient implements BrokerClient {
  private static final Logger logger = Logger.getLogger(KafkaBrokerClient.class.getName());

  static final int LINGER_MS = 10;
  static final String COMPRESSION = "snappy";

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final Duration writeTimeout;
  private final boolean async;

  private final LongAdder writes = new LongAdder();
  private final LongAdder messages = new LongAdder();
  private final LongAdder errors = new LongAdder();

  public KafkaBrokerClient(ProducerConfig config) {
    this(config, new KafkaProducer<>(producerProperties(config), new StringSerializer(), new ByteArraySerializer()));
  }

  /**
   * Wraps an existing producer, e.g. a {@code MockProducer} in tests. The client takes
   * ownership and closes it in {@link #close(Duration)}.
   */
  public KafkaBrokerClient(ProducerConfig config, Producer<String, byte[]> producer) {
    Objects.requireNonNull(config, "config");
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = config.topic();
    this.writeTimeout = config.writeTimeout();
    this.async = config.async();
    logger.log(Level.INFO, "Kafka broker client created: brokers={0}, topic={1}, async={2}",
        new Object[] {config.brokers(), topic, async});
  }

  /**
   * Kafka client settings derived from the config. Free-form
   * {@link ProducerConfig#clientProperties()} are applied last and win.
   */
  static Properties producerProperties(ProducerConfig config) {
    long timeoutMs = config.writeTimeout().toMillis();
    Properties props = new Properties();
    props.put(org.apache.kafka.clients.producer.ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
        String.join(",", config.brokers()));
    props.put(org.apache.kafka.clients.producer.ProducerConfig.ACKS_CONFIG, "all");
    props.put(org.apache.kafka.clients.producer.ProducerConfig.LINGER_MS_CONFIG, String.valueOf(LINGER_MS));
    props.put(org.apache.kafka.clients.producer.ProducerConfig.COMPRESSION_TYPE_CONFIG, COMPRESSION);
    props.put(org.apache.kafka.clients.producer.ProducerConfig.MAX_BLOCK_MS_CONFIG, String.valueOf(timeoutMs));
    props.put(org.apache.kafka.clients.producer.ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(timeoutMs));
    // must be >= linger.ms + request.timeout.ms
    props.put(org.apache.kafka.clients.producer.ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG,
        String.valueOf(timeoutMs + LINGER_MS));
    props.putAll(config.clientProperties());
    return props;
  }

  @Override
  public void write(List<Message> batch) throws BrokerException, InterruptedException {
    writes.increment();
    long deadline = System.nanoTime() + writeTimeout.toNanos();
    List<Future<RecordMetadata>> pending = new ArrayList<>(batch.size());
    try {
      for (Message message : batch) {
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, message.key(), message.value());
        pending.add(producer.send(record, async ? this::onAsyncCompletion : null));
      }
      if (!async) {
        for (Future<RecordMetadata> future : pending) {
          future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        }
      }
    } catch (InterruptException e) {
      throw interrupted(e);
    } catch (ExecutionException e) {
      errors.increment();
      throw KafkaErrors.toBrokerException(topic, e.getCause() != null ? e.getCause() : e);
    } catch (TimeoutException e) {
      errors.increment();
      throw new BrokerException("write to topic " + topic + " timed out after " + writeTimeout.toMillis() + " ms",
          ErrorKind.RETRIABLE, e);
    } catch (KafkaException e) {
      errors.increment();
      throw KafkaErrors.toBrokerException(topic, e);
    }
    messages.add(batch.size());
  }

  private void onAsyncCompletion(RecordMetadata metadata, Exception error) {
    if (error != null) {
      errors.increment();
      logger.log(Level.WARNING, "Asynchronous delivery to topic " + topic + " failed", error);
    }
  }

  private static InterruptedException interrupted(InterruptException e) {
    InterruptedException interrupted = new InterruptedException("interrupted while writing to Kafka");
    interrupted.initCause(e);
    return interrupted;
  }

  @Override
  public BrokerStats stats() {
    return new BrokerStats(writes.sum(), messages.sum(), errors.sum());
  }

  @Override
  public void close(Duration timeout) {
    logger.log(Level.INFO, "Closing Kafka broker client, flushing for up to {0} ms", timeout.toMillis());
    try {
      producer.close(timeout);
    } catch (InterruptException e) {
      logger.log(Level.WARNING, "Interrupted while closing Kafka producer", e);
    }
  }
}
