package io.mediaplatform.producer;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated settings for a {@link MessageProducer} and the {@link BrokerClient} it wraps.
 *
 * <p>Create instances via {@link #builder()}. Invalid values fail {@link Builder#build()}.
 */
public final class ProducerConfig {
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(100);
  public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(10);
  public static final int DEFAULT_BATCH_SIZE = 100;
  public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(30);

  private final List<String> brokers;
  private final String topic;
  private final int maxRetries;
  private final Duration retryBackoff;
  private final Duration writeTimeout;
  private final int batchSize;
  private final boolean async;
  private final Duration closeTimeout;
  private final Map<String, String> clientProperties;

  private ProducerConfig(Builder builder) {
    if (builder.brokers == null || builder.brokers.isEmpty()) {
      throw new IllegalArgumentException("brokers list is empty");
    }
    for (String broker : builder.brokers) {
      if (broker == null || broker.isBlank()) {
        throw new IllegalArgumentException("brokers list contains a blank entry");
      }
    }
    if (builder.topic == null || builder.topic.isBlank()) {
      throw new IllegalArgumentException("topic is empty");
    }
    int maxRetries = builder.maxRetries == null ? DEFAULT_MAX_RETRIES : builder.maxRetries;
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries cannot be negative");
    }
    Objects.requireNonNull(builder.retryBackoff, "retryBackoff");
    if (builder.retryBackoff.isNegative()) {
      throw new IllegalArgumentException("retryBackoff cannot be negative");
    }
    Objects.requireNonNull(builder.writeTimeout, "writeTimeout");
    if (builder.writeTimeout.isNegative()) {
      throw new IllegalArgumentException("writeTimeout cannot be negative");
    }
    if (builder.writeTimeout.isZero()) {
      throw new IllegalArgumentException("writeTimeout must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    Objects.requireNonNull(builder.closeTimeout, "closeTimeout");
    if (builder.closeTimeout.isNegative()) {
      throw new IllegalArgumentException("closeTimeout cannot be negative");
    }

    this.brokers = List.copyOf(builder.brokers);
    this.topic = builder.topic;
    this.maxRetries = maxRetries;
    this.retryBackoff = builder.retryBackoff;
    this.writeTimeout = builder.writeTimeout;
    this.batchSize = builder.batchSize;
    this.async = builder.async;
    this.closeTimeout = builder.closeTimeout;
    this.clientProperties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.clientProperties));
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> brokers() {
    return brokers;
  }

  public String topic() {
    return topic;
  }

  /** Retries after the first attempt; a publish makes at most {@code maxRetries + 1} attempts. */
  public int maxRetries() {
    return maxRetries;
  }

  public Duration retryBackoff() {
    return retryBackoff;
  }

  public Duration writeTimeout() {
    return writeTimeout;
  }

  /** Largest number of messages accepted by one {@link MessageProducer#publishBatch} call. */
  public int batchSize() {
    return batchSize;
  }

  public boolean async() {
    return async;
  }

  public Duration closeTimeout() {
    return closeTimeout;
  }

  /** Extra client settings passed through to the broker client unchanged. */
  public Map<String, String> clientProperties() {
    return clientProperties;
  }

  @Override
  public String toString() {
    return "ProducerConfig{brokers=" + brokers + ", topic=" + topic + ", maxRetries=" + maxRetries
        + ", retryBackoff=" + retryBackoff + ", writeTimeout=" + writeTimeout + ", batchSize=" + batchSize
        + ", async=" + async + ", closeTimeout=" + closeTimeout + '}';
  }

  public static final class Builder {
    private List<String> brokers;
    private String topic;
    private Integer maxRetries;
    private Duration retryBackoff = DEFAULT_RETRY_BACKOFF;
    private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private boolean async;
    private Duration closeTimeout = DEFAULT_CLOSE_TIMEOUT;
    private final Map<String, String> clientProperties = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * <b>Required.</b> Broker bootstrap endpoints, e.g. {@code localhost:9092}.
     */
    public Builder brokers(List<String> brokers) {
      this.brokers = brokers;
      return this;
    }

    public Builder brokers(String... brokers) {
      return brokers(List.of(brokers));
    }

    /**
     * <b>Required.</b> Destination topic for every message.
     */
    public Builder topic(String topic) {
      this.topic = topic;
      return this;
    }

    /**
     * Optional. Defaults to {@value ProducerConfig#DEFAULT_MAX_RETRIES}. Zero disables retries.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Optional. Base wait before the first retry. Defaults to 100 ms.
     */
    public Builder retryBackoff(Duration retryBackoff) {
      this.retryBackoff = retryBackoff;
      return this;
    }

    /**
     * Optional. Upper bound on one write call. Defaults to 10 s.
     */
    public Builder writeTimeout(Duration writeTimeout) {
      this.writeTimeout = writeTimeout;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Optional. When {@code true}, writes return once messages are buffered and
     * delivery errors only show up in {@link BrokerClient#stats()}. Defaults to {@code false}.
     */
    public Builder async(boolean async) {
      this.async = async;
      return this;
    }

    /**
     * Optional. How long {@link MessageProducer#close()} waits for in-flight sends. Defaults to 30 s.
     */
    public Builder closeTimeout(Duration closeTimeout) {
      this.closeTimeout = closeTimeout;
      return this;
    }

    public Builder clientProperty(String name, String value) {
      clientProperties.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder clientProperties(Map<String, String> properties) {
      properties.forEach(this::clientProperty);
      return this;
    }

    /**
     * @throws IllegalArgumentException if any setting is out of range
     */
    public ProducerConfig build() {
      return new ProducerConfig(this);
    }
  }
}
