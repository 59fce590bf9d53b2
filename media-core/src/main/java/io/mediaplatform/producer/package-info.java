/**
 * Reliable message producer: retries with capped exponential backoff, structured
 * error classification, lock-free metrics, a lifetime error-rate health check and
 * a close that drains in-flight calls.
 *
 * <p>The network side is behind {@link io.mediaplatform.producer.BrokerClient};
 * the {@code media-kafka} module supplies the Kafka implementation.
 */
package io.mediaplatform.producer;
