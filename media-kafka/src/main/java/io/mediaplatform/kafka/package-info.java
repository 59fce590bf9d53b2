/**
 * Kafka implementation of the producer's broker boundary.
 */
package io.mediaplatform.kafka;
