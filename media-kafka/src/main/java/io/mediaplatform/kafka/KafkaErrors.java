package io.mediaplatform.kafka;

import io.mediaplatform.producer.BrokerException;
import io.mediaplatform.producer.ErrorKind;
import org.apache.kafka.common.InvalidRecordException;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.CorruptRecordException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.RecordBatchTooLargeException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.errors.UnsupportedVersionException;

/**
 * Maps Kafka client exceptions onto {@link ErrorKind}.
 *
 * <p>Anything Kafka does not type as retriable or as a permanent record/auth problem
 * is reported as {@link ErrorKind#UNKNOWN}, leaving the decision to the producer's
 * text-based classifier.
 */
public final class KafkaErrors {

  private KafkaErrors() {
  }

  public static ErrorKind classify(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof RetriableException) {
        return ErrorKind.RETRIABLE;
      }
      if (t instanceof RecordTooLargeException
          || t instanceof RecordBatchTooLargeException
          || t instanceof InvalidRecordException
          || t instanceof CorruptRecordException
          || t instanceof SerializationException
          || t instanceof InvalidTopicException
          || t instanceof AuthorizationException
          || t instanceof AuthenticationException
          || t instanceof UnsupportedVersionException) {
        return ErrorKind.NON_RETRIABLE;
      }
    }
    return ErrorKind.UNKNOWN;
  }

  static BrokerException toBrokerException(String topic, Throwable error) {
    return new BrokerException("write to topic " + topic + " failed: " + error.getMessage(), classify(error), error);
  }
}
