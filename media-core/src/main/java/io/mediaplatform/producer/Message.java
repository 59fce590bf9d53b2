package io.mediaplatform.producer;

import java.util.Objects;

/**
 * One key/value pair to publish. The key drives partitioning and consumer-side dedup.
 */
public record Message(String key, byte[] value) {
  public Message {
    Objects.requireNonNull(value, "value");
  }
}
