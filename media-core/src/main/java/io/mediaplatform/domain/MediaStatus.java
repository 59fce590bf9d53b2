package io.mediaplatform.domain;

import java.util.Objects;

/**
 * Lifecycle status of a media asset. The lowercase {@link #code()} is what gets
 * persisted and published.
 *
 * @see StatusTransitions
 */
public enum MediaStatus {
  UPLOADED("uploaded"),
  PROCESSING("processing"),
  READY("ready"),
  FAILED("failed");

  private final String code;

  MediaStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves a status from its persisted code.
   *
   * @param code lowercase status code
   * @return the matching status
   * @throws IllegalArgumentException if no status has this code
   */
  public static MediaStatus fromCode(String code) {
    Objects.requireNonNull(code, "code");
    for (MediaStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown media status: " + code);
  }
}
