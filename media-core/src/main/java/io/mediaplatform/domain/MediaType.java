package io.mediaplatform.domain;

import java.util.Objects;

/**
 * Kind of content a media asset holds.
 */
public enum MediaType {
  VIDEO("video"),
  AUDIO("audio"),
  FILE("file");

  private final String code;

  MediaType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static MediaType fromCode(String code) {
    Objects.requireNonNull(code, "code");
    for (MediaType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown media type: " + code);
  }
}
