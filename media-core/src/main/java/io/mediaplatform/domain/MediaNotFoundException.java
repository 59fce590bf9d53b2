package io.mediaplatform.domain;

import java.util.UUID;

public class MediaNotFoundException extends RuntimeException {
  private final UUID mediaId;

  public MediaNotFoundException(UUID mediaId) {
    super("Media not found: " + mediaId);
    this.mediaId = mediaId;
  }

  public UUID mediaId() {
    return mediaId;
  }
}
