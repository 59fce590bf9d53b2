package io.mediaplatform.domain;

import java.util.UUID;

/**
 * Thrown when creating a media asset whose identifier already exists.
 */
public class MediaConflictException extends RuntimeException {
  private final UUID mediaId;

  public MediaConflictException(UUID mediaId, Throwable cause) {
    super("Media already exists: " + mediaId, cause);
    this.mediaId = mediaId;
  }

  public UUID mediaId() {
    return mediaId;
  }
}
