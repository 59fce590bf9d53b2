package io.mediaplatform.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable snapshot of a media asset as held by the media store.
 *
 * @param id        unique asset identifier
 * @param status    current lifecycle status
 * @param type      content kind
 * @param source    locator of the uploaded content (URL, object key, path)
 * @param createdAt when the asset was created
 * @param updatedAt when the asset was last modified
 */
public record Media(
    UUID id,
    MediaStatus status,
    MediaType type,
    String source,
    Instant createdAt,
    Instant updatedAt
) {
  public Media {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  /**
   * Returns a copy with the given status and modification time.
   */
  public Media withStatus(MediaStatus newStatus, Instant at) {
    return new Media(id, newStatus, type, source, createdAt, at);
  }
}
