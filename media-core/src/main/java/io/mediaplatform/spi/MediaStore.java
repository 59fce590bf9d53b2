package io.mediaplatform.spi;

import io.mediaplatform.domain.Media;
import io.mediaplatform.domain.MediaStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract for media assets. All methods run on the connection they
 * are given, so the caller decides whether they take part in a transaction.
 */
public interface MediaStore {

    /**
     * @throws io.mediaplatform.domain.MediaConflictException if the id is already taken
     * @throws StoreException                                 on any other storage failure
     */
    void create(Connection conn, Media media);

    Optional<Media> findById(Connection conn, UUID id);

    /**
     * Reads the asset and locks its row until the surrounding transaction ends.
     */
    Optional<Media> findByIdForUpdate(Connection conn, UUID id);

    /**
     * @return the number of rows updated (0 or 1)
     */
    int updateStatus(Connection conn, UUID id, MediaStatus status, Instant updatedAt);
}
