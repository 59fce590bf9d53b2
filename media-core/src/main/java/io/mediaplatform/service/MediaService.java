package io.mediaplatform.service;

import io.mediaplatform.domain.Media;
import io.mediaplatform.domain.MediaNotFoundException;
import io.mediaplatform.domain.MediaStatus;
import io.mediaplatform.domain.MediaType;
import io.mediaplatform.domain.StatusTransitions;
import io.mediaplatform.event.MediaStatusChanged;
import io.mediaplatform.spi.ConnectionProvider;
import io.mediaplatform.spi.MediaStore;
import io.mediaplatform.spi.OutboxStore;
import io.mediaplatform.spi.StoreException;
import io.mediaplatform.spi.Transaction;
import io.mediaplatform.spi.TransactionManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for media operations.
 *
 * <p>{@link #changeStatus} is the transactional write path: the status update and the
 * {@link MediaStatusChanged} outbox record are written in one transaction, so either
 * both become visible or neither does. No broker call happens here; the
 * {@link io.mediaplatform.outbox.OutboxPublisher} delivers the event later.
 */
public final class MediaService {
  private static final Logger logger = Logger.getLogger(MediaService.class.getName());

  private final MediaStore mediaStore;
  private final OutboxStore outboxStore;
  private final TransactionManager txManager;
  private final ConnectionProvider connectionProvider;
  private final Clock clock;
  private final Supplier<UUID> idGenerator;

  public MediaService(MediaStore mediaStore, OutboxStore outboxStore,
                      TransactionManager txManager, ConnectionProvider connectionProvider) {
    this(mediaStore, outboxStore, txManager, connectionProvider, Clock.systemUTC(), UUID::randomUUID);
  }

  public MediaService(MediaStore mediaStore, OutboxStore outboxStore,
                      TransactionManager txManager, ConnectionProvider connectionProvider,
                      Clock clock, Supplier<UUID> idGenerator) {
    this.mediaStore = Objects.requireNonNull(mediaStore, "mediaStore");
    this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  /**
   * Creates a media asset in status {@link MediaStatus#UPLOADED}.
   *
   * @throws IllegalArgumentException                       if {@code type} is null or {@code source} is blank
   * @throws io.mediaplatform.domain.MediaConflictException if the generated id already exists
   * @throws StoreException                                 on storage failure
   */
  public Media createMedia(MediaType type, String source) {
    if (type == null) {
      throw new IllegalArgumentException("type is required");
    }
    if (source == null || source.isBlank()) {
      throw new IllegalArgumentException("source is required");
    }
    Instant now = clock.instant();
    Media media = new Media(idGenerator.get(), MediaStatus.UPLOADED, type, source, now, now);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      mediaStore.create(conn, media);
    } catch (SQLException e) {
      throw new StoreException("Failed to create media " + media.id(), e);
    }
    logger.log(Level.FINE, "Created media {0} ({1})", new Object[] {media.id(), type.code()});
    return media;
  }

  /**
   * @throws IllegalArgumentException if {@code id} is null
   * @throws MediaNotFoundException   if no asset has this id
   */
  public Media getMedia(UUID id) {
    if (id == null) {
      throw new IllegalArgumentException("id is required");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return mediaStore.findById(conn, id).orElseThrow(() -> new MediaNotFoundException(id));
    } catch (SQLException e) {
      throw new StoreException("Failed to read media " + id, e);
    }
  }

  /**
   * Moves an asset to {@code newStatus} and enqueues a {@link MediaStatusChanged} event
   * in the same transaction.
   *
   * <p>The current state is read with a row lock inside the transaction, so the
   * transition is validated against the state being updated. Changing to the current
   * status returns the asset unchanged and writes nothing.
   *
   * @return the updated asset
   * @throws IllegalArgumentException                            if an argument is null
   * @throws MediaNotFoundException                              if no asset has this id
   * @throws io.mediaplatform.domain.InvalidTransitionException if the transition is not allowed
   * @throws io.mediaplatform.event.EventSerializationException if the event cannot be serialized
   * @throws StoreException                                      on storage failure; nothing was written
   */
  public Media changeStatus(UUID id, MediaStatus newStatus) {
    if (id == null) {
      throw new IllegalArgumentException("id is required");
    }
    if (newStatus == null) {
      throw new IllegalArgumentException("status is required");
    }
    try (Transaction tx = txManager.begin()) {
      Connection conn = tx.connection();
      Media current = mediaStore.findByIdForUpdate(conn, id)
          .orElseThrow(() -> new MediaNotFoundException(id));
      MediaStatus from = current.status();
      if (from == newStatus) {
        logger.log(Level.FINE, "Media {0} already {1}, nothing to do", new Object[] {id, from.code()});
        tx.rollback();
        return current;
      }
      StatusTransitions.validate(from, newStatus);

      Instant now = clock.instant();
      if (mediaStore.updateStatus(conn, id, newStatus, now) == 0) {
        throw new MediaNotFoundException(id);
      }
      MediaStatusChanged event = MediaStatusChanged.of(id, from, newStatus, now);
      outboxStore.enqueue(conn, event);
      tx.commit();

      logger.log(Level.FINE, "Media {0} changed {1} -> {2}, event {3}",
          new Object[] {id, from.code(), newStatus.code(), event.eventId()});
      return current.withStatus(newStatus, now);
    } catch (SQLException e) {
      throw new StoreException("Failed to change status of media " + id, e);
    }
  }
}
