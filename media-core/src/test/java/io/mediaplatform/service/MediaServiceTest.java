package io.mediaplatform.service;

import io.mediaplatform.domain.InvalidTransitionException;
import io.mediaplatform.domain.Media;
import io.mediaplatform.domain.MediaNotFoundException;
import io.mediaplatform.domain.MediaStatus;
import io.mediaplatform.domain.MediaType;
import io.mediaplatform.event.DomainEvent;
import io.mediaplatform.event.MediaStatusChanged;
import io.mediaplatform.outbox.OutboxRecord;
import io.mediaplatform.spi.ConnectionProvider;
import io.mediaplatform.spi.MediaStore;
import io.mediaplatform.spi.OutboxStore;
import io.mediaplatform.spi.StoreException;
import io.mediaplatform.spi.Transaction;
import io.mediaplatform.spi.TransactionManager;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Write path rules checked against in-memory collaborators. Atomicity against a real
 * database is covered in the media-jdbc module.
 */
class MediaServiceTest {
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
  private static final UUID ID = UUID.fromString("00000000-0000-0000-0000-000000000001");

  private final MemoryMediaStore mediaStore = new MemoryMediaStore();
  private final CapturingOutboxStore outboxStore = new CapturingOutboxStore();
  private final StubTransactionManager txManager = new StubTransactionManager();
  private final ConnectionProvider connections = MediaServiceTest::noopConnection;
  private final MediaService service = new MediaService(mediaStore, outboxStore, txManager, connections,
      Clock.fixed(NOW, ZoneOffset.UTC), () -> ID);

  @Test
  void createStartsUploaded() {
    Media media = service.createMedia(MediaType.VIDEO, "s3://bucket/clip.mp4");

    assertEquals(ID, media.id());
    assertEquals(MediaStatus.UPLOADED, media.status());
    assertEquals(NOW, media.createdAt());
    assertEquals(NOW, media.updatedAt());
    assertEquals(media, service.getMedia(ID));
  }

  @Test
  void createValidatesArguments() {
    assertThrows(IllegalArgumentException.class, () -> service.createMedia(null, "x"));
    assertThrows(IllegalArgumentException.class, () -> service.createMedia(MediaType.FILE, " "));
    assertTrue(mediaStore.media.isEmpty());
  }

  @Test
  void getUnknownIdIsNotFound() {
    MediaNotFoundException ex = assertThrows(MediaNotFoundException.class, () -> service.getMedia(ID));
    assertEquals(ID, ex.mediaId());
    assertThrows(IllegalArgumentException.class, () -> service.getMedia(null));
  }

  @Test
  void changeStatusUpdatesAndEnqueuesInOneCommit() {
    service.createMedia(MediaType.AUDIO, "file:///tmp/a.wav");

    Media updated = service.changeStatus(ID, MediaStatus.PROCESSING);

    assertEquals(MediaStatus.PROCESSING, updated.status());
    assertEquals(MediaStatus.PROCESSING, mediaStore.media.get(ID).status());
    assertEquals(1, outboxStore.events.size());
    MediaStatusChanged event = (MediaStatusChanged) outboxStore.events.get(0);
    assertEquals(MediaStatus.UPLOADED, event.from());
    assertEquals(MediaStatus.PROCESSING, event.to());
    assertEquals(ID.toString(), event.aggregateId());
    assertEquals(1, txManager.commits.get());
    assertSame(txManager.lastConnection, outboxStore.lastConnection, "enqueue must use the transaction's connection");
  }

  @Test
  void sameStatusWritesNothing() {
    Media created = service.createMedia(MediaType.AUDIO, "file:///tmp/a.wav");

    Media result = service.changeStatus(ID, MediaStatus.UPLOADED);

    assertEquals(created, result);
    assertTrue(outboxStore.events.isEmpty());
    assertEquals(0, mediaStore.updates.get());
    assertEquals(0, txManager.commits.get());
  }

  @Test
  void invalidTransitionWritesNothing() {
    service.createMedia(MediaType.AUDIO, "file:///tmp/a.wav");

    assertThrows(InvalidTransitionException.class, () -> service.changeStatus(ID, MediaStatus.READY));

    assertEquals(MediaStatus.UPLOADED, mediaStore.media.get(ID).status());
    assertTrue(outboxStore.events.isEmpty());
    assertEquals(0, txManager.commits.get());
    assertEquals(1, txManager.rollbacks.get());
  }

  @Test
  void changeStatusOfUnknownIdIsNotFound() {
    assertThrows(MediaNotFoundException.class, () -> service.changeStatus(ID, MediaStatus.PROCESSING));
    assertEquals(1, txManager.rollbacks.get());
  }

  @Test
  void enqueueFailureRollsBack() {
    service.createMedia(MediaType.AUDIO, "file:///tmp/a.wav");
    outboxStore.failure = new StoreException("outbox insert failed");

    assertThrows(StoreException.class, () -> service.changeStatus(ID, MediaStatus.PROCESSING));

    assertEquals(0, txManager.commits.get());
    assertEquals(1, txManager.rollbacks.get());
  }

  @Test
  void beginFailureIsWrapped() {
    service.createMedia(MediaType.AUDIO, "file:///tmp/a.wav");
    txManager.beginFailure = new SQLTransientConnectionException("pool exhausted");

    StoreException ex = assertThrows(StoreException.class, () -> service.changeStatus(ID, MediaStatus.FAILED));

    assertInstanceOf(SQLException.class, ex.getCause());
    assertTrue(outboxStore.events.isEmpty());
  }

  @Test
  void nullArgumentsAreRejectedBeforeStorage() {
    assertThrows(IllegalArgumentException.class, () -> service.changeStatus(null, MediaStatus.READY));
    assertThrows(IllegalArgumentException.class, () -> service.changeStatus(ID, null));
    assertEquals(0, txManager.begins.get());
  }

  private static Connection noopConnection() {
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(), new Class<?>[] {Connection.class}, (p, m, a) -> null);
  }

  private static final class MemoryMediaStore implements MediaStore {
    final Map<UUID, Media> media = new HashMap<>();
    final AtomicInteger updates = new AtomicInteger();

    @Override
    public void create(Connection conn, Media m) {
      media.put(m.id(), m);
    }

    @Override
    public Optional<Media> findById(Connection conn, UUID id) {
      return Optional.ofNullable(media.get(id));
    }

    @Override
    public Optional<Media> findByIdForUpdate(Connection conn, UUID id) {
      return findById(conn, id);
    }

    @Override
    public int updateStatus(Connection conn, UUID id, MediaStatus status, Instant updatedAt) {
      updates.incrementAndGet();
      Media current = media.get(id);
      if (current == null) {
        return 0;
      }
      media.put(id, current.withStatus(status, updatedAt));
      return 1;
    }
  }

  private static final class CapturingOutboxStore implements OutboxStore {
    final List<DomainEvent> events = new ArrayList<>();
    Connection lastConnection;
    RuntimeException failure;

    @Override
    public void enqueue(Connection conn, DomainEvent event) {
      if (failure != null) {
        throw failure;
      }
      lastConnection = conn;
      events.add(event);
    }

    @Override
    public List<OutboxRecord> fetchPending(Connection conn, int limit) {
      return List.of();
    }

    @Override
    public int markProcessed(Connection conn, long id) {
      return 0;
    }
  }

  private static final class StubTransactionManager implements TransactionManager {
    final AtomicInteger begins = new AtomicInteger();
    final AtomicInteger commits = new AtomicInteger();
    final AtomicInteger rollbacks = new AtomicInteger();
    SQLException beginFailure;
    Connection lastConnection;

    @Override
    public Transaction begin() throws SQLException {
      begins.incrementAndGet();
      if (beginFailure != null) {
        throw beginFailure;
      }
      Connection connection = noopConnection();
      lastConnection = connection;
      return new Transaction() {
        private boolean completed;

        @Override
        public Connection connection() {
          return connection;
        }

        @Override
        public void commit() {
          if (!completed) {
            completed = true;
            commits.incrementAndGet();
          }
        }

        @Override
        public void rollback() {
          if (!completed) {
            completed = true;
            rollbacks.incrementAndGet();
          }
        }

        @Override
        public boolean isCompleted() {
          return completed;
        }

        @Override
        public void close() {
          rollback();
        }
      };
    }
  }
}
