package io.mediaplatform.jdbc.store;

import io.mediaplatform.event.DomainEvent;
import io.mediaplatform.event.EventSerializer;
import io.mediaplatform.jdbc.JdbcTemplate;
import io.mediaplatform.jdbc.TableNames;
import io.mediaplatform.outbox.OutboxRecord;
import io.mediaplatform.spi.OutboxStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC outbox store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimPending} to provide database-specific claim
 * strategies, and {@link #payloadPlaceholder()} when the payload column needs a cast.
 * Register custom implementations via
 * {@code META-INF/services/io.mediaplatform.jdbc.store.AbstractJdbcOutboxStore}.
 *
 * @see JdbcOutboxStores
 */
public abstract class AbstractJdbcOutboxStore implements OutboxStore {

  protected static final String RECORD_COLUMNS =
      "id, event_id, event_type, aggregate_id, payload, occurred_at, processed_at";

  protected static final JdbcTemplate.RowMapper<OutboxRecord> RECORD_ROW_MAPPER = rs -> new OutboxRecord(
      rs.getLong("id"),
      rs.getString("event_id"),
      rs.getString("event_type"),
      rs.getString("aggregate_id"),
      rs.getString("payload"),
      JdbcTemplate.instant(rs, "occurred_at"),
      JdbcTemplate.instant(rs, "processed_at"));

  private final String tableName;
  private final EventSerializer serializer;

  protected AbstractJdbcOutboxStore() {
    this(TableNames.DEFAULT_OUTBOX_TABLE);
  }

  protected AbstractJdbcOutboxStore(String tableName) {
    this(tableName, new EventSerializer());
  }

  protected AbstractJdbcOutboxStore(String tableName, EventSerializer serializer) {
    this.tableName = TableNames.validate(tableName);
    this.serializer = Objects.requireNonNull(serializer, "serializer");
  }

  /**
   * Unique identifier for this outbox store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this outbox store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store bound to another table.
   */
  public abstract AbstractJdbcOutboxStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  protected EventSerializer serializer() {
    return serializer;
  }

  /**
   * Bind placeholder used for the payload column in INSERT statements.
   */
  protected String payloadPlaceholder() {
    return "?";
  }

  @Override
  public void enqueue(Connection conn, DomainEvent event) {
    Objects.requireNonNull(event, "event");
    String payload = serializer.serialize(event);
    String sql = "INSERT INTO " + tableName() +
        " (event_id, event_type, aggregate_id, payload, occurred_at, created_at)" +
        " VALUES (?,?,?," + payloadPlaceholder() + ",?,?)";
    JdbcTemplate.update(conn, sql,
        event.eventId(), event.eventType(), event.aggregateId(), payload,
        event.occurredAt(), Instant.now());
  }

  @Override
  public List<OutboxRecord> fetchPending(Connection conn, int limit) {
    String sql = "SELECT " + RECORD_COLUMNS + " FROM " + tableName() +
        " WHERE processed_at IS NULL ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, limit);
  }

  @Override
  public int markProcessed(Connection conn, long id) {
    String sql = "UPDATE " + tableName() +
        " SET processed_at=?, locked_by=NULL, locked_at=NULL" +
        " WHERE id=? AND processed_at IS NULL";
    return JdbcTemplate.update(conn, sql, Instant.now(), id);
  }

  /**
   * Looks a record up by its event id, processed or not.
   */
  public Optional<OutboxRecord> findByEventId(Connection conn, String eventId) {
    Objects.requireNonNull(eventId, "eventId");
    String sql = "SELECT " + RECORD_COLUMNS + " FROM " + tableName() + " WHERE event_id=?";
    List<OutboxRecord> rows = JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, eventId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /**
   * Two-phase claim: UPDATE with a subquery, then SELECT the rows stamped with this
   * owner and timestamp. Rows this owner claimed earlier but never marked are
   * claimed again.
   */
  @Override
  public List<OutboxRecord> claimPending(Connection conn, String ownerId, Instant now,
      Instant lockExpiry, int limit) {
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String claimSql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=? " +
        "WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE processed_at IS NULL" +
        " AND (locked_by IS NULL OR locked_by=? OR locked_at < ?)" +
        " ORDER BY id LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql, ownerId, nowMs, ownerId, lockExpiry, limit);
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, ownerId, nowMs);
  }

  /**
   * Selects rows claimed by the given owner at the given lock timestamp.
   */
  protected List<OutboxRecord> selectClaimed(Connection conn, String ownerId, Instant lockedAt) {
    String sql = "SELECT " + RECORD_COLUMNS + " FROM " + tableName() +
        " WHERE locked_by=? AND locked_at=? AND processed_at IS NULL ORDER BY id";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, ownerId, lockedAt);
  }
}
