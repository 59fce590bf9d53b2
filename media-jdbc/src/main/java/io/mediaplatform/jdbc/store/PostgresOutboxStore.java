package io.mediaplatform.jdbc.store;

import io.mediaplatform.event.EventSerializer;
import io.mediaplatform.jdbc.JdbcTemplate;
import io.mediaplatform.outbox.OutboxRecord;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL outbox store. The payload column is {@code JSONB}.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a
 * single-round-trip claim.
 */
public final class PostgresOutboxStore extends AbstractJdbcOutboxStore {

  public PostgresOutboxStore() {
    super();
  }

  public PostgresOutboxStore(String tableName) {
    super(tableName);
  }

  public PostgresOutboxStore(String tableName, EventSerializer serializer) {
    super(tableName, serializer);
  }

  @Override
  public AbstractJdbcOutboxStore withTableName(String tableName) {
    return new PostgresOutboxStore(tableName, serializer());
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String payloadPlaceholder() {
    return "CAST(? AS jsonb)";
  }

  @Override
  public List<OutboxRecord> claimPending(Connection conn, String ownerId, Instant now,
      Instant lockExpiry, int limit) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=? " +
        "WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE processed_at IS NULL" +
        " AND (locked_by IS NULL OR locked_by=? OR locked_at < ?)" +
        " ORDER BY id LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + RECORD_COLUMNS;
    List<OutboxRecord> claimed = new ArrayList<>(
        JdbcTemplate.updateReturning(conn, sql, RECORD_ROW_MAPPER, ownerId, nowMs, ownerId, lockExpiry, limit));
    // RETURNING does not preserve the subquery order
    claimed.sort(Comparator.comparingLong(OutboxRecord::id));
    return claimed;
  }
}
