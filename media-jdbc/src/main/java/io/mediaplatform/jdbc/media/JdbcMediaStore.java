package io.mediaplatform.jdbc.media;

import io.mediaplatform.domain.Media;
import io.mediaplatform.domain.MediaConflictException;
import io.mediaplatform.domain.MediaStatus;
import io.mediaplatform.domain.MediaType;
import io.mediaplatform.jdbc.JdbcTemplate;
import io.mediaplatform.jdbc.TableNames;
import io.mediaplatform.spi.MediaStore;
import io.mediaplatform.spi.StoreException;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link MediaStore} over a single table. The SQL is portable across H2 and PostgreSQL.
 *
 * <p>Expected columns: {@code id} (UUID primary key), {@code status}, {@code type},
 * {@code source}, {@code created_at}, {@code updated_at}.
 */
public class JdbcMediaStore implements MediaStore {
  private static final String COLUMNS = "id, status, type, source, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<Media> MEDIA_ROW_MAPPER = rs -> new Media(
      rs.getObject("id", UUID.class),
      MediaStatus.fromCode(rs.getString("status")),
      MediaType.fromCode(rs.getString("type")),
      rs.getString("source"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"));

  private final String tableName;

  public JdbcMediaStore() {
    this(TableNames.DEFAULT_MEDIA_TABLE);
  }

  public JdbcMediaStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public void create(Connection conn, Media media) {
    Objects.requireNonNull(media, "media");
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?)";
    try {
      JdbcTemplate.update(conn, sql,
          media.id(), media.status().code(), media.type().code(), media.source(),
          media.createdAt(), media.updatedAt());
    } catch (StoreException e) {
      if (JdbcTemplate.isUniqueViolation(e)) {
        throw new MediaConflictException(media.id(), e.getCause());
      }
      throw e;
    }
  }

  @Override
  public Optional<Media> findById(Connection conn, UUID id) {
    return selectOne(conn, "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?", id);
  }

  @Override
  public Optional<Media> findByIdForUpdate(Connection conn, UUID id) {
    return selectOne(conn, "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=? FOR UPDATE", id);
  }

  @Override
  public int updateStatus(Connection conn, UUID id, MediaStatus status, Instant updatedAt) {
    String sql = "UPDATE " + tableName + " SET status=?, updated_at=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, status.code(), updatedAt, id);
  }

  private Optional<Media> selectOne(Connection conn, String sql, UUID id) {
    Objects.requireNonNull(id, "id");
    List<Media> rows = JdbcTemplate.query(conn, sql, MEDIA_ROW_MAPPER, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
