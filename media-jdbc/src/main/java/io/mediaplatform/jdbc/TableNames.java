package io.mediaplatform.jdbc;

import java.util.Objects;

/**
 * Table name defaults and validation. Names are concatenated into SQL, so only plain
 * identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_OUTBOX_TABLE = "outbox";
  public static final String DEFAULT_MEDIA_TABLE = "media";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * @return {@code tableName} unchanged
   * @throws IllegalArgumentException if it is not a plain SQL identifier
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
