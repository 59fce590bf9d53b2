package io.mediaplatform.jdbc.store;

import io.mediaplatform.event.EventSerializer;

import java.util.List;

/**
 * H2 outbox store. Uses the default two-phase claim from {@link AbstractJdbcOutboxStore}.
 */
public final class H2OutboxStore extends AbstractJdbcOutboxStore {

  public H2OutboxStore() {
    super();
  }

  public H2OutboxStore(String tableName) {
    super(tableName);
  }

  public H2OutboxStore(String tableName, EventSerializer serializer) {
    super(tableName, serializer);
  }

  @Override
  public AbstractJdbcOutboxStore withTableName(String tableName) {
    return new H2OutboxStore(tableName, serializer());
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
