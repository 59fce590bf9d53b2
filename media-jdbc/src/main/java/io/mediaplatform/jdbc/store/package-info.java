/**
 * Outbox table implementations for H2 and PostgreSQL, plus the
 * {@link io.mediaplatform.jdbc.store.JdbcOutboxStores} registry.
 */
package io.mediaplatform.jdbc.store;
