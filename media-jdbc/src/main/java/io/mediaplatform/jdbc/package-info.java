/**
 * JDBC building blocks shared by the media and outbox stores.
 *
 * @see io.mediaplatform.jdbc.store.JdbcOutboxStores
 * @see io.mediaplatform.jdbc.tx.JdbcTransactionManager
 */
package io.mediaplatform.jdbc;
