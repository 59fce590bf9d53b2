package io.mediaplatform.spi;

import java.sql.SQLException;

/**
 * Opens transactions for the media write path.
 *
 * <pre>{@code
 * try (Transaction tx = txManager.begin()) {
 *     mediaStore.updateStatus(tx.connection(), id, status, now);
 *     outboxStore.enqueue(tx.connection(), event);
 *     tx.commit();
 * }
 * }</pre>
 */
public interface TransactionManager {

    /**
     * @return a new transaction; the caller must close it
     * @throws SQLException if a connection cannot be obtained or configured
     */
    Transaction begin() throws SQLException;
}
