package io.mediaplatform.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Handle to one open database transaction. Every store call that must be part of
 * the transaction receives {@link #connection()} explicitly.
 *
 * <p>Use with try-with-resources. If neither {@link #commit()} nor {@link #rollback()}
 * was called, {@link #close()} rolls back.
 *
 * @see TransactionManager
 */
public interface Transaction extends AutoCloseable {

    /**
     * The connection bound to this transaction. Auto-commit is off.
     */
    Connection connection();

    /**
     * Commits. Rolls back and rethrows if the commit itself fails. No-op once completed.
     */
    void commit() throws SQLException;

    /**
     * Rolls back. No-op once completed.
     */
    void rollback() throws SQLException;

    boolean isCompleted();

    @Override
    void close() throws SQLException;
}
