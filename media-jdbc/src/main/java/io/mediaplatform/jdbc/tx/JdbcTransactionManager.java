package io.mediaplatform.jdbc.tx;

import io.mediaplatform.spi.ConnectionProvider;
import io.mediaplatform.spi.Transaction;
import io.mediaplatform.spi.TransactionManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction manager for plain JDBC. Obtains a connection, disables auto-commit and
 * hands it out through the returned {@link Transaction}.
 *
 * <pre>{@code
 * try (Transaction tx = txManager.begin()) {
 *     mediaStore.updateStatus(tx.connection(), id, status, now);
 *     outboxStore.enqueue(tx.connection(), event);
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager implements TransactionManager {
  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * @return a new transaction handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  @Override
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new JdbcTransaction(connection);
  }

  /**
   * An active transaction. If neither {@link #commit()} nor {@link #rollback()} is
   * called, {@link #close()} rolls back. The connection is returned once the
   * transaction completes.
   */
  static final class JdbcTransaction implements Transaction {
    private static final Logger logger = Logger.getLogger(JdbcTransaction.class.getName());

    private final Connection connection;
    private boolean completed;

    JdbcTransaction(Connection connection) {
      this.connection = connection;
    }

    @Override
    public Connection connection() {
      if (completed) {
        throw new IllegalStateException("Transaction already completed");
      }
      return connection;
    }

    @Override
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        safeRollback(e);
        throw e;
      } finally {
        finalizeTx();
      }
    }

    @Override
    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finalizeTx();
      }
    }

    @Override
    public boolean isCompleted() {
      return completed;
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx() throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        logger.log(Level.FINE, "Failed to restore auto-commit before returning the connection", e);
      } finally {
        connection.close();
      }
    }

    private void safeRollback(SQLException commitFailure) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        commitFailure.addSuppressed(e);
      }
    }
  }
}
