package io.docstore.jdbc.tx;

import io.docstore.jdbc.JdbcTransactionException;
import io.docstore.tx.TransactionState;

import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TransactionState} owning one JDBC connection with auto-commit disabled.
 *
 * <p>Created and completed by {@link JdbcTransactionManager}; nested handles that joined the
 * transaction can only mark it rollback-only.
 */
public final class JdbcTransactionState implements TransactionState {
  private final String id;
  private final Connection connection;
  private boolean active = true;
  private boolean rollbackOnly;

  JdbcTransactionState(String id, Connection connection) {
    this.id = Objects.requireNonNull(id, "id");
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public boolean isActive() {
    return active;
  }

  /**
   * Returns the connection of this transaction.
   *
   * @throws JdbcTransactionException if the transaction has completed
   */
  public Connection connection() {
    if (!active) {
      throw new JdbcTransactionException("Transaction " + id + " has already completed");
    }
    return connection;
  }

  public boolean isRollbackOnly() {
    return rollbackOnly;
  }

  void markRollbackOnly() {
    rollbackOnly = true;
  }

  Connection rawConnection() {
    return connection;
  }

  void deactivate() {
    active = false;
  }

  @Override
  public String toString() {
    return "JdbcTransactionState{id=" + id + ", active=" + active + ", rollbackOnly=" + rollbackOnly + "}";
  }
}
