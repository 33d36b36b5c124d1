package io.docstore.jdbc.tx;

import io.docstore.jdbc.ConnectionProvider;
import io.docstore.jdbc.JdbcTransactionException;
import io.docstore.tx.StandaloneTransactionContext;
import io.docstore.tx.TransactionContext;
import io.docstore.tx.TransactionState;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction manager for JDBC work driven by a {@link TransactionContext}.
 *
 * <p>{@link #begin(TransactionContext)} looks at the context's parent transaction:
 * <ul>
 *   <li>none: obtains a connection, disables auto-commit and registers a new
 *       {@link JdbcTransactionState} with the context;</li>
 *   <li>present and the context is embeddable: joins it. Commit of the joined handle is deferred
 *       to the outer handle, rollback marks the outer transaction rollback-only;</li>
 *   <li>present and the context is not embeddable: opens an independent transaction registered
 *       with a fresh {@link StandaloneTransactionContext} for the same database.</li>
 * </ul>
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin(context)) {
 *     tx.connection().createStatement().execute(sql);
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AtomicLong sequence = new AtomicLong();

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Begins a transaction for {@code context}, joining its parent transaction where allowed.
   *
   * @param context the context of the calling operation
   * @return a transaction handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained or prepared
   * @throws JdbcTransactionException if the parent transaction to join is not JDBC-backed or has
   *     completed
   */
  public Transaction begin(TransactionContext context) throws SQLException {
    Objects.requireNonNull(context, "context");
    Optional<TransactionState> parent = context.getParentTransaction();
    if (parent.isPresent()) {
      if (context.isEmbeddable()) {
        return join(context, parent.get());
      }
      logger.log(Level.FINE, "Context is not embeddable, opening independent transaction next to {0}",
          parent.get().id());
      context = new StandaloneTransactionContext(context.database());
    }
    return open(context);
  }

  /**
   * Returns the connection of the transaction registered with {@code context}, if any.
   */
  public static Optional<Connection> currentConnection(TransactionContext context) {
    return context.getParentTransaction()
        .filter(JdbcTransactionState.class::isInstance)
        .map(JdbcTransactionState.class::cast)
        .filter(JdbcTransactionState::isActive)
        .map(JdbcTransactionState::connection);
  }

  private Transaction open(TransactionContext context) throws SQLException {
    Connection connection = connectionProvider.getConnection();
    JdbcTransactionState state = new JdbcTransactionState("jdbc-" + sequence.incrementAndGet(), connection);
    try {
      connection.setAutoCommit(false);
      context.registerTransaction(state);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
    logger.log(Level.FINEST, "Began transaction {0}", state.id());
    return new Transaction(context, state, true);
  }

  private Transaction join(TransactionContext context, TransactionState parent) {
    if (!(parent instanceof JdbcTransactionState)) {
      throw new JdbcTransactionException("Cannot join non-JDBC transaction " + parent.id());
    }
    JdbcTransactionState state = (JdbcTransactionState) parent;
    if (!state.isActive()) {
      throw new JdbcTransactionException("Cannot join completed transaction " + state.id());
    }
    logger.log(Level.FINEST, "Joined transaction {0}", state.id());
    return new Transaction(context, state, false);
  }

  /**
   * A transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}. If neither
   * is called, {@link #close()} rolls back.
   *
   * <p>The handle that opened the transaction unregisters it from its context when it completes,
   * on every path. A handle that joined a parent transaction never commits, rolls back or closes
   * the connection itself.
   */
  public static final class Transaction implements AutoCloseable {
    private final TransactionContext context;
    private final JdbcTransactionState state;
    private final boolean owner;
    private boolean completed;

    private Transaction(TransactionContext context, JdbcTransactionState state, boolean owner) {
      this.context = context;
      this.state = state;
      this.owner = owner;
    }

    /**
     * Returns the context the transaction is registered with. For an independent transaction this
     * is the standalone context created for it.
     */
    public TransactionContext context() {
      return context;
    }

    public JdbcTransactionState state() {
      return state;
    }

    public Connection connection() {
      return state.connection();
    }

    /**
     * Returns {@code true} if this handle joined a parent transaction.
     */
    public boolean isJoined() {
      return !owner;
    }

    /**
     * Commits the transaction. On a joined handle this only completes the handle.
     *
     * @throws SQLException if the commit fails; the transaction is rolled back
     * @throws JdbcTransactionException if a joined handle marked the transaction rollback-only; the
     *     transaction is rolled back
     */
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      if (!owner) {
        completed = true;
        return;
      }
      Connection connection = state.rawConnection();
      if (state.isRollbackOnly()) {
        try {
          connection.rollback();
        } finally {
          finalizeTx();
        }
        throw new JdbcTransactionException(
            "Transaction " + state.id() + " was marked rollback-only and has been rolled back");
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

    /**
     * Rolls the transaction back. On a joined handle this marks the transaction rollback-only.
     */
    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      if (!owner) {
        completed = true;
        state.markRollbackOnly();
        return;
      }
      try {
        state.rawConnection().rollback();
      } finally {
        finalizeTx();
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx() throws SQLException {
      completed = true;
      state.deactivate();
      context.unregisterTransaction();
      Connection connection = state.rawConnection();
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        try {
          connection.close();
        } catch (SQLException closeError) {
          e.addSuppressed(closeError);
        }
        throw e;
      }
      connection.close();
    }

    private void safeRollback(SQLException cause) {
      try {
        state.rawConnection().rollback();
      } catch (SQLException e) {
        cause.addSuppressed(e);
      }
    }
  }
}
