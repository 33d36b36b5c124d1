package io.docstore.tx;

import io.docstore.database.Database;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link TransactionContext} for operations that run outside any maintenance sandbox.
 *
 * <p>Keeps its registered transaction locally. Embeddability is fixed at construction and
 * defaults to {@code false}.
 */
public final class StandaloneTransactionContext extends AbstractTransactionContext {
  private final boolean embeddable;
  private TransactionState currentTransaction;

  public StandaloneTransactionContext(Database database) {
    this(database, false);
  }

  public StandaloneTransactionContext(Database database, boolean embeddable) {
    super(database);
    this.embeddable = embeddable;
  }

  @Override
  public void registerTransaction(TransactionState transaction) {
    Objects.requireNonNull(transaction, "transaction");
    if (currentTransaction != null) {
      throw new ContextStateException(
          "Transaction " + currentTransaction.id() + " already registered in context");
    }
    currentTransaction = transaction;
  }

  @Override
  public void unregisterTransaction() {
    currentTransaction = null;
  }

  @Override
  public Optional<TransactionState> getParentTransaction() {
    return Optional.ofNullable(currentTransaction);
  }

  @Override
  public boolean isEmbeddable() {
    return embeddable;
  }
}
