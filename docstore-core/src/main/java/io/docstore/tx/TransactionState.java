package io.docstore.tx;

/**
 * A running transaction as seen by a {@link TransactionContext}.
 *
 * <p>Contexts only track the association with the current transaction. The transaction's
 * lifetime belongs to whoever began it; a context never commits, aborts or closes it.
 */
public interface TransactionState {

  /**
   * Returns an identifier for logging and diagnostics.
   */
  String id();

  /**
   * Returns {@code true} while the transaction has neither committed nor rolled back.
   */
  boolean isActive();
}
