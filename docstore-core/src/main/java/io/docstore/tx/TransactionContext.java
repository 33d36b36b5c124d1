package io.docstore.tx;

import io.docstore.codec.CustomTypeHandler;
import io.docstore.database.Database;
import io.docstore.resolver.NameResolver;

import java.util.Optional;

/**
 * Tracks which transaction is active for one execution unit (a request, a maintenance task or a
 * bootstrap sequence) and whether nested operations may join it.
 *
 * <p>A context is owned by exactly one execution unit at a time and is not thread-safe. It holds
 * at most one registered transaction. The resolver and the custom type handler are built lazily
 * and cached for the lifetime of the context.
 *
 * <p>Implementations: {@link StandaloneTransactionContext} (no sandbox),
 * {@link ScopedTransactionContext} (bound to the execution unit's {@link ContextSlot}).
 */
public interface TransactionContext {

  /**
   * Returns the database this context operates against.
   */
  Database database();

  /**
   * Associates {@code transaction} with this context.
   *
   * @param transaction the transaction that just began
   * @throws ContextStateException if a transaction is already registered; the registered
   *     transaction is left in place
   * @throws NullPointerException if {@code transaction} is null
   */
  void registerTransaction(TransactionState transaction);

  /**
   * Clears the association with the current transaction.
   *
   * <p>Safe to call when no transaction is registered, in which case it does nothing. Never
   * throws, so it can run on every unwind path.
   */
  void unregisterTransaction();

  /**
   * Returns the currently registered transaction, which nested operations may join when
   * {@link #isEmbeddable()} is {@code true}.
   */
  Optional<TransactionState> getParentTransaction();

  /**
   * Returns whether nested operations may join the registered transaction. A non-embeddable
   * context forces nested operations to open an independent transaction.
   */
  boolean isEmbeddable();

  /**
   * Returns the custom type handler of this context, building it on the first call. Every call on
   * the same context returns the same instance.
   */
  CustomTypeHandler orderCustomTypeHandler();

  /**
   * Returns the name resolver of this context, building it on the first call. Every call on the
   * same context returns the same instance.
   */
  NameResolver getResolver();
}
