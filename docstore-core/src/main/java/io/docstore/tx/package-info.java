/**
 * Transaction contexts: the per-execution-unit record of the active transaction.
 *
 * <p>Callers begin a transaction, register it with the context, and unregister it when the
 * transaction completes. Nested operations ask the context for the parent transaction and join it
 * only when the context {@linkplain io.docstore.tx.TransactionContext#isEmbeddable() is
 * embeddable}.
 *
 * @see io.docstore.tx.TransactionContext
 * @see io.docstore.tx.ScopedTransactionContext
 * @see io.docstore.tx.ContextSlot
 */
package io.docstore.tx;
