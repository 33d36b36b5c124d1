/**
 * JDBC transactions registered with a {@link io.docstore.tx.TransactionContext}.
 *
 * <p>{@link io.docstore.jdbc.tx.JdbcTransactionManager} decides per call whether to join the
 * context's parent transaction, open an independent one next to it, or register a new one.
 */
package io.docstore.jdbc.tx;
