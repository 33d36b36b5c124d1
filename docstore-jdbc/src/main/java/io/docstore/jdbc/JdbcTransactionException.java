package io.docstore.jdbc;

/**
 * Unchecked exception for transactions that cannot be joined, used or committed, wrapping the
 * underlying {@link java.sql.SQLException} where there is one.
 */
public final class JdbcTransactionException extends RuntimeException {
  public JdbcTransactionException(String message) {
    super(message);
  }

  public JdbcTransactionException(String message, Throwable cause) {
    super(message, cause);
  }
}
