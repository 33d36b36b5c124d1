/**
 * JDBC integration: connection sourcing and the exception type of the JDBC module.
 *
 * @see io.docstore.jdbc.tx.JdbcTransactionManager
 */
package io.docstore.jdbc;
