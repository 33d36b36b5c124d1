/**
 * Transaction context subsystem of a document database server.
 *
 * <h2>Core Design</h2>
 * <p>A {@linkplain io.docstore.tx.TransactionContext transaction context} records, for one
 * execution unit, which transaction is active and whether nested operations may join it. Contexts
 * reference transactions without owning them and cache a
 * {@linkplain io.docstore.resolver.NameResolver name resolver} and a
 * {@linkplain io.docstore.codec.CustomTypeHandler custom type handler} for their lifetime.
 *
 * <p>Inside a {@linkplain io.docstore.sandbox.MaintenanceSandbox maintenance sandbox}, contexts are
 * {@linkplain io.docstore.tx.ScopedTransactionContext scoped}: they share the global context that
 * occupies the thread's {@linkplain io.docstore.tx.ContextSlot context slot}.
 *
 * <p>At startup the {@linkplain io.docstore.upgrade.UpgradeFeature upgrade feature} runs the
 * init/upgrade procedure against every database through one sandbox entry.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>docstore-core</b>: contexts, sandbox, upgrade sweep, SPIs (zero external deps)</li>
 *   <li><b>docstore-jdbc</b>: JDBC transactions that join or open transactions through a context</li>
 *   <li><b>docstore-micrometer</b>: Micrometer metrics for the sweep</li>
 *   <li><b>docstore-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * TransactionContext context = new StandaloneTransactionContext(database, true);
 * context.registerTransaction(transaction);
 * try {
 *     CustomTypeHandler handler = context.orderCustomTypeHandler();
 *     String handle = handler.toHandle(new DocumentId(collectionId, "alice"));
 * } finally {
 *     context.unregisterTransaction();
 * }
 * }</pre>
 */
package io.docstore;
