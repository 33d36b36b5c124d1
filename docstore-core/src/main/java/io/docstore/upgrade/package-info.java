/**
 * Bootstrap init/upgrade sweep.
 *
 * <p>{@link io.docstore.upgrade.UpgradeFeature} validates the upgrade options, opens the write-ahead
 * log and runs a {@link io.docstore.sandbox.MaintenanceProcedure} against every known database
 * inside one global sandbox entry. Failures are fatal: the sweep stops at the first failing
 * database and the server does not start.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * UpgradeFeature feature = UpgradeFeature.builder()
 *     .options(new UpgradeOptions().setUpgrade(true))
 *     .registry(registry)
 *     .sandbox(new LocalMaintenanceSandbox())
 *     .writeAheadLog(wal)
 *     .lifecycle(lifecycle)
 *     .procedure((database, sandbox) -> upgrader.upgrade(database))
 *     .build();
 * feature.validateOptions();
 * feature.start();
 * }</pre>
 */
package io.docstore.upgrade;
