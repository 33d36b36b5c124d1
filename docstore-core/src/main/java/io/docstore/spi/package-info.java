/**
 * Service Provider Interfaces the upgrade feature consumes from the hosting server.
 *
 * @see io.docstore.spi.WriteAheadLog
 * @see io.docstore.spi.ServerLifecycle
 * @see io.docstore.spi.FatalErrorHandler
 * @see io.docstore.spi.UpgradeMetrics
 */
package io.docstore.spi;
