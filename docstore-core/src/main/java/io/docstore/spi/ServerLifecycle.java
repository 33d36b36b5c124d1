package io.docstore.spi;

import java.util.Collection;

/**
 * Server-level switches the upgrade feature flips during startup.
 *
 * <p>Implemented by the hosting server (or the Spring Boot starter's
 * {@code SpringServerLifecycle}).
 */
public interface ServerLifecycle {

  /**
   * Disables the named features for the rest of this run.
   */
  void disableFeatures(Collection<String> featureNames);

  /**
   * Prevents the replication applier from starting.
   */
  void disableReplicationApplier();

  /**
   * Puts the database layer into upgrade mode.
   */
  void enableUpgrade();

  /**
   * Prevents the server from joining its cluster.
   */
  void disableCluster();

  /**
   * Requests a graceful shutdown once startup has finished its current step.
   */
  void beginShutdown();

  /**
   * Sets the status the process reports when it exits.
   */
  void setExitCode(int exitCode);
}
