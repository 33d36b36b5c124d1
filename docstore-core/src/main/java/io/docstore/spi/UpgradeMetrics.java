package io.docstore.spi;

/**
 * Observability hook for the database init/upgrade sweep.
 *
 * <p>Every database the sweep hands to the maintenance procedure counts as visited, whatever the
 * outcome; failures are the subset of visited databases whose procedure reported a failure or
 * raised an error. The {@link #NOOP} instance discards everything.
 */
public interface UpgradeMetrics {

  /**
   * No-op instance that discards all metrics.
   */
  UpgradeMetrics NOOP = new Noop();

  /**
   * Increments the count of databases the maintenance procedure was invoked for. Called before
   * the procedure runs.
   */
  void incrementDatabasesVisited();

  /**
   * Increments the count of visited databases whose maintenance procedure reported a failure or
   * raised an error.
   */
  void incrementDatabaseFailures();

  /**
   * Records how long the last sweep took.
   *
   * @param durationMs sweep duration in milliseconds (always non-negative)
   */
  void recordSweepDurationMs(long durationMs);

  /**
   * Default no-op implementation.
   */
  final class Noop implements UpgradeMetrics {
    @Override
    public void incrementDatabasesVisited() {
    }

    @Override
    public void incrementDatabaseFailures() {
    }

    @Override
    public void recordSweepDurationMs(long durationMs) {
    }
  }
}
