package io.docstore.spi;

import io.docstore.upgrade.FatalStartupException;

/**
 * Receives fatal startup conditions after they have been logged.
 *
 * <p>Handlers are expected to terminate the process. A handler that returns lets the caller
 * rethrow the exception, so no further startup work happens either way.
 */
@FunctionalInterface
public interface FatalErrorHandler {

  /** Calls {@link System#exit(int)} with status 1, running shutdown hooks. */
  FatalErrorHandler EXIT = error -> System.exit(1);

  /**
   * Calls {@link Runtime#halt(int)} with status 1. Shutdown hooks do not run, which is required
   * when the failure happens on a thread that a shutdown hook would wait for.
   */
  FatalErrorHandler HALT = error -> Runtime.getRuntime().halt(1);

  /**
   * Returns without terminating, so the caller rethrows the exception. Used where an enclosing
   * container handles startup failures, and in tests.
   */
  FatalErrorHandler RETHROW = error -> {
  };

  /**
   * Handles a fatal condition.
   *
   * @param error the condition, already logged
   */
  void onFatal(FatalStartupException error);
}
