package io.docstore.upgrade;

import java.util.List;

/**
 * A unit of server startup. The hosting server orders features by {@link #startsAfter()}, calls
 * {@link #validateOptions()} on all of them, then {@link #start()} in order.
 */
public interface ServerFeature {

  String name();

  /**
   * Names of the features that must start before this one.
   */
  default List<String> startsAfter() {
    return List.of();
  }

  /**
   * Checks the feature's options before any feature starts.
   */
  default void validateOptions() {
  }

  void start();
}
