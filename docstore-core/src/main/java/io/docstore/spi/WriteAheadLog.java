package io.docstore.spi;

/**
 * The server's write-ahead log as seen by the bootstrap sequence.
 */
@FunctionalInterface
public interface WriteAheadLog {

  /**
   * Opens the log for writing, finishing crash recovery first.
   *
   * @return {@code true} if the log is open and recovery completed
   */
  boolean open();
}
