package io.docstore.database;

import java.util.List;

/**
 * Enumerates the databases known to the server.
 *
 * <p>{@link #snapshot()} returns a stable list taken while the registry is protected against
 * concurrent creation and deletion. Callers iterate the snapshot, never the live registry.
 *
 * @see DefaultDatabaseRegistry
 */
public interface DatabaseRegistry {

  /**
   * Returns the system database.
   */
  Database systemDatabase();

  /**
   * Returns an immutable snapshot of all known databases, system database included.
   */
  List<Database> snapshot();
}
