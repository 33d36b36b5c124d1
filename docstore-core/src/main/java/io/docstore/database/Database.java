package io.docstore.database;

import java.util.Optional;

/**
 * A database known to the server. Transaction contexts reference a database but never own it.
 *
 * @see DatabaseRegistry
 */
public interface Database {

  /** Name of the system database, created with the server and never dropped. */
  String SYSTEM_DATABASE = "_system";

  long id();

  String name();

  /**
   * Returns {@code true} for the system database.
   */
  default boolean isSystem() {
    return SYSTEM_DATABASE.equals(name());
  }

  /**
   * Looks up a collection by name.
   *
   * @param name collection name
   * @return the collection, or empty if no collection with that name exists
   */
  Optional<CollectionInfo> collection(String name);

  /**
   * Looks up a collection by id.
   *
   * @param id collection id
   * @return the collection, or empty if no collection with that id exists
   */
  Optional<CollectionInfo> collection(long id);
}
