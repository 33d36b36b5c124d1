package io.docstore.database;

import java.util.Objects;

/**
 * Identifier and name of a collection inside a {@link Database}.
 *
 * @param id   internal collection id, unique within its database
 * @param name collection name
 */
public record CollectionInfo(long id, String name) {

  public CollectionInfo {
    Objects.requireNonNull(name, "name");
    if (id <= 0L) {
      throw new IllegalArgumentException("id must be > 0");
    }
  }
}
