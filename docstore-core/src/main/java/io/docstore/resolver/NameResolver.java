package io.docstore.resolver;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Maps collection names to internal collection ids and back, scoped to one database.
 *
 * <p>Obtained through {@link io.docstore.tx.TransactionContext#getResolver()}; a context builds its
 * resolver once and hands out the same instance for the rest of its life.
 *
 * @see CollectionNameResolver
 */
public interface NameResolver {

  /** Name reported for a collection id the resolver does not know. */
  String UNKNOWN = "_unknown";

  /**
   * Resolves a collection name to its id. A string made of digits only is treated as an id and
   * resolved if such a collection exists.
   *
   * @param name collection name or numeric id
   * @return the collection id, or empty if the collection does not exist
   */
  OptionalLong collectionId(String name);

  /**
   * Resolves a collection id to its name.
   *
   * @param id collection id
   * @return the collection name, or empty if the collection does not exist
   */
  Optional<String> collectionName(long id);

  /**
   * Resolves a collection id to its name, returning {@link #UNKNOWN} for unknown ids.
   */
  default String collectionNameOrUnknown(long id) {
    return collectionName(id).orElse(UNKNOWN);
  }
}
