package io.docstore.codec;

import java.util.Objects;

/**
 * Database-internal identifier of a document: the owning collection's id plus the document key.
 *
 * @param collectionId id of the collection holding the document
 * @param key          document key, unique within the collection
 */
public record DocumentId(long collectionId, String key) {

  public DocumentId {
    Objects.requireNonNull(key, "key");
    if (key.isEmpty()) {
      throw new IllegalArgumentException("key must not be empty");
    }
  }
}
