package io.docstore.codec;

import io.docstore.resolver.NameResolver;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * {@link CustomTypeHandler} that resolves collection names through a {@link NameResolver}.
 *
 * <p>Ids of collections the resolver does not know are encoded with the collection name
 * {@link NameResolver#UNKNOWN}; decoding such a handle fails.
 */
public final class DocumentIdTypeHandler implements CustomTypeHandler {
  private final NameResolver resolver;

  public DocumentIdTypeHandler(NameResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  public NameResolver resolver() {
    return resolver;
  }

  @Override
  public String toHandle(DocumentId id) {
    Objects.requireNonNull(id, "id");
    return resolver.collectionNameOrUnknown(id.collectionId()) + HANDLE_SEPARATOR + id.key();
  }

  @Override
  public DocumentId fromHandle(String handle) {
    Objects.requireNonNull(handle, "handle");
    int sep = handle.indexOf(HANDLE_SEPARATOR);
    if (sep <= 0 || sep == handle.length() - 1) {
      throw new IllegalArgumentException("Invalid document handle: " + handle);
    }
    String collection = handle.substring(0, sep);
    OptionalLong collectionId = resolver.collectionId(collection);
    if (collectionId.isEmpty()) {
      throw new IllegalArgumentException("Unknown collection in document handle: " + handle);
    }
    return new DocumentId(collectionId.getAsLong(), handle.substring(sep + 1));
  }
}
