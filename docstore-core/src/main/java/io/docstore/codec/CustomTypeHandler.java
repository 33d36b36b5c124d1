package io.docstore.codec;

/**
 * Encodes and decodes database-specific value types inside the generic serialization format.
 *
 * <p>Document ids are stored internally as {@link DocumentId} and exposed as the string handle
 * {@code <collection name>/<key>}.
 *
 * <p>Building a handler is comparatively expensive; transaction contexts build one on first use
 * and return the same instance afterwards, see
 * {@link io.docstore.tx.TransactionContext#orderCustomTypeHandler()}.
 */
public interface CustomTypeHandler {

  /** Separator between collection name and key in a document handle. */
  char HANDLE_SEPARATOR = '/';

  /**
   * Encodes a document id as a handle.
   *
   * @param id the document id
   * @return the handle string
   */
  String toHandle(DocumentId id);

  /**
   * Decodes a handle into a document id.
   *
   * @param handle the handle string
   * @return the document id
   * @throws IllegalArgumentException if the handle is malformed or names an unknown collection
   */
  DocumentId fromHandle(String handle);
}
