package io.docstore.database;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link Database} holding a collection catalog.
 *
 * <p>Collection creation is thread-safe; ids are assigned sequentially starting at 1.
 */
public final class SimpleDatabase implements Database {
  private final long id;
  private final String name;
  private final AtomicLong nextCollectionId = new AtomicLong(1);
  private final Map<String, CollectionInfo> byName = new ConcurrentHashMap<>();
  private final Map<Long, CollectionInfo> byId = new ConcurrentHashMap<>();

  public SimpleDatabase(long id, String name) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }
    this.id = id;
  }

  @Override
  public long id() {
    return id;
  }

  @Override
  public String name() {
    return name;
  }

  /**
   * Creates a collection, or returns the existing one with the same name.
   *
   * @param collectionName the collection name
   * @return the created or existing collection
   */
  public CollectionInfo createCollection(String collectionName) {
    Objects.requireNonNull(collectionName, "collectionName");
    if (collectionName.isEmpty()) {
      throw new IllegalArgumentException("collectionName must not be empty");
    }
    return byName.computeIfAbsent(collectionName, n -> {
      CollectionInfo info = new CollectionInfo(nextCollectionId.getAndIncrement(), n);
      byId.put(info.id(), info);
      return info;
    });
  }

  @Override
  public Optional<CollectionInfo> collection(String collectionName) {
    return Optional.ofNullable(byName.get(collectionName));
  }

  @Override
  public Optional<CollectionInfo> collection(long collectionId) {
    return Optional.ofNullable(byId.get(collectionId));
  }

  @Override
  public String toString() {
    return "SimpleDatabase{id=" + id + ", name='" + name + "'}";
  }
}
