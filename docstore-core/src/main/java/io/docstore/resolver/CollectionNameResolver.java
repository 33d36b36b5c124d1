package io.docstore.resolver;

import io.docstore.database.CollectionInfo;
import io.docstore.database.Database;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link NameResolver} bound to one {@link Database} that memoizes successful lookups in both
 * directions.
 *
 * <p>Not thread-safe. A resolver belongs to one transaction context, and a context is used by one
 * execution unit at a time. Misses are not cached, so a collection created after a failed lookup
 * is found on the next call.
 */
public final class CollectionNameResolver implements NameResolver {
  private final Database database;
  private final Map<String, Long> idsByName = new HashMap<>();
  private final Map<Long, String> namesById = new HashMap<>();

  public CollectionNameResolver(Database database) {
    this.database = Objects.requireNonNull(database, "database");
  }

  public Database database() {
    return database;
  }

  @Override
  public OptionalLong collectionId(String name) {
    Objects.requireNonNull(name, "name");
    Long cached = idsByName.get(name);
    if (cached != null) {
      return OptionalLong.of(cached);
    }
    Optional<CollectionInfo> found = isNumeric(name)
        ? database.collection(Long.parseLong(name))
        : database.collection(name);
    if (found.isEmpty()) {
      return OptionalLong.empty();
    }
    CollectionInfo info = found.get();
    idsByName.put(name, info.id());
    namesById.put(info.id(), info.name());
    return OptionalLong.of(info.id());
  }

  @Override
  public Optional<String> collectionName(long id) {
    String cached = namesById.get(id);
    if (cached != null) {
      return Optional.of(cached);
    }
    Optional<CollectionInfo> found = database.collection(id);
    found.ifPresent(info -> {
      namesById.put(info.id(), info.name());
      idsByName.put(info.name(), info.id());
    });
    return found.map(CollectionInfo::name);
  }

  private static boolean isNumeric(String name) {
    if (name.isEmpty() || name.length() > 18) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }
}
