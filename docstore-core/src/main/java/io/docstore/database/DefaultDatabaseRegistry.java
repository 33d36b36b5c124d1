package io.docstore.database;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory {@link DatabaseRegistry}. The system database is created on construction.
 *
 * <p>Create and drop take the write lock; {@link #snapshot()} copies the current list under the
 * read lock, so a sweep never observes a half-applied create or drop.
 */
public final class DefaultDatabaseRegistry implements DatabaseRegistry {
  private static final Logger logger = Logger.getLogger(DefaultDatabaseRegistry.class.getName());

  private final ReadWriteLock protector = new ReentrantReadWriteLock();
  private final Map<String, SimpleDatabase> databases = new LinkedHashMap<>();
  private final SimpleDatabase system;
  private long nextId = 1;

  public DefaultDatabaseRegistry() {
    this.system = create(Database.SYSTEM_DATABASE);
  }

  /**
   * Creates a database, or returns the existing one with the same name.
   *
   * @param name database name
   * @return the created or existing database
   */
  public SimpleDatabase create(String name) {
    Objects.requireNonNull(name, "name");
    protector.writeLock().lock();
    try {
      SimpleDatabase existing = databases.get(name);
      if (existing != null) {
        return existing;
      }
      SimpleDatabase created = new SimpleDatabase(nextId++, name);
      databases.put(name, created);
      logger.log(Level.FINE, "Created database ''{0}''", name);
      return created;
    } finally {
      protector.writeLock().unlock();
    }
  }

  /**
   * Drops a database.
   *
   * @param name database name
   * @return {@code true} if the database existed
   * @throws IllegalArgumentException if {@code name} is the system database
   */
  public boolean drop(String name) {
    Objects.requireNonNull(name, "name");
    if (Database.SYSTEM_DATABASE.equals(name)) {
      throw new IllegalArgumentException("The system database cannot be dropped");
    }
    protector.writeLock().lock();
    try {
      boolean removed = databases.remove(name) != null;
      if (removed) {
        logger.log(Level.FINE, "Dropped database ''{0}''", name);
      }
      return removed;
    } finally {
      protector.writeLock().unlock();
    }
  }

  /**
   * Looks up a database by name.
   */
  public Optional<Database> lookup(String name) {
    protector.readLock().lock();
    try {
      return Optional.ofNullable(databases.get(name));
    } finally {
      protector.readLock().unlock();
    }
  }

  @Override
  public Database systemDatabase() {
    return system;
  }

  @Override
  public List<Database> snapshot() {
    protector.readLock().lock();
    try {
      return List.copyOf(databases.values());
    } finally {
      protector.readLock().unlock();
    }
  }
}
