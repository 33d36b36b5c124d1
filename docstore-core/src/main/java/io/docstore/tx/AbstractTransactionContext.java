package io.docstore.tx;

import io.docstore.codec.CustomTypeHandler;
import io.docstore.codec.DocumentIdTypeHandler;
import io.docstore.database.Database;
import io.docstore.resolver.CollectionNameResolver;
import io.docstore.resolver.NameResolver;

import java.util.Objects;

/**
 * Base class holding the database binding and the lazily built resolver and type handler.
 *
 * <p>The type handler is built from {@link #getResolver()}, so both share one resolver.
 * No locking: a context is never used by two execution units concurrently.
 */
public abstract class AbstractTransactionContext implements TransactionContext {
  private final Database database;
  private NameResolver resolver;
  private CustomTypeHandler customTypeHandler;

  protected AbstractTransactionContext(Database database) {
    this.database = Objects.requireNonNull(database, "database");
  }

  @Override
  public final Database database() {
    return database;
  }

  @Override
  public final CustomTypeHandler orderCustomTypeHandler() {
    if (customTypeHandler == null) {
      customTypeHandler = Objects.requireNonNull(
          createCustomTypeHandler(getResolver()), "createCustomTypeHandler returned null");
    }
    return customTypeHandler;
  }

  @Override
  public final NameResolver getResolver() {
    if (resolver == null) {
      resolver = Objects.requireNonNull(createResolver(), "createResolver returned null");
    }
    return resolver;
  }

  /**
   * Builds the resolver. Called at most once per context.
   */
  protected NameResolver createResolver() {
    return new CollectionNameResolver(database);
  }

  /**
   * Builds the custom type handler. Called at most once per context.
   *
   * @param resolver this context's resolver
   */
  protected CustomTypeHandler createCustomTypeHandler(NameResolver resolver) {
    return new DocumentIdTypeHandler(resolver);
  }
}
