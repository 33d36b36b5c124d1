package io.docstore.tx;

import io.docstore.database.Database;
import io.docstore.resolver.NameResolver;

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TransactionContext} bound to the execution unit's {@link ContextSlot}, used inside a
 * maintenance sandbox.
 *
 * <p>On creation the context captures the slot's occupant as its <em>shared</em> context, or
 * itself when the slot is empty. Transaction registration is recorded on the shared context,
 * together with the registering context as the shared context's main scope. Every context created
 * while a global context occupies the slot therefore sees the same parent transaction, and
 * {@link #isEmbedded()} reports it even after control has crossed the sandbox boundary and back.
 *
 * <p>{@link #makeGlobal()} turns a context into its own shared context; sandboxes call it on the
 * context they put into the slot. Global status does not change {@link #isEmbeddable()}.
 *
 * <p>The links to the shared context and to the main scope are weak references used only for
 * lookup. They never keep the other context alive.
 */
public final class ScopedTransactionContext extends AbstractTransactionContext {
  private final ContextSlot slot;
  private final boolean embeddable;
  private WeakReference<ScopedTransactionContext> shared;

  // Only meaningful on the shared context.
  private TransactionState currentTransaction;
  private WeakReference<ScopedTransactionContext> mainScope;

  private ScopedTransactionContext(Database database, boolean embeddable, ContextSlot slot) {
    super(database);
    this.slot = Objects.requireNonNull(slot, "slot");
    this.embeddable = embeddable;
    ScopedTransactionContext occupant = slot.current();
    this.shared = new WeakReference<>(occupant != null ? occupant : this);
  }

  /**
   * Creates a context bound to the {@linkplain ContextSlot#defaultSlot() default slot}.
   *
   * @param database   the database to operate against
   * @param embeddable whether nested operations may join the registered transaction
   * @return the new context
   */
  public static ScopedTransactionContext create(Database database, boolean embeddable) {
    return create(database, embeddable, ContextSlot.defaultSlot());
  }

  /**
   * Creates a context bound to {@code slot}.
   *
   * @param database   the database to operate against
   * @param embeddable whether nested operations may join the registered transaction
   * @param slot       the slot whose occupant becomes the shared context
   * @return the new context
   */
  public static ScopedTransactionContext create(Database database, boolean embeddable, ContextSlot slot) {
    return new ScopedTransactionContext(database, embeddable, slot);
  }

  /**
   * Returns {@code true} if the current thread has entered a context in the default slot and that
   * context has a registered transaction.
   */
  public static boolean isEmbedded() {
    return isEmbedded(ContextSlot.defaultSlot());
  }

  /**
   * Returns {@code true} if the current thread has entered a context in {@code slot} and that
   * context has a registered transaction.
   */
  public static boolean isEmbedded(ContextSlot slot) {
    ScopedTransactionContext occupant = slot.current();
    return occupant != null && occupant.currentTransaction != null;
  }

  public ContextSlot slot() {
    return slot;
  }

  @Override
  public void registerTransaction(TransactionState transaction) {
    Objects.requireNonNull(transaction, "transaction");
    ScopedTransactionContext owner = sharedContext();
    if (owner.currentTransaction != null) {
      throw new ContextStateException(
          "Transaction " + owner.currentTransaction.id() + " already registered in context");
    }
    owner.currentTransaction = transaction;
    owner.mainScope = new WeakReference<>(this);
  }

  @Override
  public void unregisterTransaction() {
    ScopedTransactionContext owner = shared.get();
    if (owner == null) {
      return;
    }
    owner.currentTransaction = null;
    owner.mainScope = null;
  }

  @Override
  public Optional<TransactionState> getParentTransaction() {
    return Optional.ofNullable(sharedContext().currentTransaction);
  }

  @Override
  public boolean isEmbeddable() {
    return embeddable;
  }

  /**
   * Promotes this context to a global one: it becomes its own shared context and keeps serving a
   * sequence of operations. There is no way back.
   */
  public void makeGlobal() {
    shared = new WeakReference<>(this);
  }

  public boolean isGlobal() {
    return shared.get() == this;
  }

  /**
   * Returns the context that registered the current transaction on the shared context, if any.
   */
  public Optional<ScopedTransactionContext> mainScope() {
    WeakReference<ScopedTransactionContext> ref = sharedContext().mainScope;
    return ref == null ? Optional.empty() : Optional.ofNullable(ref.get());
  }

  /**
   * Returns the shared context's resolver when the shared context is another context on the same
   * database, so all contexts within one sandbox entry use one resolver.
   */
  @Override
  protected NameResolver createResolver() {
    ScopedTransactionContext owner = shared.get();
    if (owner != null && owner != this && owner.database().equals(database())) {
      return owner.getResolver();
    }
    return super.createResolver();
  }

  private ScopedTransactionContext sharedContext() {
    ScopedTransactionContext owner = shared.get();
    if (owner == null) {
      throw new ContextStateException("Shared transaction context is no longer available");
    }
    return owner;
  }
}
