package io.docstore.tx;

import java.util.Objects;

/**
 * Execution-unit-local register holding the {@link ScopedTransactionContext} the current thread
 * has entered, if any.
 *
 * <p>{@link #enter(ScopedTransactionContext)} replaces the occupant and returns a {@link Scope}
 * that puts the previous occupant back when closed. Scopes nest; they must be closed in reverse
 * order of entry, on the thread that entered them. Use with try-with-resources so the previous
 * occupant is restored on every exit path:
 * <pre>{@code
 * try (ContextSlot.Scope scope = slot.enter(context)) {
 *     // run operations against context
 * }
 * }</pre>
 *
 * @see ScopedTransactionContext
 */
public final class ContextSlot {
  private static final ContextSlot DEFAULT = new ContextSlot();

  private final ThreadLocal<ScopedTransactionContext> occupant = new ThreadLocal<>();

  /**
   * Returns the process-wide slot used by {@link ScopedTransactionContext#create} and
   * {@link ScopedTransactionContext#isEmbedded()}.
   */
  public static ContextSlot defaultSlot() {
    return DEFAULT;
  }

  /**
   * Returns the context the current thread has entered, or {@code null} if the slot is empty.
   */
  public ScopedTransactionContext current() {
    return occupant.get();
  }

  /**
   * Returns {@code true} if the current thread has entered a context.
   */
  public boolean isOccupied() {
    return occupant.get() != null;
  }

  /**
   * Makes {@code context} the occupant of the current thread's slot.
   *
   * @param context the context to enter
   * @return a scope that restores the previous occupant when closed
   */
  public Scope enter(ScopedTransactionContext context) {
    Objects.requireNonNull(context, "context");
    ScopedTransactionContext previous = occupant.get();
    occupant.set(context);
    return new Scope(context, previous, Thread.currentThread());
  }

  /**
   * An entered slot. Closing it restores the occupant that was present before entry.
   */
  public final class Scope implements AutoCloseable {
    private final ScopedTransactionContext entered;
    private final ScopedTransactionContext previous;
    private final Thread owner;
    private boolean closed;

    private Scope(ScopedTransactionContext entered, ScopedTransactionContext previous, Thread owner) {
      this.entered = entered;
      this.previous = previous;
      this.owner = owner;
    }

    /**
     * Returns the context this scope entered.
     */
    public ScopedTransactionContext context() {
      return entered;
    }

    /**
     * Returns the occupant this scope restores on close, or {@code null} for an empty slot.
     */
    public ScopedTransactionContext previous() {
      return previous;
    }

    /**
     * Restores the previous occupant. Subsequent calls are no-ops.
     *
     * @throws ContextStateException if called from a thread other than the one that entered, or
     *     while a scope entered later on the same slot is still open; the slot is left unchanged
     */
    @Override
    public void close() {
      if (closed) {
        return;
      }
      checkOwner();
      if (occupant.get() != entered) {
        throw new ContextStateException("Context scopes must be closed in reverse order of entry");
      }
      restore();
    }

    /**
     * Restores the previous occupant even if scopes entered after this one were never closed.
     * Those scopes are discarded; closing them later is a no-op only if they were already closed,
     * otherwise it fails the reverse-order check.
     *
     * @return {@code true} if scopes entered after this one were still open and got discarded,
     *     {@code false} if the slot was in order or this scope was already closed
     * @throws ContextStateException if called from a thread other than the one that entered
     */
    public boolean unwind() {
      if (closed) {
        return false;
      }
      checkOwner();
      boolean discarded = occupant.get() != entered;
      restore();
      return discarded;
    }

    private void checkOwner() {
      if (Thread.currentThread() != owner) {
        throw new ContextStateException(
            "Context scope must be closed by the thread that entered it (" + owner.getName() + ")");
      }
    }

    private void restore() {
      closed = true;
      if (previous == null) {
        occupant.remove();
      } else {
        occupant.set(previous);
      }
    }
  }
}
