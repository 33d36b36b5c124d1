package io.docstore.tx;

/**
 * Thrown when a {@link TransactionContext} or {@link ContextSlot} is used against its contract,
 * e.g. registering a second transaction without unregistering the first.
 *
 * <p>These are programming errors in the caller, not transient conditions; retrying the same call
 * fails the same way.
 */
public final class ContextStateException extends IllegalStateException {

  public ContextStateException(String message) {
    super(message);
  }
}
