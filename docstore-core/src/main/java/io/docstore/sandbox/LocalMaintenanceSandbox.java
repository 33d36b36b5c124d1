package io.docstore.sandbox;

import io.docstore.database.Database;
import io.docstore.tx.ContextSlot;
import io.docstore.tx.ContextStateException;
import io.docstore.tx.ScopedTransactionContext;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process {@link MaintenanceSandbox} running procedures as plain Java code.
 *
 * <p>The sandbox has a single slot guarded by a fair lock; {@link #enter(Database, boolean)} blocks
 * until it is free. The thread holding the slot may enter again (nested entry). Each entry creates
 * a non-embeddable {@link ScopedTransactionContext} for the database, promotes it to global and
 * puts it into the {@link ContextSlot}. Closing the handle restores the previous occupant and
 * releases the lock, in that order.
 */
public final class LocalMaintenanceSandbox implements MaintenanceSandbox {
  private static final Logger logger = Logger.getLogger(LocalMaintenanceSandbox.class.getName());

  private final ContextSlot slot;
  private final ReentrantLock lock = new ReentrantLock(true);

  public LocalMaintenanceSandbox() {
    this(ContextSlot.defaultSlot());
  }

  public LocalMaintenanceSandbox(ContextSlot slot) {
    this.slot = Objects.requireNonNull(slot, "slot");
  }

  @Override
  public SandboxHandle enter(Database database, boolean exclusive) {
    Objects.requireNonNull(database, "database");
    lock.lock();
    try {
      ScopedTransactionContext context = ScopedTransactionContext.create(database, false, slot);
      context.makeGlobal();
      ContextSlot.Scope scope = slot.enter(context);
      logger.log(Level.FINE, "Entered sandbox for database ''{0}'' (exclusive={1})",
          new Object[]{database.name(), exclusive});
      return new LocalHandle(database, exclusive, scope);
    } catch (RuntimeException e) {
      lock.unlock();
      throw e;
    }
  }

  /**
   * Returns {@code true} while some thread holds the sandbox.
   */
  public boolean isOccupied() {
    return lock.isLocked();
  }

  public ContextSlot slot() {
    return slot;
  }

  private final class LocalHandle implements SandboxHandle {
    private final Database database;
    private final boolean exclusive;
    private final ContextSlot.Scope scope;
    private final Thread owner = Thread.currentThread();
    private final Map<String, Boolean> variables = new HashMap<>();
    private boolean closed;

    private LocalHandle(Database database, boolean exclusive, ContextSlot.Scope scope) {
      this.database = database;
      this.exclusive = exclusive;
      this.scope = scope;
    }

    @Override
    public Database database() {
      return database;
    }

    @Override
    public ScopedTransactionContext context() {
      return scope.context();
    }

    @Override
    public boolean isExclusive() {
      return exclusive;
    }

    @Override
    public void setVariable(String name, boolean value) {
      Objects.requireNonNull(name, "name");
      variables.put(name, value);
    }

    @Override
    public Optional<Boolean> variable(String name) {
      return Optional.ofNullable(variables.get(name));
    }

    @Override
    public ProcedureOutcome run(MaintenanceProcedure procedure, Database target) {
      Objects.requireNonNull(procedure, "procedure");
      Objects.requireNonNull(target, "target");
      if (closed) {
        throw new SandboxException("Sandbox for database '" + database.name() + "' has been exited");
      }
      ProcedureOutcome outcome;
      try {
        outcome = procedure.run(target, this);
      } catch (SandboxException e) {
        throw e;
      } catch (Exception e) {
        throw new SandboxException(
            "Maintenance procedure raised an error for database '" + target.name() + "'", e);
      }
      if (outcome == null) {
        throw new SandboxException(
            "Maintenance procedure reported no outcome for database '" + target.name() + "'");
      }
      return outcome;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      if (Thread.currentThread() != owner) {
        throw new ContextStateException(
            "Sandbox must be exited by the thread that entered it (" + owner.getName() + ")");
      }
      closed = true;
      try {
        if (scope.unwind()) {
          logger.log(Level.WARNING,
              "Discarded context scopes left open inside sandbox for database ''{0}''", database.name());
        }
      } finally {
        lock.unlock();
        logger.log(Level.FINE, "Exited sandbox for database ''{0}''", database.name());
      }
    }
  }
}
