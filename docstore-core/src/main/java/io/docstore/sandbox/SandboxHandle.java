package io.docstore.sandbox;

import io.docstore.database.Database;
import io.docstore.tx.ScopedTransactionContext;

import java.util.Optional;

/**
 * An entered sandbox. Closing the handle exits the sandbox, restores the context slot's previous
 * occupant and frees the sandbox for the next caller.
 *
 * @see MaintenanceSandbox#enter(Database, boolean)
 */
public interface SandboxHandle extends AutoCloseable {

  /**
   * Returns the database the sandbox was entered for.
   */
  Database database();

  /**
   * Returns the global context occupying the context slot while this handle is open.
   */
  ScopedTransactionContext context();

  boolean isExclusive();

  /**
   * Sets a named boolean variable visible to procedures run through this handle.
   */
  void setVariable(String name, boolean value);

  /**
   * Returns a variable previously set with {@link #setVariable(String, boolean)}.
   */
  Optional<Boolean> variable(String name);

  /**
   * Runs {@code procedure} against {@code target} synchronously.
   *
   * @return the outcome the procedure reported
   * @throws SandboxException if the handle is closed, the procedure threw, or it returned no
   *     outcome
   */
  ProcedureOutcome run(MaintenanceProcedure procedure, Database target);

  /**
   * Exits the sandbox. The context slot gets back the occupant it had at entry, even if a
   * procedure entered scopes on it and never closed them. Subsequent calls are no-ops.
   *
   * @throws io.docstore.tx.ContextStateException if called from a thread other than the one that
   *     entered
   */
  @Override
  void close();
}
