package io.docstore.sandbox;

import io.docstore.database.Database;

/**
 * A maintenance task (e.g. an init/upgrade routine) run inside a sandbox against one database.
 *
 * <p>The procedure reports its own status through the returned {@link ProcedureOutcome}. Throwing
 * means the procedure could not be run at all; the sandbox reports that as a
 * {@link SandboxException}.
 */
@FunctionalInterface
public interface MaintenanceProcedure {

  /**
   * Runs the procedure.
   *
   * @param target  the database to maintain
   * @param sandbox the sandbox the procedure runs in; variables injected by the caller are
   *     readable through {@link SandboxHandle#variable(String)}
   * @return the outcome, never {@code null}
   * @throws Exception if the procedure cannot run
   */
  ProcedureOutcome run(Database target, SandboxHandle sandbox) throws Exception;
}
