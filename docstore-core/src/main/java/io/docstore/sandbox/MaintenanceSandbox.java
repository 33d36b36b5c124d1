package io.docstore.sandbox;

import io.docstore.database.Database;

/**
 * Isolated execution environment for maintenance procedures.
 *
 * <p>Entering is a scoped acquisition: {@link #enter(Database, boolean)} blocks until the sandbox
 * is available and the returned handle must be closed on every exit path.
 *
 * @see LocalMaintenanceSandbox
 */
public interface MaintenanceSandbox {

  /**
   * Enters the sandbox for {@code database}.
   *
   * @param database  the database the sandbox's global context is bound to
   * @param exclusive whether the caller requires exclusive use of the sandbox
   * @return an open handle; close it with try-with-resources
   */
  SandboxHandle enter(Database database, boolean exclusive);
}
