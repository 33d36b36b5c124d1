/**
 * Maintenance sandbox: the isolated environment that runs init/upgrade procedures per database.
 *
 * <p>Procedures report a tri-state {@link io.docstore.sandbox.ProcedureOutcome}; failures of the
 * sandbox itself surface as {@link io.docstore.sandbox.SandboxException}.
 */
package io.docstore.sandbox;
