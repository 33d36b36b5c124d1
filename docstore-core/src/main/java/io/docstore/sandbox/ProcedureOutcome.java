package io.docstore.sandbox;

/**
 * Result reported by a {@link MaintenanceProcedure}.
 */
public enum ProcedureOutcome {
  /** The procedure's precondition check failed before it began any work. */
  NOT_STARTED,
  /** The procedure began its work and then failed. */
  STARTED_FAILED,
  /** The procedure ran to completion. */
  SUCCEEDED;

  public boolean isSuccess() {
    return this == SUCCEEDED;
  }
}
