package io.docstore.upgrade;

import java.util.Objects;
import java.util.Optional;

/**
 * A condition that makes the server unable to continue starting up.
 *
 * <p>Raised by {@link UpgradeFeature} and passed to the configured
 * {@link io.docstore.spi.FatalErrorHandler}. None of these conditions is retried.
 */
public final class FatalStartupException extends RuntimeException {

  /**
   * Why startup cannot continue.
   */
  public enum Reason {
    /** {@code --database.upgrade true} combined with {@code --database.upgrade-check false}. */
    CONFIGURATION_CONFLICT,
    /** The write-ahead log could not be opened. */
    RECOVERY_FAILURE,
    /** The maintenance procedure failed for a database while an upgrade was requested. */
    PROCEDURE_FAILURE,
    /** A database needs an upgrade that was not requested. */
    PRECONDITION_FAILURE,
    /** The sandbox failed before the maintenance procedure could report an outcome. */
    SANDBOX_FAILURE
  }

  private final Reason reason;
  private final String databaseName;

  public FatalStartupException(Reason reason, String message) {
    this(reason, null, message, null);
  }

  public FatalStartupException(Reason reason, String databaseName, String message) {
    this(reason, databaseName, message, null);
  }

  public FatalStartupException(Reason reason, String databaseName, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.databaseName = databaseName;
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Returns the database being processed when the failure happened, if any.
   */
  public Optional<String> databaseName() {
    return Optional.ofNullable(databaseName);
  }
}
