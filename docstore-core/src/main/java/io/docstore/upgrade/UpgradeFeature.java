package io.docstore.upgrade;

import io.docstore.database.Database;
import io.docstore.database.DatabaseRegistry;
import io.docstore.sandbox.MaintenanceProcedure;
import io.docstore.sandbox.MaintenanceSandbox;
import io.docstore.sandbox.ProcedureOutcome;
import io.docstore.sandbox.SandboxException;
import io.docstore.sandbox.SandboxHandle;
import io.docstore.spi.FatalErrorHandler;
import io.docstore.spi.ServerLifecycle;
import io.docstore.spi.UpgradeMetrics;
import io.docstore.spi.WriteAheadLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Startup feature that checks, and on request upgrades, every database before the server accepts
 * work.
 *
 * <p>{@link #validateOptions()} rejects contradictory options and, when an upgrade is requested,
 * switches the server into upgrade mode (non-server features, replication applier and cluster
 * participation disabled). {@link #start()} opens the write-ahead log, runs the maintenance
 * procedure once per database inside a single global sandbox entry bound to the system database,
 * and requests shutdown after an upgrade run.
 *
 * <p>Every failure is fatal: it is logged, handed to the {@link FatalErrorHandler} and rethrown
 * as a {@link FatalStartupException}. Unchecked errors raised by the write-ahead log, the sandbox
 * or the registry are wrapped with their cause attached. The sweep stops at the first failing
 * database; databases already processed are not revisited.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see UpgradeOptions
 * @see MaintenanceProcedure
 */
public final class UpgradeFeature implements ServerFeature {
  private static final Logger logger = Logger.getLogger(UpgradeFeature.class.getName());

  public static final String NAME = "Upgrade";

  /** Sandbox variable carrying whether an upgrade was requested. */
  public static final String UPGRADE_VARIABLE = "upgrade";

  private static final List<String> STARTS_AFTER = List.of("CheckVersion", "Cluster", "Database", "Sandbox");

  private final UpgradeOptions options;
  private final DatabaseRegistry registry;
  private final MaintenanceSandbox sandbox;
  private final WriteAheadLog writeAheadLog;
  private final ServerLifecycle lifecycle;
  private final MaintenanceProcedure procedure;
  private final FatalErrorHandler fatalErrorHandler;
  private final UpgradeMetrics metrics;
  private final List<String> nonServerFeatures;

  private UpgradeFeature(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.sandbox = Objects.requireNonNull(builder.sandbox, "sandbox");
    this.writeAheadLog = Objects.requireNonNull(builder.writeAheadLog, "writeAheadLog");
    this.lifecycle = Objects.requireNonNull(builder.lifecycle, "lifecycle");
    this.procedure = Objects.requireNonNull(builder.procedure, "procedure");
    this.options = builder.options != null ? builder.options.copy() : new UpgradeOptions();
    this.fatalErrorHandler = builder.fatalErrorHandler != null ? builder.fatalErrorHandler : FatalErrorHandler.EXIT;
    this.metrics = builder.metrics != null ? builder.metrics : UpgradeMetrics.NOOP;
    this.nonServerFeatures = List.copyOf(builder.nonServerFeatures);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<String> startsAfter() {
    return STARTS_AFTER;
  }

  /**
   * Returns a copy of the options this feature runs with.
   */
  public UpgradeOptions options() {
    return options.copy();
  }

  /**
   * Validates the options and, for an upgrade run, disables the features that must not run
   * alongside it.
   *
   * @throws FatalStartupException if the options conflict (after the fatal handler returned)
   */
  @Override
  public void validateOptions() {
    logger.log(Level.FINEST, "{0}::validateOptions", NAME);
    try {
      options.validate();
    } catch (FatalStartupException e) {
      throw fatal(e);
    }

    if (!options.isUpgrade()) {
      logger.log(Level.FINEST, "executing upgrade check: not disabling server features");
      return;
    }

    logger.log(Level.FINEST, "executing upgrade procedure: disabling server features");
    lifecycle.disableFeatures(nonServerFeatures);
    lifecycle.disableReplicationApplier();
    lifecycle.enableUpgrade();
    lifecycle.disableCluster();
  }

  /**
   * Opens the write-ahead log, runs the init/upgrade sweep if the check is enabled, and requests
   * shutdown after an upgrade run.
   *
   * @throws FatalStartupException if recovery or the sweep fails (after the fatal handler returned)
   */
  @Override
  public void start() {
    logger.log(Level.FINEST, "{0}::start", NAME);
    try {
      openWriteAheadLog();

      if (options.isUpgradeCheck()) {
        upgradeDatabases();
      }
    } catch (FatalStartupException e) {
      throw fatal(e);
    }

    if (options.isUpgrade()) {
      lifecycle.beginShutdown();
    }
  }

  private void openWriteAheadLog() {
    boolean opened;
    try {
      opened = writeAheadLog.open();
    } catch (RuntimeException e) {
      throw new FatalStartupException(FatalStartupException.Reason.RECOVERY_FAILURE, null,
          "Unable to finish WAL recovery procedure", e);
    }
    if (!opened) {
      throw new FatalStartupException(FatalStartupException.Reason.RECOVERY_FAILURE,
          "Unable to finish WAL recovery procedure");
    }
  }

  private void upgradeDatabases() {
    logger.log(Level.FINEST, "starting database init/upgrade");
    long startNanos = System.nanoTime();

    try (SandboxHandle handle = sandbox.enter(registry.systemDatabase(), true)) {
      logger.log(Level.FINE, "running database init/upgrade");
      for (Database database : registry.snapshot()) {
        upgradeDatabase(handle, database);
      }
    } catch (FatalStartupException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new FatalStartupException(FatalStartupException.Reason.SANDBOX_FAILURE, null,
          "Script error during server start", e);
    } finally {
      metrics.recordSweepDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    if (options.isUpgrade()) {
      lifecycle.setExitCode(0);
      logger.log(Level.INFO, "database upgrade passed");
    }
    logger.log(Level.FINEST, "finished database init/upgrade");
  }

  private void upgradeDatabase(SandboxHandle handle, Database database) {
    handle.setVariable(UPGRADE_VARIABLE, options.isUpgrade());

    metrics.incrementDatabasesVisited();
    ProcedureOutcome outcome;
    try {
      outcome = handle.run(procedure, database);
    } catch (SandboxException e) {
      metrics.incrementDatabaseFailures();
      throw new FatalStartupException(FatalStartupException.Reason.SANDBOX_FAILURE,
          database.name(), "Script error during server start", e);
    }

    if (outcome.isSuccess()) {
      logger.log(Level.FINE, "database ''{0}'' init/upgrade done", database.name());
      return;
    }
    metrics.incrementDatabaseFailures();
    throw procedureFailure(database, outcome);
  }

  private FatalStartupException procedureFailure(Database database, ProcedureOutcome outcome) {
    if (options.isUpgrade()) {
      return new FatalStartupException(FatalStartupException.Reason.PROCEDURE_FAILURE, database.name(),
          "Database '" + database.name() + "' upgrade failed"
              + (outcome == ProcedureOutcome.STARTED_FAILED
                  ? ". Please inspect the logs from the upgrade procedure"
                  : " before the upgrade procedure could start"));
    }
    return new FatalStartupException(FatalStartupException.Reason.PRECONDITION_FAILURE, database.name(),
        "Database '" + database.name() + "' needs upgrade. Please start the server with the "
            + UpgradeOptions.UPGRADE_OPTION + " option");
  }

  private FatalStartupException fatal(FatalStartupException error) {
    logger.log(Level.SEVERE, error.getMessage(), error.getCause());
    fatalErrorHandler.onFatal(error);
    return error;
  }

  /** Builder for {@link UpgradeFeature}. */
  public static final class Builder {
    private UpgradeOptions options;
    private DatabaseRegistry registry;
    private MaintenanceSandbox sandbox;
    private WriteAheadLog writeAheadLog;
    private ServerLifecycle lifecycle;
    private MaintenanceProcedure procedure;
    private FatalErrorHandler fatalErrorHandler;
    private UpgradeMetrics metrics;
    private final List<String> nonServerFeatures = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the upgrade options. The builder keeps a copy.
     *
     * <p>Optional. Defaults to {@code upgrade=false}, {@code upgradeCheck=true}.
     *
     * @param options the options
     * @return this builder
     */
    public Builder options(UpgradeOptions options) {
      this.options = options;
      return this;
    }

    /**
     * Sets the registry enumerating the databases to process.
     *
     * <p><b>Required.</b>
     *
     * @param registry the database registry
     * @return this builder
     */
    public Builder registry(DatabaseRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the sandbox the maintenance procedure runs in.
     *
     * <p><b>Required.</b>
     *
     * @param sandbox the maintenance sandbox
     * @return this builder
     */
    public Builder sandbox(MaintenanceSandbox sandbox) {
      this.sandbox = sandbox;
      return this;
    }

    /**
     * Sets the write-ahead log opened before any database is touched.
     *
     * <p><b>Required.</b>
     *
     * @param writeAheadLog the write-ahead log
     * @return this builder
     */
    public Builder writeAheadLog(WriteAheadLog writeAheadLog) {
      this.writeAheadLog = writeAheadLog;
      return this;
    }

    /**
     * Sets the server lifecycle used to disable features and request shutdown.
     *
     * <p><b>Required.</b>
     *
     * @param lifecycle the server lifecycle
     * @return this builder
     */
    public Builder lifecycle(ServerLifecycle lifecycle) {
      this.lifecycle = lifecycle;
      return this;
    }

    /**
     * Sets the init/upgrade procedure run once per database.
     *
     * <p><b>Required.</b>
     *
     * @param procedure the maintenance procedure
     * @return this builder
     */
    public Builder procedure(MaintenanceProcedure procedure) {
      this.procedure = procedure;
      return this;
    }

    /**
     * Sets the handler receiving fatal conditions.
     *
     * <p>Optional. Defaults to {@link FatalErrorHandler#EXIT}.
     *
     * @param fatalErrorHandler the fatal error handler
     * @return this builder
     */
    public Builder fatalErrorHandler(FatalErrorHandler fatalErrorHandler) {
      this.fatalErrorHandler = fatalErrorHandler;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link UpgradeMetrics#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(UpgradeMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Adds features to disable for the duration of an upgrade run.
     *
     * @param featureNames feature names
     * @return this builder
     */
    public Builder nonServerFeatures(List<String> featureNames) {
      Objects.requireNonNull(featureNames, "featureNames");
      featureNames.forEach(name -> nonServerFeatures.add(Objects.requireNonNull(name, "featureName")));
      return this;
    }

    /**
     * Builds the feature.
     *
     * @return a new {@link UpgradeFeature}
     * @throws NullPointerException if a required component is missing
     */
    public UpgradeFeature build() {
      return new UpgradeFeature(this);
    }
  }
}
