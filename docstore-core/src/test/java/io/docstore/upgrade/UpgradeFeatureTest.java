package io.docstore.upgrade;

import io.docstore.database.Database;
import io.docstore.database.DefaultDatabaseRegistry;
import io.docstore.sandbox.LocalMaintenanceSandbox;
import io.docstore.sandbox.MaintenanceProcedure;
import io.docstore.sandbox.ProcedureOutcome;
import io.docstore.sandbox.SandboxHandle;
import io.docstore.spi.FatalErrorHandler;
import io.docstore.spi.UpgradeMetrics;
import io.docstore.spi.WriteAheadLog;
import io.docstore.tx.ContextSlot;
import io.docstore.tx.ScopedTransactionContext;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UpgradeFeatureTest {

  private DefaultDatabaseRegistry registry;
  private ContextSlot slot;
  private LocalMaintenanceSandbox sandbox;
  private CountingWriteAheadLog wal;
  private RecordingServerLifecycle lifecycle;
  private ScriptedProcedure procedure;
  private List<FatalStartupException> fatalErrors;
  private RecordingMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new DefaultDatabaseRegistry();
    slot = new ContextSlot();
    sandbox = new LocalMaintenanceSandbox(slot);
    wal = new CountingWriteAheadLog(true);
    lifecycle = new RecordingServerLifecycle();
    procedure = new ScriptedProcedure();
    fatalErrors = new ArrayList<>();
    metrics = new RecordingMetrics();
  }

  @Test
  void checkSweepVisitsAllDatabasesAndKeepsRunning() {
    registry.create("shop");
    registry.create("crm");
    UpgradeFeature feature = feature(new UpgradeOptions());

    feature.validateOptions();
    feature.start();

    assertEquals(List.of("_system", "shop", "crm"), procedure.visited);
    assertEquals(List.of(false, false, false), procedure.upgradeFlags);
    assertEquals(1, wal.opens.get());
    assertFalse(lifecycle.shutdownRequested);
    assertNull(lifecycle.exitCode);
    assertTrue(fatalErrors.isEmpty());
    assertEquals(3, metrics.visited);
    assertEquals(0, metrics.failures);
    assertEquals(1, metrics.durations.size());
  }

  @Test
  void failedUpgradeStopsSweepAtFailingDatabase() {
    registry.create("shop");
    procedure.outcomes.put("_system", ProcedureOutcome.STARTED_FAILED);
    UpgradeFeature feature = feature(new UpgradeOptions().setUpgrade(true));
    feature.validateOptions();

    FatalStartupException ex = assertThrows(FatalStartupException.class, feature::start);

    assertEquals(FatalStartupException.Reason.PROCEDURE_FAILURE, ex.reason());
    assertEquals("_system", ex.databaseName().orElseThrow());
    assertEquals("Database '_system' upgrade failed. Please inspect the logs from the upgrade procedure",
        ex.getMessage());
    assertEquals(List.of("_system"), procedure.visited);
    assertEquals(List.of(ex), fatalErrors);
    assertFalse(lifecycle.shutdownRequested);
    assertNull(lifecycle.exitCode);
    assertEquals(1, metrics.visited);
    assertEquals(1, metrics.failures);
  }

  @Test
  void conflictingOptionsRejectedBeforeAnythingIsTouched() {
    UpgradeFeature feature = feature(new UpgradeOptions().setUpgrade(true).setUpgradeCheck(false));

    FatalStartupException ex = assertThrows(FatalStartupException.class, feature::validateOptions);

    assertEquals(FatalStartupException.Reason.CONFIGURATION_CONFLICT, ex.reason());
    assertEquals(List.of(ex), fatalErrors);
    assertEquals(0, wal.opens.get());
    assertTrue(procedure.visited.isEmpty());
    assertTrue(lifecycle.untouched());
  }

  @Test
  void upgradeModeDisablesServerFeatures() {
    UpgradeFeature feature = UpgradeFeature.builder()
        .options(new UpgradeOptions().setUpgrade(true))
        .registry(registry)
        .sandbox(sandbox)
        .writeAheadLog(wal)
        .lifecycle(lifecycle)
        .procedure(procedure)
        .fatalErrorHandler(fatalErrors::add)
        .nonServerFeatures(List.of("HttpEndpoint", "Scheduler"))
        .build();

    feature.validateOptions();

    assertEquals(List.of("HttpEndpoint", "Scheduler"), lifecycle.disabledFeatures);
    assertTrue(lifecycle.replicationApplierDisabled);
    assertTrue(lifecycle.upgradeEnabled);
    assertTrue(lifecycle.clusterDisabled);
  }

  @Test
  void checkModeLeavesServerFeaturesAlone() {
    feature(new UpgradeOptions()).validateOptions();

    assertTrue(lifecycle.untouched());
  }

  @Test
  void successfulUpgradeSetsExitCodeAndRequestsShutdown() {
    registry.create("shop");
    UpgradeFeature feature = feature(new UpgradeOptions().setUpgrade(true));
    feature.validateOptions();

    feature.start();

    assertEquals(List.of(true, true), procedure.upgradeFlags);
    assertEquals(0, lifecycle.exitCode);
    assertTrue(lifecycle.shutdownRequested);
  }

  @Test
  void walFailureIsFatalAndNoProcedureRuns() {
    wal = new CountingWriteAheadLog(false);
    UpgradeFeature feature = feature(new UpgradeOptions());

    FatalStartupException ex = assertThrows(FatalStartupException.class, feature::start);

    assertEquals(FatalStartupException.Reason.RECOVERY_FAILURE, ex.reason());
    assertEquals("Unable to finish WAL recovery procedure", ex.getMessage());
    assertTrue(procedure.visited.isEmpty());
    assertEquals(List.of(ex), fatalErrors);
  }

  @Test
  void disabledCheckSkipsSweep() {
    UpgradeFeature feature = feature(new UpgradeOptions().setUpgradeCheck(false));
    feature.validateOptions();

    feature.start();

    assertEquals(1, wal.opens.get());
    assertTrue(procedure.visited.isEmpty());
    assertTrue(metrics.durations.isEmpty());
    assertFalse(lifecycle.shutdownRequested);
  }

  @Test
  void failedCheckWithoutUpgradeAsksForUpgrade() {
    registry.create("shop");
    procedure.outcomes.put("shop", ProcedureOutcome.STARTED_FAILED);
    UpgradeFeature feature = feature(new UpgradeOptions());

    FatalStartupException ex = assertThrows(FatalStartupException.class, feature::start);

    assertEquals(FatalStartupException.Reason.PRECONDITION_FAILURE, ex.reason());
    assertEquals("Database 'shop' needs upgrade. Please start the server with the --database.upgrade option",
        ex.getMessage());
    assertEquals(List.of("_system", "shop"), procedure.visited);
  }

  @Test
  void notStartedWithoutUpgradeAsksForUpgrade() {
    procedure.outcomes.put("_system", ProcedureOutcome.NOT_STARTED);
    UpgradeFeature feature = feature(new UpgradeOptions());

    FatalStartupException ex = assertThrows(FatalStartupException.class, feature::start);

    assertEquals(FatalStartupException.Reason.PRECONDITION_FAILURE, ex.reason());
  }

  @Test
  void notStartedDuringUpgradeIsUpgradeFailure() {
    procedure.outcomes.put("_system", ProcedureOutcome.NOT_STARTED);
    UpgradeFeature feature = feature(new UpgradeOptions().setUpgrade(true));

    FatalStartupException ex = assertThrows(FatalStartupException.class, feature::start);

    assertEquals(FatalStartupException.Reason.PROCEDURE_FAILURE, ex.reason());
    assertEquals("Database '_system' upgrade failed before the upgrade procedure could start",
        ex.getMessage());
  }

  @Test
  void procedureErrorIsSandboxFailure() {
    registry.create("shop");
    procedure.errors.put("shop", new UncheckedIOException(new IOException("script missing")));
    UpgradeFeature feature = feature(new UpgradeOptions());

    FatalStartupException ex = assertThrows(FatalStartupException.class, feature::start);

    assertEquals(FatalStartupException.Reason.SANDBOX_FAILURE, ex.reason());
    assertEquals("shop", ex.databaseName().orElseThrow());
    assertEquals("Script error during server start", ex.getMessage());
    assertInstanceOf(UncheckedIOException.class, ex.getCause().getCause());
    assertEquals(2, metrics.visited);
    assertEquals(1, metrics.failures);
  }

  @Test
  void sandboxEntryErrorIsRoutedToFatalHandler() {
    IllegalStateException broken = new IllegalStateException("sandbox unavailable");
    UpgradeFeature feature = UpgradeFeature.builder()
        .registry(registry)
        .sandbox((database, exclusive) -> {
          throw broken;
        })
        .writeAheadLog(wal)
        .lifecycle(lifecycle)
        .procedure(procedure)
        .fatalErrorHandler(fatalErrors::add)
        .metrics(metrics)
        .build();

    FatalStartupException ex = assertThrows(FatalStartupException.class, feature::start);

    assertEquals(FatalStartupException.Reason.SANDBOX_FAILURE, ex.reason());
    assertTrue(ex.databaseName().isEmpty());
    assertSame(broken, ex.getCause());
    assertEquals(List.of(ex), fatalErrors);
    assertTrue(procedure.visited.isEmpty());
    assertEquals(1, metrics.durations.size());
  }

  @Test
  void walErrorIsRecoveryFailure() {
    IllegalStateException corrupt = new IllegalStateException("log segment corrupt");
    WriteAheadLog failing = () -> {
      throw corrupt;
    };
    UpgradeFeature feature = UpgradeFeature.builder()
        .registry(registry)
        .sandbox(sandbox)
        .writeAheadLog(failing)
        .lifecycle(lifecycle)
        .procedure(procedure)
        .fatalErrorHandler(fatalErrors::add)
        .build();

    FatalStartupException ex = assertThrows(FatalStartupException.class, feature::start);

    assertEquals(FatalStartupException.Reason.RECOVERY_FAILURE, ex.reason());
    assertSame(corrupt, ex.getCause());
    assertEquals(List.of(ex), fatalErrors);
    assertTrue(procedure.visited.isEmpty());
  }

  @Test
  void scopeLeftOpenByProcedureDoesNotFailStartup() {
    registry.create("shop");
    MaintenanceProcedure leaking = (target, handle) -> {
      slot.enter(ScopedTransactionContext.create(target, true, slot));
      return ProcedureOutcome.SUCCEEDED;
    };
    UpgradeFeature feature = UpgradeFeature.builder()
        .registry(registry)
        .sandbox(sandbox)
        .writeAheadLog(wal)
        .lifecycle(lifecycle)
        .procedure(leaking)
        .fatalErrorHandler(fatalErrors::add)
        .metrics(metrics)
        .build();

    feature.start();

    assertTrue(fatalErrors.isEmpty());
    assertEquals(2, metrics.visited);
    assertEquals(0, metrics.failures);
    assertNull(slot.current());
    assertFalse(sandbox.isOccupied());
  }

  @Test
  void sandboxIsExitedAfterFailure() {
    procedure.outcomes.put("_system", ProcedureOutcome.STARTED_FAILED);
    UpgradeFeature feature = feature(new UpgradeOptions());

    assertThrows(FatalStartupException.class, feature::start);

    assertFalse(slot.isOccupied());
    assertFalse(sandbox.isOccupied());
    assertEquals(1, metrics.durations.size());
  }

  @Test
  void proceduresRunInsideGlobalSystemContext() {
    registry.create("shop");
    List<ScopedTransactionContext> contexts = new ArrayList<>();
    MaintenanceProcedure inspecting = (target, handle) -> {
      contexts.add(slot.current());
      return ProcedureOutcome.SUCCEEDED;
    };
    UpgradeFeature feature = UpgradeFeature.builder()
        .registry(registry)
        .sandbox(sandbox)
        .writeAheadLog(wal)
        .lifecycle(lifecycle)
        .procedure(inspecting)
        .fatalErrorHandler(fatalErrors::add)
        .build();

    feature.start();

    assertEquals(2, contexts.size());
    assertSame(contexts.get(0), contexts.get(1));
    assertTrue(contexts.get(0).isGlobal());
    assertSame(registry.systemDatabase(), contexts.get(0).database());
  }

  @Test
  void optionsAreCopiedAtBuildTime() {
    UpgradeOptions options = new UpgradeOptions();
    UpgradeFeature feature = feature(options);

    options.setUpgrade(true);

    assertFalse(feature.options().isUpgrade());
  }

  @Test
  void describesItself() {
    UpgradeFeature feature = feature(new UpgradeOptions());

    assertEquals("Upgrade", feature.name());
    assertEquals(List.of("CheckVersion", "Cluster", "Database", "Sandbox"), feature.startsAfter());
  }

  @Test
  void builderRequiresComponents() {
    assertThrows(NullPointerException.class, () -> UpgradeFeature.builder().build());
    assertThrows(NullPointerException.class, () -> UpgradeFeature.builder()
        .registry(registry)
        .sandbox(sandbox)
        .writeAheadLog(wal)
        .lifecycle(lifecycle)
        .build());
  }

  private UpgradeFeature feature(UpgradeOptions options) {
    FatalErrorHandler handler = fatalErrors::add;
    return UpgradeFeature.builder()
        .options(options)
        .registry(registry)
        .sandbox(sandbox)
        .writeAheadLog(wal)
        .lifecycle(lifecycle)
        .procedure(procedure)
        .fatalErrorHandler(handler)
        .metrics(metrics)
        .build();
  }

  private static final class CountingWriteAheadLog implements WriteAheadLog {
    private final boolean result;
    private final AtomicInteger opens = new AtomicInteger();

    private CountingWriteAheadLog(boolean result) {
      this.result = result;
    }

    @Override
    public boolean open() {
      opens.incrementAndGet();
      return result;
    }
  }

  private static final class ScriptedProcedure implements MaintenanceProcedure {
    private final Map<String, ProcedureOutcome> outcomes = new HashMap<>();
    private final Map<String, RuntimeException> errors = new HashMap<>();
    private final List<String> visited = new ArrayList<>();
    private final List<Boolean> upgradeFlags = new ArrayList<>();

    @Override
    public ProcedureOutcome run(Database target, SandboxHandle sandbox) {
      visited.add(target.name());
      upgradeFlags.add(sandbox.variable(UpgradeFeature.UPGRADE_VARIABLE).orElseThrow());
      RuntimeException error = errors.get(target.name());
      if (error != null) {
        throw error;
      }
      return outcomes.getOrDefault(target.name(), ProcedureOutcome.SUCCEEDED);
    }
  }

  private static final class RecordingMetrics implements UpgradeMetrics {
    private int visited;
    private int failures;
    private final List<Long> durations = new ArrayList<>();

    @Override
    public void incrementDatabasesVisited() {
      visited++;
    }

    @Override
    public void incrementDatabaseFailures() {
      failures++;
    }

    @Override
    public void recordSweepDurationMs(long durationMs) {
      durations.add(durationMs);
    }
  }
}
