package io.docstore.spring.boot;

import io.docstore.spi.ServerLifecycle;
import org.springframework.boot.ExitCodeGenerator;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ServerLifecycle} for a Spring application.
 *
 * <p>Records the switches flipped during startup for other beans to consult, reports the exit
 * code through {@link ExitCodeGenerator} (picked up by
 * {@link org.springframework.boot.SpringApplication#exit}) and runs the configured shutdown
 * action once when shutdown is requested.
 */
public class SpringServerLifecycle implements ServerLifecycle, ExitCodeGenerator {
  private static final Logger logger = Logger.getLogger(SpringServerLifecycle.class.getName());

  private final Runnable shutdownAction;
  private final Set<String> disabledFeatures = new LinkedHashSet<>();
  private volatile boolean replicationApplierDisabled;
  private volatile boolean upgradeEnabled;
  private volatile boolean clusterDisabled;
  private volatile boolean shutdownRequested;
  private volatile int exitCode;

  /**
   * @param shutdownAction runs once on {@link #beginShutdown()}; must not block on the thread
   *     that is starting the application
   */
  public SpringServerLifecycle(Runnable shutdownAction) {
    this.shutdownAction = Objects.requireNonNull(shutdownAction, "shutdownAction");
  }

  @Override
  public synchronized void disableFeatures(Collection<String> featureNames) {
    disabledFeatures.addAll(featureNames);
    logger.log(Level.FINE, "Disabled features {0}", featureNames);
  }

  @Override
  public void disableReplicationApplier() {
    replicationApplierDisabled = true;
  }

  @Override
  public void enableUpgrade() {
    upgradeEnabled = true;
  }

  @Override
  public void disableCluster() {
    clusterDisabled = true;
  }

  @Override
  public void beginShutdown() {
    synchronized (this) {
      if (shutdownRequested) {
        return;
      }
      shutdownRequested = true;
    }
    logger.log(Level.INFO, "Shutdown requested");
    shutdownAction.run();
  }

  @Override
  public void setExitCode(int exitCode) {
    this.exitCode = exitCode;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  public synchronized boolean isFeatureDisabled(String featureName) {
    return disabledFeatures.contains(featureName);
  }

  public synchronized Set<String> getDisabledFeatures() {
    return Set.copyOf(disabledFeatures);
  }

  public boolean isReplicationApplierDisabled() {
    return replicationApplierDisabled;
  }

  public boolean isUpgradeEnabled() {
    return upgradeEnabled;
  }

  public boolean isClusterDisabled() {
    return clusterDisabled;
  }

  public boolean isShutdownRequested() {
    return shutdownRequested;
  }
}
