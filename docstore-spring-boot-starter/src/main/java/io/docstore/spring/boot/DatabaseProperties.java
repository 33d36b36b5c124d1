package io.docstore.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the database init/upgrade sweep.
 *
 * @see DatabaseUpgradeAutoConfiguration
 */
@ConfigurationProperties(prefix = "database")
public class DatabaseProperties {

  /**
   * Run the upgrade procedure for every database, then shut down.
   */
  private boolean upgrade = false;

  /**
   * Run the maintenance procedure in check mode on every start.
   */
  private boolean upgradeCheck = true;

  /**
   * Names of features disabled for the duration of an upgrade run.
   */
  private List<String> nonServerFeatures = new ArrayList<>();

  /**
   * What to do once a fatal startup condition has been logged.
   */
  private FatalErrorAction fatalErrorAction = FatalErrorAction.HALT;

  private final Metrics metrics = new Metrics();

  public boolean isUpgrade() {
    return upgrade;
  }

  public void setUpgrade(boolean upgrade) {
    this.upgrade = upgrade;
  }

  public boolean isUpgradeCheck() {
    return upgradeCheck;
  }

  public void setUpgradeCheck(boolean upgradeCheck) {
    this.upgradeCheck = upgradeCheck;
  }

  public List<String> getNonServerFeatures() {
    return nonServerFeatures;
  }

  public void setNonServerFeatures(List<String> nonServerFeatures) {
    this.nonServerFeatures = nonServerFeatures;
  }

  public FatalErrorAction getFatalErrorAction() {
    return fatalErrorAction;
  }

  public void setFatalErrorAction(FatalErrorAction fatalErrorAction) {
    this.fatalErrorAction = fatalErrorAction;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public enum FatalErrorAction {
    /** Halt the JVM with status 1 without running shutdown hooks. */
    HALT,
    /** Exit the JVM with status 1, running shutdown hooks. */
    EXIT,
    /** Let the exception fail the application context refresh. */
    RETHROW
  }

  public static class Metrics {
    /**
     * Whether to register Micrometer meters for the sweep.
     */
    private boolean enabled = true;

    /**
     * Prefix for all meter names.
     */
    private String namePrefix = "docstore.upgrade";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
