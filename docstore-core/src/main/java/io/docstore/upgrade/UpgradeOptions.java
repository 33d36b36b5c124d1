package io.docstore.upgrade;

/**
 * Startup options of the upgrade feature.
 *
 * <p>{@code upgrade} (default {@code false}) runs the upgrade procedure and shuts the server down
 * afterwards. {@code upgradeCheck} (default {@code true}) runs the procedure in check mode on every
 * start. Disabling the check while requesting an upgrade is rejected by {@link #validate()}.
 */
public final class UpgradeOptions {
  public static final String UPGRADE_OPTION = "--database.upgrade";
  public static final String UPGRADE_CHECK_OPTION = "--database.upgrade-check";

  private boolean upgrade = false;
  private boolean upgradeCheck = true;

  public boolean isUpgrade() {
    return upgrade;
  }

  public UpgradeOptions setUpgrade(boolean upgrade) {
    this.upgrade = upgrade;
    return this;
  }

  public boolean isUpgradeCheck() {
    return upgradeCheck;
  }

  public UpgradeOptions setUpgradeCheck(boolean upgradeCheck) {
    this.upgradeCheck = upgradeCheck;
    return this;
  }

  /**
   * Rejects contradictory option combinations.
   *
   * @throws FatalStartupException with {@link FatalStartupException.Reason#CONFIGURATION_CONFLICT}
   *     if an upgrade is requested with the upgrade check disabled
   */
  public void validate() {
    if (upgrade && !upgradeCheck) {
      throw new FatalStartupException(FatalStartupException.Reason.CONFIGURATION_CONFLICT,
          "cannot specify both '" + UPGRADE_OPTION + " true' and '" + UPGRADE_CHECK_OPTION + " false'");
    }
  }

  UpgradeOptions copy() {
    return new UpgradeOptions().setUpgrade(upgrade).setUpgradeCheck(upgradeCheck);
  }

  @Override
  public String toString() {
    return "UpgradeOptions{upgrade=" + upgrade + ", upgradeCheck=" + upgradeCheck + "}";
  }
}
