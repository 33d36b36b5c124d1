package io.docstore.spring.boot;

import io.docstore.upgrade.UpgradeFeature;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the {@link UpgradeFeature} when the application context starts, ahead of other
 * lifecycle beans such as embedded web servers.
 *
 * <p>A fatal condition raised by the feature propagates out of {@link #start()} and fails the
 * context refresh, unless the fatal error handler terminated the JVM first.
 */
public class UpgradeFeatureLifecycle implements SmartLifecycle {
  /** Phase in which the sweep runs. */
  public static final int PHASE = Integer.MIN_VALUE + 1000;

  private final UpgradeFeature feature;
  private volatile boolean running;

  public UpgradeFeatureLifecycle(UpgradeFeature feature) {
    this.feature = Objects.requireNonNull(feature, "feature");
  }

  @Override
  public void start() {
    feature.start();
    running = true;
  }

  @Override
  public void stop() {
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return PHASE;
  }
}
