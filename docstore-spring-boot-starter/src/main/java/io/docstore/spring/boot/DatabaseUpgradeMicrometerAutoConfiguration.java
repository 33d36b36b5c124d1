package io.docstore.spring.boot;

import io.docstore.micrometer.MicrometerUpgradeMetrics;
import io.docstore.spi.UpgradeMetrics;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics of the upgrade sweep.
 *
 * <p>Creates a {@link MicrometerUpgradeMetrics} when Micrometer is on the classpath and
 * {@code database.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link DatabaseUpgradeAutoConfiguration} so the {@link UpgradeMetrics} bean is
 * available for injection into the {@link io.docstore.upgrade.UpgradeFeature}.
 */
@AutoConfiguration(before = DatabaseUpgradeAutoConfiguration.class)
@ConditionalOnClass({MicrometerUpgradeMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "database.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(DatabaseProperties.class)
public class DatabaseUpgradeMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(UpgradeMetrics.class)
  public MicrometerUpgradeMetrics micrometerUpgradeMetrics(
      MeterRegistry meterRegistry, DatabaseProperties props) {
    return new MicrometerUpgradeMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
