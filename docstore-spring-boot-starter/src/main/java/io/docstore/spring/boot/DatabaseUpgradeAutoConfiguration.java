package io.docstore.spring.boot;

import io.docstore.database.DatabaseRegistry;
import io.docstore.database.DefaultDatabaseRegistry;
import io.docstore.jdbc.ConnectionProvider;
import io.docstore.jdbc.DataSourceConnectionProvider;
import io.docstore.jdbc.tx.JdbcTransactionManager;
import io.docstore.sandbox.LocalMaintenanceSandbox;
import io.docstore.sandbox.MaintenanceProcedure;
import io.docstore.sandbox.MaintenanceSandbox;
import io.docstore.spi.FatalErrorHandler;
import io.docstore.spi.ServerLifecycle;
import io.docstore.spi.UpgradeMetrics;
import io.docstore.spi.WriteAheadLog;
import io.docstore.upgrade.UpgradeFeature;
import io.docstore.upgrade.UpgradeOptions;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Auto-configuration for the database init/upgrade sweep.
 *
 * <p>Always provides a {@link DatabaseRegistry}, a {@link MaintenanceSandbox}, a
 * {@link ServerLifecycle} and a {@link FatalErrorHandler}, each backing off for a user-defined
 * bean. The {@link UpgradeFeature} itself needs a {@link WriteAheadLog} and a
 * {@link MaintenanceProcedure} bean from the application. Its options are validated while the
 * bean is created; the sweep runs when the context starts (see {@link UpgradeFeatureLifecycle}).
 *
 * <p>When a {@link DataSource} is present and {@code docstore-jdbc} is on the classpath, a
 * {@link JdbcTransactionManager} is provided as well.
 *
 * @see DatabaseProperties
 * @see DatabaseUpgradeMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(UpgradeFeature.class)
@EnableConfigurationProperties(DatabaseProperties.class)
public class DatabaseUpgradeAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(DatabaseRegistry.class)
  public DefaultDatabaseRegistry databaseRegistry() {
    return new DefaultDatabaseRegistry();
  }

  @Bean
  @ConditionalOnMissingBean(MaintenanceSandbox.class)
  public LocalMaintenanceSandbox maintenanceSandbox() {
    return new LocalMaintenanceSandbox();
  }

  @Bean
  @ConditionalOnMissingBean(ServerLifecycle.class)
  public SpringServerLifecycle serverLifecycle(ConfigurableApplicationContext context) {
    // close() waits for the refresh in progress, so it must not run on the starting thread
    ShutdownThreadFactory threads = new ShutdownThreadFactory("docstore-shutdown-");
    return new SpringServerLifecycle(() -> threads.newThread(context::close).start());
  }

  @Bean
  @ConditionalOnMissingBean(FatalErrorHandler.class)
  public FatalErrorHandler fatalErrorHandler(DatabaseProperties props) {
    return switch (props.getFatalErrorAction()) {
      case HALT -> FatalErrorHandler.HALT;
      case EXIT -> FatalErrorHandler.EXIT;
      case RETHROW -> FatalErrorHandler.RETHROW;
    };
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean({WriteAheadLog.class, MaintenanceProcedure.class})
  public UpgradeFeature upgradeFeature(DatabaseProperties props,
      DatabaseRegistry registry,
      MaintenanceSandbox sandbox,
      WriteAheadLog writeAheadLog,
      ServerLifecycle lifecycle,
      MaintenanceProcedure procedure,
      FatalErrorHandler fatalErrorHandler,
      ObjectProvider<UpgradeMetrics> metricsProvider) {

    UpgradeOptions options = new UpgradeOptions()
        .setUpgrade(props.isUpgrade())
        .setUpgradeCheck(props.isUpgradeCheck());
    UpgradeFeature feature = UpgradeFeature.builder()
        .options(options)
        .registry(registry)
        .sandbox(sandbox)
        .writeAheadLog(writeAheadLog)
        .lifecycle(lifecycle)
        .procedure(procedure)
        .fatalErrorHandler(fatalErrorHandler)
        .metrics(metricsProvider.getIfAvailable(() -> UpgradeMetrics.NOOP))
        .nonServerFeatures(props.getNonServerFeatures())
        .build();
    feature.validateOptions();
    return feature;
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean({WriteAheadLog.class, MaintenanceProcedure.class})
  public UpgradeFeatureLifecycle upgradeFeatureLifecycle(UpgradeFeature upgradeFeature) {
    return new UpgradeFeatureLifecycle(upgradeFeature);
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(JdbcTransactionManager.class)
  @ConditionalOnBean(DataSource.class)
  static class JdbcConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
      return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcTransactionManager jdbcTransactionManager(ConnectionProvider connectionProvider) {
      return new JdbcTransactionManager(connectionProvider);
    }
  }
}
