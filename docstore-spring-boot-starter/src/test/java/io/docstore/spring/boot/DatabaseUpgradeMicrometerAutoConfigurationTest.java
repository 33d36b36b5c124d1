package io.docstore.spring.boot;

import io.docstore.micrometer.MicrometerUpgradeMetrics;
import io.docstore.spi.UpgradeMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseUpgradeMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DatabaseUpgradeMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerMetricsByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerUpgradeMetrics"));
            assertInstanceOf(MicrometerUpgradeMetrics.class, ctx.getBean(UpgradeMetrics.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("database.metrics.name-prefix=node1.upgrade").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("node1.upgrade.databases.visited").counter());
            assertNotNull(registry.find("node1.upgrade.sweep.duration.ms").gauge());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("database.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerUpgradeMetrics"));
        });
    }

    @Test
    void backsOffWhenCustomMetricsPresent() {
        runner.withUserConfiguration(CustomMetricsConfig.class).run(ctx -> {
            assertSame(UpgradeMetrics.NOOP, ctx.getBean(UpgradeMetrics.class));
        });
    }

    @Test
    void metersRemovedWhenContextCloses() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(DatabaseUpgradeMicrometerAutoConfiguration.class))
                .withBean(MeterRegistry.class, () -> registry)
                .run(ctx -> assertNotNull(registry.find("docstore.upgrade.databases.visited").counter()));

        assertEquals(0, registry.getMeters().size());
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomMetricsConfig {
        @Bean
        UpgradeMetrics customUpgradeMetrics() {
            return UpgradeMetrics.NOOP;
        }
    }
}
