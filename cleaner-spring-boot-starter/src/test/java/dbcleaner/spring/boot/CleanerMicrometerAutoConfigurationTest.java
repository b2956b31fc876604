package dbcleaner.spring.boot;

import dbcleaner.TableCleaner;
import dbcleaner.micrometer.MicrometerMetricsExporter;
import dbcleaner.spi.MetricsExporter;
import dbcleaner.spi.Sleeper;
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
import static org.junit.jupiter.api.Assertions.assertTrue;

class CleanerMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CleanerMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("cleaner.metrics.name-prefix=airflow.cleaner").run(ctx -> {
            ctx.getBean(MetricsExporter.class).incrementRowsDeleted("log", 5);
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("airflow.cleaner.rows.deleted").tag("table", "log").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("cleaner.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void notCreatedWithoutMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(CleanerMicrometerAutoConfiguration.class))
                .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void cleanerReportsToRegistryInMockMode() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        CleanerMicrometerAutoConfiguration.class,
                        CleanerAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("cleaner.database.mock=true")
                .run(ctx -> {
                    ctx.getBean(TableCleaner.class).cleanAll();

                    var registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1000.0,
                            registry.get("dbcleaner.rows.deleted").tag("table", "xcom").counter().count());
                    assertEquals(1.0,
                            registry.get("dbcleaner.batches").tag("table", "job").counter().count());
                });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        Sleeper sleeper() {
            return duration -> { };
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
