package dbcleaner.spring.boot;

import dbcleaner.micrometer.MicrometerMetricsExporter;
import dbcleaner.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code cleaner.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link CleanerAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@link dbcleaner.TableCleaner}.
 */
@AutoConfiguration(
    before = CleanerAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "cleaner.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(CleanerProperties.class)
public class CleanerMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, CleanerProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
