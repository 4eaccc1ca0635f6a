package worklease.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import worklease.micrometer.MicrometerMetricsExporter;
import worklease.spi.MetricsExporter;

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
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * with a {@link MeterRegistry} bean, and {@code worklease.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link WorkLeaseAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the lease manager, reclaimer and worker.
 */
@AutoConfiguration(before = WorkLeaseAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "worklease.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WorkLeaseProperties.class)
public class WorkLeaseMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, WorkLeaseProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
