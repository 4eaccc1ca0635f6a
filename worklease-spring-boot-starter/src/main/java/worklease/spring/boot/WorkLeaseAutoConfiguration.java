package worklease.spring.boot;

import worklease.failed.FailedUnitInspector;
import worklease.jdbc.DataSourceConnectionProvider;
import worklease.jdbc.store.AbstractJdbcWorkStore;
import worklease.jdbc.store.JdbcWorkStores;
import worklease.lease.LeaseManager;
import worklease.model.Pipeline;
import worklease.reclaim.LeaseTimeouts;
import worklease.reclaim.ReclaimScheduler;
import worklease.reclaim.StaleLeaseReclaimer;
import worklease.spi.ConnectionProvider;
import worklease.spi.MetricsExporter;
import worklease.worker.ExponentialBackoffRetryPolicy;
import worklease.worker.StageProcessor;
import worklease.worker.StageWorker;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for claim-and-lease work coordination.
 *
 * <p>Wires the work store, lease manager, stale-lease reclaimer and failed-unit inspector
 * from a {@link DataSource} and {@link WorkLeaseProperties}. A {@link ReclaimScheduler}
 * runs unless {@code worklease.reclaimer.enabled=false}; a {@link StageWorker} starts when
 * the application defines a {@link StageProcessor} bean.
 *
 * @see WorkLeaseProperties
 * @see WorkLeaseMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(LeaseManager.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(WorkLeaseProperties.class)
public class WorkLeaseAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcWorkStore workStore(DataSource dataSource, WorkLeaseProperties props) {
    return JdbcWorkStores.detect(dataSource, props.getTableName(),
        Pipeline.ofStages(props.getStageCount()));
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public LeaseManager leaseManager(WorkLeaseProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcWorkStore workStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return LeaseManager.builder()
        .connectionProvider(connectionProvider)
        .workStore(workStore)
        .maxRetries(props.getMaxRetries())
        .metrics(metricsProvider.getIfAvailable())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public StaleLeaseReclaimer staleLeaseReclaimer(WorkLeaseProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcWorkStore workStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var lease = props.getLease();
    LeaseTimeouts timeouts = LeaseTimeouts.of(lease.getTimeout(), lease.getStageTimeouts());
    return new StaleLeaseReclaimer(connectionProvider, workStore, timeouts,
        Clock.systemUTC(), metricsProvider.getIfAvailable());
  }

  @Bean
  @ConditionalOnMissingBean
  public FailedUnitInspector failedUnitInspector(ConnectionProvider connectionProvider,
      AbstractJdbcWorkStore workStore) {
    return new FailedUnitInspector(connectionProvider, workStore);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "worklease.reclaimer", name = "enabled", matchIfMissing = true)
  public ReclaimScheduler reclaimScheduler(WorkLeaseProperties props, StaleLeaseReclaimer reclaimer) {
    return ReclaimScheduler.builder()
        .reclaimer(reclaimer)
        .intervalSeconds(props.getReclaimer().getIntervalSeconds())
        .build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(StageProcessor.class)
  @ConditionalOnProperty(prefix = "worklease.worker", name = "enabled", matchIfMissing = true)
  public StageWorker stageWorker(WorkLeaseProperties props,
      LeaseManager leaseManager,
      StaleLeaseReclaimer reclaimer,
      StageProcessor processor,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var w = props.getWorker();
    var builder = StageWorker.builder()
        .leaseManager(leaseManager)
        .processor(processor)
        .stage(w.getStage())
        .batchSize(w.getBatchSize())
        .intervalMs(w.getIntervalMs())
        .commitAttempts(w.getCommitAttempts())
        .leaseTimeouts(reclaimer.timeouts())
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
        .metrics(metricsProvider.getIfAvailable());
    if (w.getOwnerId() != null && !w.getOwnerId().isEmpty()) {
      builder.leaseOwner(w.getOwnerId());
    }
    if (w.isReclaimBeforeClaim()) {
      builder.reclaimBeforeClaim(reclaimer);
    }
    return builder.build();
  }
}
