package worklease.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkLeasePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(WorkLeaseProperties.class);
            assertEquals("work_unit", props.getTableName());
            assertEquals(2, props.getStageCount());
            assertEquals(3, props.getMaxRetries());
            assertEquals(Duration.ofMinutes(30), props.getLease().getTimeout());
            assertTrue(props.getLease().getStageTimeouts().isEmpty());
            assertTrue(props.getWorker().isEnabled());
            assertEquals(1, props.getWorker().getStage());
            assertEquals(50, props.getWorker().getBatchSize());
            assertEquals(5000, props.getWorker().getIntervalMs());
            assertNull(props.getWorker().getOwnerId());
            assertFalse(props.getWorker().isReclaimBeforeClaim());
            assertEquals(3, props.getWorker().getCommitAttempts());
            assertEquals(5000, props.getRetry().getBaseDelayMs());
            assertEquals(300000, props.getRetry().getMaxDelayMs());
            assertTrue(props.getReclaimer().isEnabled());
            assertEquals(300, props.getReclaimer().getIntervalSeconds());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("worklease", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "worklease.table-name=enrich_job",
                "worklease.stage-count=3",
                "worklease.max-retries=5",
                "worklease.lease.timeout=10m",
                "worklease.lease.stage-timeouts.2=45m",
                "worklease.worker.stage=2",
                "worklease.worker.batch-size=20",
                "worklease.worker.interval-ms=1000",
                "worklease.worker.owner-id=enricher-7",
                "worklease.worker.reclaim-before-claim=true",
                "worklease.worker.commit-attempts=5",
                "worklease.retry.base-delay-ms=1000",
                "worklease.retry.max-delay-ms=60000",
                "worklease.reclaimer.enabled=false",
                "worklease.reclaimer.interval-seconds=60",
                "worklease.metrics.name-prefix=developers.enrich"
        ).run(ctx -> {
            var props = ctx.getBean(WorkLeaseProperties.class);
            assertEquals("enrich_job", props.getTableName());
            assertEquals(3, props.getStageCount());
            assertEquals(5, props.getMaxRetries());
            assertEquals(Duration.ofMinutes(10), props.getLease().getTimeout());
            assertEquals(Map.of(2, Duration.ofMinutes(45)), props.getLease().getStageTimeouts());
            assertEquals(2, props.getWorker().getStage());
            assertEquals(20, props.getWorker().getBatchSize());
            assertEquals(1000, props.getWorker().getIntervalMs());
            assertEquals("enricher-7", props.getWorker().getOwnerId());
            assertTrue(props.getWorker().isReclaimBeforeClaim());
            assertEquals(5, props.getWorker().getCommitAttempts());
            assertEquals(1000, props.getRetry().getBaseDelayMs());
            assertEquals(60000, props.getRetry().getMaxDelayMs());
            assertFalse(props.getReclaimer().isEnabled());
            assertEquals(60, props.getReclaimer().getIntervalSeconds());
            assertEquals("developers.enrich", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(WorkLeaseProperties.class)
    static class PropsConfig {
    }
}
