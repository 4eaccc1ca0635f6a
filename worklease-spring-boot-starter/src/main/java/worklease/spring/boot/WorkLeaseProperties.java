package worklease.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for claim-and-lease work coordination.
 *
 * @see WorkLeaseAutoConfiguration
 */
@ConfigurationProperties(prefix = "worklease")
public class WorkLeaseProperties {

    /**
     * Database table name for units of work.
     */
    private String tableName = "work_unit";

    /**
     * Number of pipeline stages; the table needs one stage_k_done_at column per stage.
     */
    private int stageCount = 2;

    /**
     * Failed attempts per stage after which a unit moves to FAILED.
     */
    private int maxRetries = 3;

    private final Lease lease = new Lease();
    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final Reclaimer reclaimer = new Reclaimer();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public int getStageCount() {
        return stageCount;
    }

    public void setStageCount(int stageCount) {
        this.stageCount = stageCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Lease getLease() {
        return lease;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Reclaimer getReclaimer() {
        return reclaimer;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Lease {
        private Duration timeout = Duration.ofMinutes(30);

        /**
         * Per-stage overrides of {@code timeout}, keyed by 1-based stage number.
         */
        private Map<Integer, Duration> stageTimeouts = new LinkedHashMap<>();

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Map<Integer, Duration> getStageTimeouts() {
            return stageTimeouts;
        }

        public void setStageTimeouts(Map<Integer, Duration> stageTimeouts) {
            this.stageTimeouts = stageTimeouts;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int stage = 1;
        private int batchSize = 50;
        private long intervalMs = 5000;
        private String ownerId;
        private boolean reclaimBeforeClaim = false;
        private int commitAttempts = 3;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getStage() {
            return stage;
        }

        public void setStage(int stage) {
            this.stage = stage;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public String getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(String ownerId) {
            this.ownerId = ownerId;
        }

        public boolean isReclaimBeforeClaim() {
            return reclaimBeforeClaim;
        }

        public void setReclaimBeforeClaim(boolean reclaimBeforeClaim) {
            this.reclaimBeforeClaim = reclaimBeforeClaim;
        }

        public int getCommitAttempts() {
            return commitAttempts;
        }

        public void setCommitAttempts(int commitAttempts) {
            this.commitAttempts = commitAttempts;
        }
    }

    public static class Retry {
        private long baseDelayMs = 5000;
        private long maxDelayMs = 300000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Reclaimer {
        private boolean enabled = true;
        private long intervalSeconds = 300;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "worklease";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
