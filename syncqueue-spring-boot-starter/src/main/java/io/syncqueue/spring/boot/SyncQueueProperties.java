package io.syncqueue.spring.boot;

import io.syncqueue.model.Source;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the sync queue.
 *
 * @see SyncQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "syncqueue")
public class SyncQueueProperties {

    /**
     * Table holding queue items.
     */
    private String queueTable = "sync_queue_item";

    /**
     * Table holding per-source checkpoints.
     */
    private String checkpointTable = "sync_checkpoint";

    private final Lease lease = new Lease();
    private final Backoff backoff = new Backoff();
    private final Reclaim reclaim = new Reclaim();
    private final Retention retention = new Retention();
    private final Worker worker = new Worker();
    private final Metrics metrics = new Metrics();

    public String getQueueTable() {
        return queueTable;
    }

    public void setQueueTable(String queueTable) {
        this.queueTable = queueTable;
    }

    public String getCheckpointTable() {
        return checkpointTable;
    }

    public void setCheckpointTable(String checkpointTable) {
        this.checkpointTable = checkpointTable;
    }

    public Lease getLease() {
        return lease;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public Reclaim getReclaim() {
        return reclaim;
    }

    public Retention getRetention() {
        return retention;
    }

    public Worker getWorker() {
        return worker;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Lease {
        /**
         * How long a claim stays valid without renewal.
         */
        private Duration duration = Duration.ofMinutes(30);

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }
    }

    public static class Backoff {
        /**
         * Delay before each retry; the last step repeats.
         */
        private List<Duration> steps = new ArrayList<>(List.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(5),
            Duration.ofMinutes(15),
            Duration.ofMinutes(30),
            Duration.ofMinutes(60)));

        public List<Duration> getSteps() {
            return steps;
        }

        public void setSteps(List<Duration> steps) {
            this.steps = steps;
        }
    }

    public static class Reclaim {
        private boolean enabled = true;

        /**
         * Age after which a processing item with an expired lease is reset.
         * Must not be shorter than the lease duration.
         */
        private Duration threshold = Duration.ofMinutes(30);
        private long intervalSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getThreshold() {
            return threshold;
        }

        public void setThreshold(Duration threshold) {
            this.threshold = threshold;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Retention {
        private boolean enabled = true;
        private Duration period = Duration.ofDays(7);
        private int batchSize = 500;
        private long intervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPeriod() {
            return period;
        }

        public void setPeriod(Duration period) {
            this.period = period;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Worker {
        /**
         * Whether to start a worker when a handler bean is present.
         */
        private boolean enabled = true;

        /**
         * Restrict claims to one source; all sources when unset.
         */
        private Source source;

        private String workerIdPrefix;
        private int batchSize = 10;
        private long intervalMs = 1000;
        private int concurrency = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Source getSource() {
            return source;
        }

        public void setSource(Source source) {
            this.source = source;
        }

        public String getWorkerIdPrefix() {
            return workerIdPrefix;
        }

        public void setWorkerIdPrefix(String workerIdPrefix) {
            this.workerIdPrefix = workerIdPrefix;
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

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    public static class Metrics {
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "syncqueue";

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
