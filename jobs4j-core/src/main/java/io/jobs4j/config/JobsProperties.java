package io.jobs4j.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runtime configuration of the jobs runtime. Bound under the {@code jobs} prefix by the
 * Spring Boot starter; plain setters otherwise.
 */
public class JobsProperties {
    private boolean enabled = true;
    private boolean autoStartup = true;
    private String workerId;
    private List<String> queues = new ArrayList<>();

    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration schedulerTickInterval = Duration.ofSeconds(5);
    private Duration stalledInterval = Duration.ofSeconds(30);
    private Duration visibilityTimeout = Duration.ofSeconds(30);

    private int maxConcurrency = 20; // global
    private int queueConcurrency = 10; // per queue
    private int batchSize = 5;
    private int maxStalledCount = 1;

    private Duration lockSafetyMargin = Duration.ofSeconds(30);
    private Duration lockContentionDelay = Duration.ofSeconds(5);
    private Duration dedupWindow = Duration.ofHours(1);

    private boolean schedulerEnabled = true;
    private boolean ensureIndexesOnStartup = false;

    /**
     * Fail with {@link IllegalArgumentException} on values the runtime cannot work with.
     */
    public void validate() {
        requirePositive(pollInterval, "jobs.poll-interval");
        requirePositive(schedulerTickInterval, "jobs.scheduler-tick-interval");
        requirePositive(stalledInterval, "jobs.stalled-interval");
        requirePositive(visibilityTimeout, "jobs.visibility-timeout");
        requirePositive(lockContentionDelay, "jobs.lock-contention-delay");
        requirePositive(dedupWindow, "jobs.dedup-window");
        Objects.requireNonNull(lockSafetyMargin, "jobs.lock-safety-margin must not be null");
        if (lockSafetyMargin.isNegative()) {
            throw new IllegalArgumentException("jobs.lock-safety-margin must not be negative");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("jobs.max-concurrency must be a positive number");
        }
        if (queueConcurrency <= 0) {
            throw new IllegalArgumentException("jobs.queue-concurrency must be a positive number");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("jobs.batch-size must be a positive number");
        }
        if (maxStalledCount < 0) {
            throw new IllegalArgumentException("jobs.max-stalled-count must not be negative");
        }
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public List<String> getQueues() {
        return queues;
    }

    public void setQueues(List<String> queues) {
        this.queues = queues;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getSchedulerTickInterval() {
        return schedulerTickInterval;
    }

    public void setSchedulerTickInterval(Duration schedulerTickInterval) {
        this.schedulerTickInterval = schedulerTickInterval;
    }

    public Duration getStalledInterval() {
        return stalledInterval;
    }

    public void setStalledInterval(Duration stalledInterval) {
        this.stalledInterval = stalledInterval;
    }

    public Duration getVisibilityTimeout() {
        return visibilityTimeout;
    }

    public void setVisibilityTimeout(Duration visibilityTimeout) {
        this.visibilityTimeout = visibilityTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getQueueConcurrency() {
        return queueConcurrency;
    }

    public void setQueueConcurrency(int queueConcurrency) {
        this.queueConcurrency = queueConcurrency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxStalledCount() {
        return maxStalledCount;
    }

    public void setMaxStalledCount(int maxStalledCount) {
        this.maxStalledCount = maxStalledCount;
    }

    public Duration getLockSafetyMargin() {
        return lockSafetyMargin;
    }

    public void setLockSafetyMargin(Duration lockSafetyMargin) {
        this.lockSafetyMargin = lockSafetyMargin;
    }

    public Duration getLockContentionDelay() {
        return lockContentionDelay;
    }

    public void setLockContentionDelay(Duration lockContentionDelay) {
        this.lockContentionDelay = lockContentionDelay;
    }

    public Duration getDedupWindow() {
        return dedupWindow;
    }

    public void setDedupWindow(Duration dedupWindow) {
        this.dedupWindow = dedupWindow;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
