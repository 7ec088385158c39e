package io.jobs4j.service;

import io.jobs4j.core.JobExecution;
import io.jobs4j.core.JobOptions;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.QueueItem;
import io.jobs4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lifecycle bookkeeping of job executions plus the retry policy.
 *
 * <p>Records are written keyed by execution id. Two writers on one record only happen on
 * the stall-redelivery path, where the last write wins.
 */
public class JobExecutionService {
    private static final Logger log = LoggerFactory.getLogger(JobExecutionService.class);

    private final JobStore store;
    private final Clock clock;

    public JobExecutionService(JobStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Create the PENDING record of a freshly enqueued item. No-op if it already exists.
     */
    public JobExecution recordPending(String executionId, String jobName, String queue, int version, String dedupKey) {
        JobExecution pending = JobExecution.pending(executionId, jobName, queue, version, dedupKey, clock.instant());
        if (!store.createExecution(pending)) {
            log.debug("Execution already recorded id={} name={}", executionId, jobName);
            return store.findExecution(executionId).orElse(pending);
        }
        return pending;
    }

    /**
     * PENDING / STALLED -> RUNNING. Creates the record when the item was enqueued without one.
     */
    public JobExecution recordStart(QueueItem item, String workerId) {
        Instant now = clock.instant();
        JobExecution current = store.findExecution(item.id())
                .orElseGet(() -> JobExecution.pending(item.id(), item.jobName(), item.queue(), item.version(),
                        item.dedupKey(), now));

        JobExecution running = current.start(item.version(), item.attempts(), workerId, now);
        store.saveExecution(running);
        log.debug("Job execution started name={} id={} attempt={} at={}", item.jobName(), item.id(), item.attempts(), now);
        return running;
    }

    /**
     * The item was dropped before its handler ran (stale version, unknown job): FAILED without
     * a start.
     */
    public JobExecution recordDiscarded(QueueItem item, String error) {
        Instant now = clock.instant();
        JobExecution current = store.findExecution(item.id())
                .orElseGet(() -> JobExecution.pending(item.id(), item.jobName(), item.queue(), item.version(),
                        item.dedupKey(), now));

        JobExecution discarded = current.discard(error, now);
        store.saveExecution(discarded);
        log.debug("Job execution discarded name={} id={} error={}", item.jobName(), item.id(), error);
        return discarded;
    }

    public JobExecution recordSuccess(String executionId) {
        JobExecution current = require(executionId);
        JobExecution completed = current.complete(clock.instant());
        store.saveExecution(completed);
        log.debug("Job execution completed name={} id={} attempts={}", completed.jobName(), executionId, completed.attempts());
        return completed;
    }

    /**
     * @param terminal true when no further attempt will be made (FAILED); otherwise the
     *                 record goes back to PENDING with the error kept for visibility
     */
    public JobExecution recordFailure(String executionId, String error, boolean terminal) {
        JobExecution current = require(executionId);
        JobExecution failed = current.fail(error, terminal, clock.instant());
        store.saveExecution(failed);
        if (terminal) {
            log.warn("Job execution failed terminally name={} id={} attempts={} error={}",
                    failed.jobName(), executionId, failed.attempts(), error);
        }
        return failed;
    }

    /**
     * A worker holding the item disappeared. Non-terminal stalls only flip the status; the
     * redelivery will start the record again.
     */
    public void recordStalled(String executionId, boolean terminal) {
        if (terminal) {
            Optional<JobExecution> current = store.findExecution(executionId);
            if (current.isEmpty()) {
                log.warn("Stalled execution has no record id={}", executionId);
                return;
            }
            store.saveExecution(current.get().fail("job stalled more than allowable limit", true, clock.instant()));
            log.warn("Job execution stalled terminally id={}", executionId);
            return;
        }
        if (!store.updateExecutionStatus(executionId, JobStatus.STALLED, "job stalled")) {
            log.warn("Stalled execution has no record id={}", executionId);
        }
    }

    /**
     * When the next attempt may run after failure number {@code attempt}.
     */
    public Instant nextRetryAt(JobOptions options, int attempt) {
        return clock.instant().plus(options.backoff().delayFor(attempt));
    }

    public Optional<JobExecution> find(String executionId) {
        return store.findExecution(executionId);
    }

    public List<JobExecution> listExecutions(String jobName, JobStatus status) {
        Objects.requireNonNull(jobName, "jobName must not be null");
        return store.listExecutions(jobName, status);
    }

    private JobExecution require(String executionId) {
        return store.findExecution(executionId)
                .orElseThrow(() -> new IllegalStateException("No execution recorded for id: " + executionId));
    }
}
