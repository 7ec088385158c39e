package io.jobs4j;

import io.jobs4j.core.EnqueueResult;
import io.jobs4j.core.InitializationReport;
import io.jobs4j.core.JobExecution;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.TickResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Main jobs API.
 *
 * <p>Two ways work reaches the queues:
 * <ul>
 *   <li>System jobs: enqueued by the scheduler once per due period of their schedule</li>
 *   <li>User jobs: enqueued on demand with {@link #trigger(String, Object)}</li>
 * </ul>
 */
public interface Jobs {

    /**
     * Reconcile job definitions, then start the scheduler and the workers. Idempotent.
     */
    void start();

    /**
     * Stop scheduling and processing. Idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * Reconcile configured jobs with persisted definitions. Runs as part of {@link #start()}.
     */
    InitializationReport initialize();

    EnqueueResult trigger(String name, Object data);

    EnqueueResult trigger(String name, Object data, TriggerOptions options);

    /**
     * Run one scheduler pass now.
     */
    TickResult tick();

    Optional<JobExecution> execution(String executionId);

    List<JobExecution> executions(String name, JobStatus status);

    /**
     * Soft-disable a job: it is neither scheduled nor triggerable until enabled again.
     * Items already queued still run.
     */
    boolean disable(String name);

    boolean enable(String name);

    record TriggerOptions(String dedupKey, Duration delay) {
        public static TriggerOptions defaults() {
            return new TriggerOptions(null, null);
        }

        public static TriggerOptions dedup(String dedupKey) {
            return new TriggerOptions(dedupKey, null);
        }

        public static TriggerOptions delayed(Duration delay) {
            return new TriggerOptions(null, delay);
        }
    }
}
