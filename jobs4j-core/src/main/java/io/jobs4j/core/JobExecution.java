package io.jobs4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One logical run of a job. The id equals the queue item id, so retries and stall
 * redeliveries of the same run update this record instead of creating new ones.
 *
 * <p>State machine: PENDING -> RUNNING -> {COMPLETED | FAILED | STALLED}. A failure with
 * attempts left goes back to PENDING; a STALLED run becomes RUNNING again on redelivery.
 */
public record JobExecution(
        String id,
        String jobName,
        String queue,
        int jobVersion,
        JobStatus status,
        int attempts,
        String dedupKey,
        String workerId,
        String error,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {

    public JobExecution {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static JobExecution pending(String id, String jobName, String queue, int jobVersion,
                                       String dedupKey, Instant createdAt) {
        return new JobExecution(id, jobName, queue, jobVersion, JobStatus.PENDING, 0, dedupKey,
                null, null, createdAt, null, null);
    }

    public JobExecution start(int jobVersion, int attempts, String workerId, Instant at) {
        return new JobExecution(id, jobName, queue, jobVersion, JobStatus.RUNNING, attempts, dedupKey,
                workerId, error, createdAt, at, null);
    }

    public JobExecution complete(Instant at) {
        return new JobExecution(id, jobName, queue, jobVersion, JobStatus.COMPLETED, attempts, dedupKey,
                workerId, null, createdAt, startedAt != null ? startedAt : at, at);
    }

    /**
     * FAILED without ever running; {@code startedAt} stays unset.
     */
    public JobExecution discard(String error, Instant at) {
        return new JobExecution(id, jobName, queue, jobVersion, JobStatus.FAILED, attempts, dedupKey,
                workerId, error, createdAt, startedAt, at);
    }

    public JobExecution fail(String error, boolean terminal, Instant at) {
        if (!terminal) {
            return new JobExecution(id, jobName, queue, jobVersion, JobStatus.PENDING, attempts, dedupKey,
                    workerId, error, createdAt, startedAt, null);
        }
        return new JobExecution(id, jobName, queue, jobVersion, JobStatus.FAILED, attempts, dedupKey,
                workerId, error, createdAt, startedAt != null ? startedAt : at, at);
    }
}
