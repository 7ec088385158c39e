package io.jobs4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Default execution options of a job.
 *
 * <ul>
 *   <li>timeout: how long a handler may run before its queue item is left to stall</li>
 *   <li>maxAttempts: handler starts allowed for one logical run, stalls included</li>
 *   <li>backoff: delay before a failed run is retried</li>
 *   <li>concurrency: parallel handler invocations of this job inside one worker process</li>
 *   <li>removeOnComplete: delete the queue item instead of keeping it as COMPLETED</li>
 * </ul>
 */
public record JobOptions(
        Duration timeout,
        int maxAttempts,
        Backoff backoff,
        int concurrency,
        boolean removeOnComplete
) {

    public JobOptions {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(backoff, "backoff must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be a positive number");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be a positive number");
        }
    }

    public static JobOptions defaults() {
        return new JobOptions(Duration.ofMinutes(5), 3, Backoff.defaults(), 5, false);
    }

    public JobOptions withTimeout(Duration timeout) {
        return new JobOptions(timeout, maxAttempts, backoff, concurrency, removeOnComplete);
    }

    public JobOptions withMaxAttempts(int maxAttempts) {
        return new JobOptions(timeout, maxAttempts, backoff, concurrency, removeOnComplete);
    }

    public JobOptions withBackoff(Backoff backoff) {
        return new JobOptions(timeout, maxAttempts, backoff, concurrency, removeOnComplete);
    }

    public JobOptions withConcurrency(int concurrency) {
        return new JobOptions(timeout, maxAttempts, backoff, concurrency, removeOnComplete);
    }

    public JobOptions withRemoveOnComplete(boolean removeOnComplete) {
        return new JobOptions(timeout, maxAttempts, backoff, concurrency, removeOnComplete);
    }
}
