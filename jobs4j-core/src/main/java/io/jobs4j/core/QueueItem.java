package io.jobs4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a queued work item as returned by the queue.
 *
 * <p>{@code attempts} counts handler starts; it is incremented when the item is claimed.
 */
public record QueueItem(
        String id,
        String queue,
        String jobName,
        int version,
        Instant scheduledAt,
        String dedupKey,
        Map<String, Object> data,
        QueueItemState state,
        Instant runAt,
        int attempts,
        int maxAttempts,
        int stalledCount,
        String lockedBy,
        Instant lockUntil,
        String lastError
) {

    public boolean attemptsExhausted() {
        return attempts >= maxAttempts;
    }
}
