package io.jobs4j.spi;

import io.jobs4j.core.EnqueueOptions;
import io.jobs4j.core.EnqueueResult;
import io.jobs4j.core.JobPayload;
import io.jobs4j.core.QueueItem;
import io.jobs4j.core.QueueItemState;
import io.jobs4j.core.StalledItem;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Queue / transport for work items.
 *
 * <p>Delivery is at-least-once and best-effort FIFO by {@code runAt}. A claimed item is
 * invisible to other workers until its visibility expires; an ACTIVE item whose visibility
 * expired is stalled and gets redelivered by {@link #recoverStalled(String, int)}.
 *
 * <p>Every write-back of a claimed item is guarded by {@code workerId}: a worker that lost
 * its item to stall redelivery cannot overwrite the new holder's state.
 */
public interface JobQueue {

    /**
     * Add an item. Items carrying a dedup key that is still reserved collapse into the
     * item holding that key.
     */
    EnqueueResult enqueue(String queue, JobPayload payload, EnqueueOptions options);

    /**
     * Atomically claim at most {@code max} due WAITING items, marking them ACTIVE for
     * {@code visibility} and incrementing their attempts.
     */
    List<QueueItem> claim(String queue, int max, Duration visibility, String workerId);

    /**
     * Heartbeat: push the visibility of a claimed item.
     *
     * @return false if the item is no longer held by {@code workerId}
     */
    boolean extend(String itemId, String workerId, Duration visibility);

    boolean complete(String itemId, String workerId, boolean remove);

    /**
     * Put a failed item back for another attempt at {@code runAt}.
     */
    boolean retry(String itemId, String workerId, Instant runAt, String error);

    /**
     * Put a claimed item back without consuming an attempt.
     */
    boolean postpone(String itemId, String workerId, Instant runAt);

    boolean fail(String itemId, String workerId, String error);

    /**
     * Redeliver ACTIVE items whose visibility expired. An item that already stalled
     * {@code maxStalledCount} times, or used up its attempts, is failed instead.
     */
    List<StalledItem> recoverStalled(String queue, int maxStalledCount);

    Optional<QueueItem> find(String itemId);

    long count(String queue, QueueItemState state);
}
