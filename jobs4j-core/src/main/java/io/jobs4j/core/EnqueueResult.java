package io.jobs4j.core;

/**
 * Result of an enqueue.
 *
 * itemId       : the new item, or the item that already holds the dedup key
 * deduplicated : true when no new item was created
 */
public record EnqueueResult(
        String itemId,
        boolean deduplicated
) {

    public static EnqueueResult created(String itemId) {
        return new EnqueueResult(itemId, false);
    }

    public static EnqueueResult duplicateOf(String itemId) {
        return new EnqueueResult(itemId, true);
    }
}
