package io.jobs4j.core;

/**
 * A queue item whose visibility expired while ACTIVE.
 *
 * @param item     the item after recovery (WAITING again, or FAILED)
 * @param terminal true when the stall or attempt budget was exhausted and the item was failed
 */
public record StalledItem(QueueItem item, boolean terminal) {
}
