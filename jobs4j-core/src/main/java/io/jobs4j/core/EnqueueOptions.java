package io.jobs4j.core;

import java.time.Duration;

/**
 * Queue-level options of a single enqueue.
 *
 * @param dedupKey    items with the same key inside {@code dedupWindow} collapse into one (nullable)
 * @param delay       how long the item stays invisible to workers (nullable means none)
 * @param dedupWindow how long a dedup key stays reserved
 * @param maxAttempts handler starts allowed for this item
 */
public record EnqueueOptions(
        String dedupKey,
        Duration delay,
        Duration dedupWindow,
        int maxAttempts
) {

    public EnqueueOptions {
        if (dedupKey != null && dedupKey.isBlank()) {
            dedupKey = null;
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be a positive number");
        }
        if (dedupKey != null && (dedupWindow == null || dedupWindow.isZero() || dedupWindow.isNegative())) {
            throw new IllegalArgumentException("dedupWindow must be a positive duration when dedupKey is set");
        }
    }

    public Duration delayOrZero() {
        return delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }
}
