package io.jobs4j.core;

/**
 * Outcome of one scheduler tick.
 *
 * enqueued     : system jobs that got a new queue item
 * deduplicated : due jobs whose item already existed (another scheduler won the race)
 * notDue       : scheduled jobs with no boundary crossed since the last enqueue
 * skipped      : disabled or not yet initialized jobs
 */
public record TickResult(
        int enqueued,
        int deduplicated,
        int notDue,
        int skipped
) {

    public static TickResult empty() {
        return new TickResult(0, 0, 0, 0);
    }
}
