package io.jobs4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted job definition.
 * Identity is {@code name}; {@code version} grows by one on every definition change.
 */
public record JobDefinition(

        // identity
        String name,
        String queue,

        // scheduling
        String schedule,
        String timezone,
        Instant lastScheduledAt,

        // execution
        JobOptions options,
        boolean singleRunningJobGlobally,
        boolean system,

        // state
        int version,
        boolean enabled,
        Instant createdAt,
        Instant updatedAt
) {

    public JobDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(options, "options must not be null");
    }

    public boolean isScheduled() {
        return schedule != null && !schedule.isBlank();
    }

    /**
     * True if any field that affects how the job runs differs. Bookkeeping fields
     * (version, enabled, timestamps, lastScheduledAt) are ignored.
     */
    public boolean sameDefinitionAs(JobDefinition other) {
        return other != null
                && name.equals(other.name)
                && queue.equals(other.queue)
                && Objects.equals(schedule, other.schedule)
                && Objects.equals(timezone, other.timezone)
                && options.equals(other.options)
                && singleRunningJobGlobally == other.singleRunningJobGlobally
                && system == other.system;
    }

    public JobDefinition withVersion(int version) {
        return new JobDefinition(name, queue, schedule, timezone, lastScheduledAt, options,
                singleRunningJobGlobally, system, version, enabled, createdAt, updatedAt);
    }

    public JobDefinition withEnabled(boolean enabled, Instant updatedAt) {
        return new JobDefinition(name, queue, schedule, timezone, lastScheduledAt, options,
                singleRunningJobGlobally, system, version, enabled, createdAt, updatedAt);
    }

    public JobDefinition withLastScheduledAt(Instant lastScheduledAt) {
        return new JobDefinition(name, queue, schedule, timezone, lastScheduledAt, options,
                singleRunningJobGlobally, system, version, enabled, createdAt, updatedAt);
    }
}
