package io.jobs4j.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * What a queue item carries: the job, the job version it was scheduled against,
 * the scheduling timestamp and the handler data.
 */
public record JobPayload(
        String jobName,
        int version,
        Instant scheduledAt,
        Map<String, Object> data
) {

    public JobPayload {
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(scheduledAt, "scheduledAt must not be null");
        if (version <= 0) {
            throw new IllegalArgumentException("version must be a positive number");
        }
    }
}
