package io.jobs4j.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.JobsContext;
import io.jobs4j.config.JobsProperties;
import io.jobs4j.internal.memory.InMemoryJobQueue;
import io.jobs4j.internal.memory.InMemoryJobStore;
import io.jobs4j.internal.memory.InMemoryLockProvider;
import io.jobs4j.spi.JobStore;

import java.time.Clock;

public final class TestContexts {

    private TestContexts() {
    }

    public static JobsContext inMemory(JobsProperties props, Clock clock, String workerId) {
        return new JobsContext(props, clock, workerId,
                new InMemoryJobStore(clock), new InMemoryJobQueue(clock), new InMemoryLockProvider(clock),
                new ObjectMapper());
    }

    /**
     * A second worker sharing the collaborators of {@code other}.
     */
    public static JobsContext sharing(JobsContext other, String workerId) {
        return new JobsContext(other.properties(), other.clock(), workerId,
                other.store(), other.queue(), other.locks(), other.objectMapper());
    }

    public static JobsContext withStore(JobsContext other, JobStore store, String workerId) {
        return new JobsContext(other.properties(), other.clock(), workerId,
                store, other.queue(), other.locks(), other.objectMapper());
    }
}
