package io.jobs4j.internal.memory;

import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobExecution;
import io.jobs4j.core.JobNotFoundException;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.PersistResult;
import io.jobs4j.spi.JobStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-local {@link JobStore}. Every operation is atomic under the instance monitor.
 */
public class InMemoryJobStore implements JobStore {

    private final Clock clock;
    private final Map<String, JobDefinition> jobs = new LinkedHashMap<>();
    private final Map<String, JobExecution> executions = new LinkedHashMap<>();

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryJobStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized PersistResult upsertJob(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        Instant now = clock.instant();
        JobDefinition existing = jobs.get(definition.name());

        if (existing == null) {
            jobs.put(definition.name(), new JobDefinition(
                    definition.name(),
                    definition.queue(),
                    definition.schedule(),
                    definition.timezone(),
                    null,
                    definition.options(),
                    definition.singleRunningJobGlobally(),
                    definition.system(),
                    1,
                    true,
                    now,
                    now
            ));
            return PersistResult.createdResult();
        }

        if (existing.sameDefinitionAs(definition)) {
            return PersistResult.noop();
        }
        jobs.put(definition.name(), new JobDefinition(
                definition.name(),
                definition.queue(),
                definition.schedule(),
                definition.timezone(),
                existing.lastScheduledAt(),
                definition.options(),
                definition.singleRunningJobGlobally(),
                definition.system(),
                existing.version() + 1,
                existing.enabled(),
                existing.createdAt(),
                now
        ));
        return PersistResult.updatedResult();
    }

    @Override
    public synchronized Optional<JobDefinition> loadJob(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    @Override
    public synchronized List<JobDefinition> listJobs() {
        return List.copyOf(jobs.values());
    }

    @Override
    public synchronized int bumpVersion(String name) {
        JobDefinition existing = jobs.get(name);
        if (existing == null) {
            throw new JobNotFoundException(name);
        }
        JobDefinition bumped = existing.withVersion(existing.version() + 1);
        jobs.put(name, bumped);
        return bumped.version();
    }

    @Override
    public synchronized boolean setEnabled(String name, boolean enabled) {
        JobDefinition existing = jobs.get(name);
        if (existing == null || existing.enabled() == enabled) {
            return false;
        }
        jobs.put(name, existing.withEnabled(enabled, clock.instant()));
        return true;
    }

    @Override
    public synchronized boolean advanceLastScheduled(String name, Instant expected, Instant boundary) {
        JobDefinition existing = jobs.get(name);
        if (existing == null || !Objects.equals(existing.lastScheduledAt(), expected)) {
            return false;
        }
        jobs.put(name, existing.withLastScheduledAt(boundary));
        return true;
    }

    @Override
    public synchronized boolean createExecution(JobExecution execution) {
        return executions.putIfAbsent(execution.id(), execution) == null;
    }

    @Override
    public synchronized void saveExecution(JobExecution execution) {
        executions.put(execution.id(), execution);
    }

    @Override
    public synchronized boolean updateExecutionStatus(String id, JobStatus status, String error) {
        JobExecution e = executions.get(id);
        if (e == null) {
            return false;
        }
        executions.put(id, new JobExecution(e.id(), e.jobName(), e.queue(), e.jobVersion(), status, e.attempts(),
                e.dedupKey(), e.workerId(), error, e.createdAt(), e.startedAt(), e.finishedAt()));
        return true;
    }

    @Override
    public synchronized Optional<JobExecution> findExecution(String id) {
        return Optional.ofNullable(executions.get(id));
    }

    @Override
    public synchronized List<JobExecution> listExecutions(String jobName, JobStatus status) {
        List<JobExecution> result = new ArrayList<>();
        for (JobExecution e : executions.values()) {
            if (e.jobName().equals(jobName) && (status == null || e.status() == status)) {
                result.add(e);
            }
        }
        // insertion order reversed, then a stable sort keeps newer records first on equal timestamps
        Collections.reverse(result);
        result.sort(Comparator.comparing(JobExecution::createdAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return result;
    }
}
