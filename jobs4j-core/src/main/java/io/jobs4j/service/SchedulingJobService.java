package io.jobs4j.service;

import com.fasterxml.jackson.core.type.TypeReference;
import io.jobs4j.JobDescriptor;
import io.jobs4j.JobsContext;
import io.jobs4j.core.EnqueueOptions;
import io.jobs4j.core.EnqueueResult;
import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobDisabledException;
import io.jobs4j.core.JobNotFoundException;
import io.jobs4j.core.JobPayload;
import io.jobs4j.core.JobRegistry;
import io.jobs4j.core.TickResult;
import io.jobs4j.utils.Schedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Puts work on the queues: system jobs when their schedule comes due, user jobs on demand.
 *
 * <p>Every due-period boundary of a system job maps to one dedup key
 * ({@code <name>:<boundaryEpochMillis>}), so scheduler replicas ticking at the same time
 * collapse into a single queue item.
 */
public class SchedulingJobService {
    private static final Logger log = LoggerFactory.getLogger(SchedulingJobService.class);

    private final JobsContext ctx;
    private final JobRegistry registry;
    private final JobExecutionService executions;

    public SchedulingJobService(JobsContext ctx, JobRegistry registry, JobExecutionService executions) {
        this.ctx = Objects.requireNonNull(ctx, "ctx must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.executions = Objects.requireNonNull(executions, "executions must not be null");
    }

    /**
     * Enqueue every enabled system job whose next due boundary has been crossed since the
     * last recorded enqueue.
     */
    public TickResult tick() {
        Instant now = ctx.clock().instant();
        int enqueued = 0;
        int deduplicated = 0;
        int notDue = 0;
        int skipped = 0;

        for (JobDescriptor<?> descriptor : registry.systemJobs()) {
            TickOutcome outcome;
            try {
                outcome = tickJob(descriptor, now);
            } catch (Exception e) {
                log.error("jobs scheduler failed for job name={} msg={}", descriptor.name(), e.getMessage(), e);
                outcome = TickOutcome.SKIPPED;
            }
            switch (outcome) {
                case ENQUEUED -> enqueued++;
                case DEDUPLICATED -> deduplicated++;
                case NOT_DUE -> notDue++;
                case SKIPPED -> skipped++;
            }
        }

        TickResult result = new TickResult(enqueued, deduplicated, notDue, skipped);
        if (enqueued > 0 || deduplicated > 0) {
            log.debug("Scheduler tick enqueued={} deduplicated={} notDue={} skipped={}",
                    enqueued, deduplicated, notDue, skipped);
        }
        return result;
    }

    private TickOutcome tickJob(JobDescriptor<?> descriptor, Instant now) {
        Optional<JobDefinition> loaded = ctx.store().loadJob(descriptor.name());
        if (loaded.isEmpty()) {
            log.warn("System job is not initialized yet name={}", descriptor.name());
            return TickOutcome.SKIPPED;
        }
        JobDefinition job = loaded.get();
        if (!job.enabled() || !job.isScheduled()) {
            return TickOutcome.SKIPPED;
        }

        Instant since = job.lastScheduledAt() != null ? job.lastScheduledAt() : job.createdAt();
        if (since == null) {
            since = now;
        }
        Instant boundary = Schedules.latestDueBoundary(job.schedule(), job.timezone(), since, now);
        if (boundary == null) {
            return TickOutcome.NOT_DUE;
        }

        String dedupKey = job.name() + ":" + boundary.toEpochMilli();
        EnqueueResult result = enqueue(job, descriptor, null, boundary, dedupKey, Duration.ZERO);

        if (!ctx.store().advanceLastScheduled(job.name(), job.lastScheduledAt(), boundary)) {
            log.debug("Another scheduler advanced the job first name={} boundary={}", job.name(), boundary);
        }
        return result.deduplicated() ? TickOutcome.DEDUPLICATED : TickOutcome.ENQUEUED;
    }

    /**
     * Enqueue a run of a user-triggered or system job outside the schedule.
     *
     * @param dedupKey optional; runs with the same key inside the dedup window collapse
     * @param delay    optional; the run is invisible to workers until it elapses
     */
    public EnqueueResult trigger(String jobName, Object data, String dedupKey, Duration delay) {
        JobDescriptor<?> descriptor = registry.getRequired(jobName);
        JobDefinition job = ctx.store().loadJob(jobName)
                .orElseThrow(() -> new JobNotFoundException(jobName));
        if (!job.enabled()) {
            throw new JobDisabledException(jobName);
        }

        Map<String, Object> dataMap = data == null ? null :
                ctx.objectMapper().convertValue(data, new TypeReference<>() {
                });
        return enqueue(job, descriptor, dataMap, ctx.clock().instant(), dedupKey, delay);
    }

    private EnqueueResult enqueue(JobDefinition job,
                                  JobDescriptor<?> descriptor,
                                  Map<String, Object> data,
                                  Instant scheduledAt,
                                  String dedupKey,
                                  Duration delay) {
        JobPayload payload = new JobPayload(job.name(), job.version(), scheduledAt, data);
        EnqueueOptions options = new EnqueueOptions(
                dedupKey,
                delay,
                ctx.properties().getDedupWindow(),
                descriptor.options().maxAttempts()
        );

        EnqueueResult result = ctx.queue().enqueue(job.queue(), payload, options);
        if (result.deduplicated()) {
            log.debug("Job enqueue collapsed into existing item name={} dedupKey={} itemId={}",
                    job.name(), dedupKey, result.itemId());
            return result;
        }

        executions.recordPending(result.itemId(), job.name(), job.queue(), job.version(), dedupKey);
        log.debug("Job enqueued name={} queue={} version={} itemId={} scheduledAt={}",
                job.name(), job.queue(), job.version(), result.itemId(), scheduledAt);
        return result;
    }

    private enum TickOutcome {
        ENQUEUED,
        DEDUPLICATED,
        NOT_DUE,
        SKIPPED
    }
}
