package io.jobs4j.service;

import io.jobs4j.JobDescriptor;
import io.jobs4j.JobsContext;
import io.jobs4j.config.JobsProperties;
import io.jobs4j.core.EnqueueResult;
import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobDisabledException;
import io.jobs4j.core.JobExecution;
import io.jobs4j.core.JobNotFoundException;
import io.jobs4j.core.JobRegistry;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.JobsConfiguration;
import io.jobs4j.core.QueueItem;
import io.jobs4j.core.QueueItemState;
import io.jobs4j.core.TickResult;
import io.jobs4j.internal.memory.InMemoryJobStore;
import io.jobs4j.support.MutableClock;
import io.jobs4j.support.RecordingHandler;
import io.jobs4j.support.TestContexts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulingJobServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:10Z");

    private MutableClock clock;
    private JobsContext ctx;
    private JobRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        ctx = TestContexts.inMemory(new JobsProperties(), clock, "worker-a");
        registry = JobRegistry.registerQueues(JobsConfiguration.builder()
                .queue("maintenance")
                .queue("mail")
                .job(JobDescriptor.builder(new RecordingHandler("cleanup"))
                        .queue("maintenance")
                        .system("1 minute")
                        .build())
                .job(JobDescriptor.builder(new RecordingHandler("send-mail"))
                        .queue("mail")
                        .build())
                .build());
        initialize(ctx);
    }

    private void initialize(JobsContext context) {
        new JobInitializationService(context, registry, new JobVersionService(context.store())).initialize();
    }

    private SchedulingJobService scheduling(JobsContext context) {
        return new SchedulingJobService(context, registry, new JobExecutionService(context.store(), context.clock()));
    }

    @Test
    void tickShouldEnqueueOnceWhenBoundaryIsCrossed() {
        SchedulingJobService scheduling = scheduling(ctx);

        assertEquals(1, scheduling.tick().notDue());

        clock.advance(Duration.ofSeconds(90));
        TickResult first = scheduling.tick();
        TickResult second = scheduling.tick();

        assertEquals(1, first.enqueued());
        assertEquals(0, second.enqueued());
        assertEquals(1, second.notDue());
        assertEquals(1, ctx.queue().count("maintenance", QueueItemState.WAITING));
        assertEquals(Instant.parse("2026-01-01T00:01:00Z"),
                ctx.store().loadJob("cleanup").orElseThrow().lastScheduledAt());
    }

    @Test
    void tickShouldCollapseMissedBoundariesIntoOneRun() {
        clock.advance(Duration.ofMinutes(10));

        TickResult result = scheduling(ctx).tick();

        assertEquals(1, result.enqueued());
        assertEquals(1, ctx.queue().count("maintenance", QueueItemState.WAITING));
    }

    @Test
    void twoSchedulersAtSameBoundaryShouldProduceOneItem() {
        // second replica read the definition before the first advanced lastScheduledAt
        InMemoryJobStore staleView = new InMemoryJobStore(clock) {
            @Override
            public boolean advanceLastScheduled(String name, Instant expected, Instant boundary) {
                return false;
            }
        };
        JobsContext replicaB = TestContexts.withStore(ctx, staleView, "worker-b");
        initialize(replicaB);

        clock.advance(Duration.ofSeconds(90));
        TickResult a = scheduling(ctx).tick();
        TickResult b = scheduling(replicaB).tick();

        assertEquals(1, a.enqueued());
        assertEquals(0, b.enqueued());
        assertEquals(1, b.deduplicated());
        assertEquals(1, ctx.queue().count("maintenance", null));

        QueueItem item = ctx.queue().claim("maintenance", 10, Duration.ofSeconds(30), "worker-a").get(0);
        assertEquals("cleanup:" + Instant.parse("2026-01-01T00:01:00Z").toEpochMilli(), item.dedupKey());
        assertEquals(1, item.version());
    }

    @Test
    void failingSystemJobShouldNotBlockTheOthers() {
        InMemoryJobStore failingStore = new InMemoryJobStore(clock) {
            @Override
            public Optional<JobDefinition> loadJob(String name) {
                if (name.equals("rebuild-index")) {
                    throw new IllegalStateException("store unavailable for " + name);
                }
                return super.loadJob(name);
            }
        };
        JobsContext context = TestContexts.withStore(ctx, failingStore, "worker-a");
        JobRegistry twoSystemJobs = JobRegistry.registerQueues(JobsConfiguration.builder()
                .queue("maintenance")
                .job(JobDescriptor.builder(new RecordingHandler("rebuild-index"))
                        .queue("maintenance")
                        .system("1 minute")
                        .build())
                .job(JobDescriptor.builder(new RecordingHandler("purge-sessions"))
                        .queue("maintenance")
                        .system("1 minute")
                        .build())
                .build());
        new JobInitializationService(context, twoSystemJobs, new JobVersionService(failingStore)).initialize();

        clock.advance(Duration.ofMinutes(2));
        TickResult result = new SchedulingJobService(context, twoSystemJobs,
                new JobExecutionService(failingStore, clock)).tick();

        assertEquals(1, result.skipped());
        assertEquals(1, result.enqueued());
        QueueItem item = ctx.queue().claim("maintenance", 10, Duration.ofSeconds(30), "worker-a").get(0);
        assertEquals("purge-sessions", item.jobName());
    }

    @Test
    void tickShouldSkipDisabledJobs() {
        ctx.store().setEnabled("cleanup", false);
        clock.advance(Duration.ofMinutes(2));

        TickResult result = scheduling(ctx).tick();

        assertEquals(1, result.skipped());
        assertEquals(0, ctx.queue().count("maintenance", null));
    }

    @Test
    void triggerShouldEnqueueWithCurrentVersionAndRecordPending() {
        ctx.store().bumpVersion("send-mail");

        EnqueueResult result = scheduling(ctx).trigger("send-mail", new RecordingHandler.Payload("hi"), null, null);

        assertFalse(result.deduplicated());
        QueueItem item = ctx.queue().find(result.itemId()).orElseThrow();
        assertEquals(2, item.version());
        assertEquals(Map.of("message", "hi"), item.data());
        assertEquals(3, item.maxAttempts());

        JobExecution execution = ctx.store().findExecution(result.itemId()).orElseThrow();
        assertEquals(JobStatus.PENDING, execution.status());
        assertEquals(2, execution.jobVersion());
    }

    @Test
    void triggerWithSameDedupKeyShouldCollapse() {
        SchedulingJobService scheduling = scheduling(ctx);

        EnqueueResult first = scheduling.trigger("send-mail", null, "welcome:42", null);
        EnqueueResult second = scheduling.trigger("send-mail", null, "welcome:42", null);

        assertTrue(second.deduplicated());
        assertEquals(first.itemId(), second.itemId());
        assertEquals(1, ctx.store().listExecutions("send-mail", null).size());
    }

    @Test
    void delayedTriggerShouldNotBeClaimableEarly() {
        scheduling(ctx).trigger("send-mail", null, null, Duration.ofMinutes(1));

        assertEquals(List.of(), ctx.queue().claim("mail", 10, Duration.ofSeconds(30), "worker-a"));
        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, ctx.queue().claim("mail", 10, Duration.ofSeconds(30), "worker-a").size());
    }

    @Test
    void triggerShouldRejectUnknownOrDisabledJobs() {
        SchedulingJobService scheduling = scheduling(ctx);
        ctx.store().setEnabled("send-mail", false);

        assertThrows(JobNotFoundException.class, () -> scheduling.trigger("nope", null, null, null));
        assertThrows(JobDisabledException.class, () -> scheduling.trigger("send-mail", null, null, null));
    }
}
