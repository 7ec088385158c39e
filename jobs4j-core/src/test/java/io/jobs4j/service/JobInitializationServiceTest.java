package io.jobs4j.service;

import io.jobs4j.JobDescriptor;
import io.jobs4j.JobsContext;
import io.jobs4j.config.JobsProperties;
import io.jobs4j.core.InitializationReport;
import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobRegistry;
import io.jobs4j.core.JobsConfiguration;
import io.jobs4j.core.PersistResult;
import io.jobs4j.internal.memory.InMemoryJobStore;
import io.jobs4j.support.MutableClock;
import io.jobs4j.support.RecordingHandler;
import io.jobs4j.support.TestContexts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobInitializationServiceTest {

    private MutableClock clock;
    private JobsContext ctx;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ctx = TestContexts.inMemory(new JobsProperties(), clock, "worker-a");
    }

    private InitializationReport initialize(JobDescriptor<?>... descriptors) {
        Set<String> queues = new LinkedHashSet<>();
        for (JobDescriptor<?> d : descriptors) {
            queues.add(d.queue());
        }
        JobRegistry registry = JobRegistry.registerQueues(JobsConfiguration.builder()
                .queues(List.copyOf(queues))
                .jobs(List.of(descriptors))
                .build());
        return new JobInitializationService(ctx, registry, new JobVersionService(ctx.store())).initialize();
    }

    private static JobDescriptor<RecordingHandler.Payload> sendMail(Duration timeout) {
        return JobDescriptor.builder(new RecordingHandler("send-mail")).queue("mail").timeout(timeout).build();
    }

    private static JobDescriptor<RecordingHandler.Payload> cleanup() {
        return JobDescriptor.builder(new RecordingHandler("cleanup")).queue("maintenance").system("1 hour").build();
    }

    @Test
    void firstStartShouldCreateDefinitionsAtVersionOne() {
        InitializationReport report = initialize(sendMail(Duration.ofMinutes(1)), cleanup());

        assertEquals(List.of("send-mail", "cleanup"), report.created());
        JobDefinition cleanup = ctx.store().loadJob("cleanup").orElseThrow();
        assertEquals(1, cleanup.version());
        assertTrue(cleanup.enabled());
        assertTrue(cleanup.system());
        assertEquals("1 hour", cleanup.schedule());
    }

    @Test
    void unchangedDefinitionShouldKeepVersion() {
        initialize(sendMail(Duration.ofMinutes(1)));

        InitializationReport report = initialize(sendMail(Duration.ofMinutes(1)));

        assertEquals(List.of("send-mail"), report.unchanged());
        assertEquals(1, ctx.store().loadJob("send-mail").orElseThrow().version());
    }

    @Test
    void changedDefinitionShouldBumpVersion() {
        initialize(sendMail(Duration.ofMinutes(1)));
        clock.advance(Duration.ofHours(1));

        InitializationReport report = initialize(sendMail(Duration.ofMinutes(2)));

        assertEquals(List.of("send-mail"), report.updated());
        JobDefinition stored = ctx.store().loadJob("send-mail").orElseThrow();
        assertEquals(2, stored.version());
        assertEquals(Duration.ofMinutes(2), stored.options().timeout());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), stored.createdAt());
    }

    @Test
    void replicasStartingWithTheSameChangeShouldBumpVersionOnce() throws Exception {
        initialize(sendMail(Duration.ofMinutes(1)));

        CyclicBarrier bothUpserting = new CyclicBarrier(2);
        AtomicBoolean racing = new AtomicBoolean(false);
        InMemoryJobStore racingStore = new InMemoryJobStore(clock) {
            @Override
            public PersistResult upsertJob(JobDefinition definition) {
                if (racing.get()) {
                    try {
                        bothUpserting.await(5, TimeUnit.SECONDS);
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                }
                return super.upsertJob(definition);
            }
        };
        racingStore.upsertJob(ctx.store().loadJob("send-mail").orElseThrow());
        racing.set(true);

        JobRegistry registry = JobRegistry.registerQueues(JobsConfiguration.builder()
                .queues(List.of("mail"))
                .jobs(List.of(sendMail(Duration.ofMinutes(2))))
                .build());
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<InitializationReport>> reports = new ArrayList<>();
            for (String worker : List.of("worker-a", "worker-b")) {
                JobsContext replica = TestContexts.withStore(ctx, racingStore, worker);
                Callable<InitializationReport> start = () ->
                        new JobInitializationService(replica, registry, new JobVersionService(racingStore)).initialize();
                reports.add(pool.submit(start));
            }

            int updated = 0;
            for (Future<InitializationReport> report : reports) {
                updated += report.get(10, TimeUnit.SECONDS).updated().size();
            }
            assertEquals(1, updated);
        } finally {
            pool.shutdownNow();
        }

        JobDefinition stored = racingStore.loadJob("send-mail").orElseThrow();
        assertEquals(2, stored.version());
        assertEquals(Duration.ofMinutes(2), stored.options().timeout());
    }

    @Test
    void removedJobShouldBeDisabledAndReenabledWhenConfiguredAgain() {
        initialize(sendMail(Duration.ofMinutes(1)), cleanup());

        InitializationReport removed = initialize(sendMail(Duration.ofMinutes(1)));
        assertEquals(List.of("cleanup"), removed.disabled());
        assertFalse(ctx.store().loadJob("cleanup").orElseThrow().enabled());

        InitializationReport back = initialize(sendMail(Duration.ofMinutes(1)), cleanup());
        assertEquals(List.of("cleanup"), back.reenabled());
        assertTrue(ctx.store().loadJob("cleanup").orElseThrow().enabled());
        assertEquals(1, ctx.store().loadJob("cleanup").orElseThrow().version());
    }
}
