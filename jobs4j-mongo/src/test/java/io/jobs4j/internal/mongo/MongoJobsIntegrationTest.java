package io.jobs4j.internal.mongo;

import com.mongodb.client.MongoClients;
import io.jobs4j.JobDescriptor;
import io.jobs4j.JobHandler;
import io.jobs4j.config.JobsProperties;
import io.jobs4j.core.Backoff;
import io.jobs4j.core.EnqueueResult;
import io.jobs4j.core.JobExecution;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.JobsConfiguration;
import io.jobs4j.internal.JobsRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Two runtimes sharing one database, as two replicas of a service would.
 */
@Testcontainers(disabledWithoutDocker = true)
class MongoJobsIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private final List<JobsRuntime> runtimes = new ArrayList<>();

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "jobs4j_e2e");
        mongoTemplate.getDb().drop();
    }

    @AfterEach
    void tearDown() {
        runtimes.forEach(JobsRuntime::stop);
    }

    @Test
    void singletonSystemJobShouldNeverOverlapAcrossReplicas() throws Exception {
        OverlapTracker tracker = new OverlapTracker("sync-ledger", Duration.ofMillis(700));
        JobDescriptor<Map<String, Object>> descriptor = JobDescriptor.builder(tracker)
                .queue("system")
                .system("1 second")
                .singleRunningJobGlobally()
                .timeout(Duration.ofSeconds(5))
                .build();

        JobsRuntime a = runtime("replica-a", descriptor);
        JobsRuntime b = runtime("replica-b", descriptor);
        a.start();
        b.start();

        assertTrue(waitUntil(10, TimeUnit.SECONDS,
                () -> a.executions("sync-ledger", JobStatus.COMPLETED).size() >= 3));
        a.stop();
        b.stop();

        assertEquals(1, tracker.maxConcurrent.get());

        List<QueueItemDocument> items = mongoTemplate.findAll(QueueItemDocument.class);
        Set<String> dedupKeys = items.stream().map(QueueItemDocument::getDedupKey).collect(Collectors.toSet());
        assertEquals(items.size(), dedupKeys.size());
    }

    @Test
    void failedHandlerShouldBeRetriedUntilItSucceeds() throws Exception {
        OverlapTracker flaky = new OverlapTracker("flaky", Duration.ZERO);
        flaky.failures.set(1);
        JobDescriptor<Map<String, Object>> descriptor = JobDescriptor.builder(flaky)
                .queue("default")
                .backoff(Backoff.fixed(Duration.ofMillis(200)))
                .build();

        JobsRuntime jobs = runtime("replica-a", descriptor);
        jobs.start();
        EnqueueResult result = jobs.trigger("flaky", Map.of("id", "A1"));

        assertTrue(waitUntil(8, TimeUnit.SECONDS, () -> jobs.execution(result.itemId())
                .map(e -> e.status() == JobStatus.COMPLETED)
                .orElse(false)));

        JobExecution execution = jobs.execution(result.itemId()).orElseThrow();
        assertEquals(2, execution.attempts());
        assertEquals(2, flaky.calls.get());
    }

    private JobsRuntime runtime(String workerId, JobDescriptor<?> descriptor) {
        JobsProperties props = new JobsProperties();
        props.setPollInterval(Duration.ofMillis(100));
        props.setSchedulerTickInterval(Duration.ofMillis(200));
        props.setVisibilityTimeout(Duration.ofSeconds(5));
        props.setLockContentionDelay(Duration.ofMillis(300));

        JobsRuntime runtime = JobsRuntime.builder()
                .properties(props)
                .workerId(workerId)
                .configuration(JobsConfiguration.builder()
                        .queue(descriptor.queue())
                        .job(descriptor)
                        .build())
                .store(new MongoJobStore(mongoTemplate))
                .queue(new MongoJobQueue(mongoTemplate))
                .locks(new MongoLockProvider(mongoTemplate))
                .build();
        runtimes.add(runtime);
        return runtime;
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }

    static class OverlapTracker implements JobHandler<Map<String, Object>> {
        private final String name;
        private final Duration work;
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger maxConcurrent = new AtomicInteger();
        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger failures = new AtomicInteger();

        OverlapTracker(String name, Duration work) {
            this.name = name;
            this.work = work;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        @SuppressWarnings("unchecked")
        public Class<Map<String, Object>> dataClass() {
            return (Class<Map<String, Object>>) (Class<?>) Map.class;
        }

        @Override
        public void execute(Map<String, Object> data) throws Exception {
            calls.incrementAndGet();
            int now = running.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(work.toMillis());
                if (failures.getAndDecrement() > 0) {
                    throw new IllegalStateException("simulated failure");
                }
            } finally {
                running.decrementAndGet();
            }
        }
    }
}
