package io.jobs4j.service;

import io.jobs4j.core.Backoff;
import io.jobs4j.core.JobExecution;
import io.jobs4j.core.JobOptions;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.QueueItem;
import io.jobs4j.core.QueueItemState;
import io.jobs4j.internal.memory.InMemoryJobStore;
import io.jobs4j.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobExecutionServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private InMemoryJobStore store;
    private JobExecutionService executions;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryJobStore(clock);
        executions = new JobExecutionService(store, clock);
    }

    private static QueueItem claimed(String id, int attempts) {
        return new QueueItem(id, "mail", "send-mail", 1, T0, null, null, QueueItemState.ACTIVE,
                T0, attempts, 3, 0, "worker-1", T0.plusSeconds(30), null);
    }

    @Test
    void startThenSuccessShouldComplete() {
        executions.recordPending("e1", "send-mail", "mail", 1, null);
        executions.recordStart(claimed("e1", 1), "worker-1");
        clock.advance(Duration.ofSeconds(2));
        executions.recordSuccess("e1");

        JobExecution e = executions.find("e1").orElseThrow();
        assertEquals(JobStatus.COMPLETED, e.status());
        assertEquals("worker-1", e.workerId());
        assertNotNull(e.startedAt());
        assertFalse(e.finishedAt().isBefore(e.startedAt()));
        assertNull(e.error());
    }

    @Test
    void recordPendingShouldNotOverwriteExistingRecord() {
        executions.recordPending("e1", "send-mail", "mail", 1, "k");
        executions.recordStart(claimed("e1", 1), "worker-1");

        JobExecution again = executions.recordPending("e1", "send-mail", "mail", 1, "k");

        assertEquals(JobStatus.RUNNING, again.status());
    }

    @Test
    void recordStartShouldCreateMissingRecord() {
        JobExecution running = executions.recordStart(claimed("e2", 1), "worker-1");

        assertEquals(JobStatus.RUNNING, running.status());
        assertTrue(executions.find("e2").isPresent());
    }

    @Test
    void nonTerminalFailureShouldReturnToPendingKeepingError() {
        executions.recordStart(claimed("e1", 1), "worker-1");
        executions.recordFailure("e1", "IllegalStateException: boom", false);

        JobExecution e = executions.find("e1").orElseThrow();
        assertEquals(JobStatus.PENDING, e.status());
        assertEquals("IllegalStateException: boom", e.error());
        assertNull(e.finishedAt());
    }

    @Test
    void terminalFailureShouldFinish() {
        executions.recordStart(claimed("e1", 3), "worker-1");
        executions.recordFailure("e1", "boom", true);

        JobExecution e = executions.find("e1").orElseThrow();
        assertEquals(JobStatus.FAILED, e.status());
        assertEquals(3, e.attempts());
        assertNotNull(e.finishedAt());
    }

    @Test
    void discardShouldFailWithoutStarting() {
        executions.recordPending("e1", "send-mail", "mail", 1, null);
        clock.advance(Duration.ofSeconds(1));

        executions.recordDiscarded(claimed("e1", 1), "stale job version 1 < 2");

        JobExecution e = executions.find("e1").orElseThrow();
        assertEquals(JobStatus.FAILED, e.status());
        assertEquals("stale job version 1 < 2", e.error());
        assertNull(e.startedAt());
        assertEquals(T0.plusSeconds(1), e.finishedAt());
    }

    @Test
    void stallShouldMarkStalledThenFailWhenTerminal() {
        executions.recordStart(claimed("e1", 1), "worker-1");

        executions.recordStalled("e1", false);
        assertEquals(JobStatus.STALLED, executions.find("e1").orElseThrow().status());

        executions.recordStalled("e1", true);
        assertEquals(JobStatus.FAILED, executions.find("e1").orElseThrow().status());
    }

    @Test
    void nextRetryAtShouldFollowBackoff() {
        JobOptions options = JobOptions.defaults().withBackoff(Backoff.exponential(Duration.ofSeconds(5)));

        assertEquals(T0.plusSeconds(5), executions.nextRetryAt(options, 1));
        assertEquals(T0.plusSeconds(20), executions.nextRetryAt(options, 3));
    }

    @Test
    void listExecutionsShouldFilterByStatusNewestFirst() {
        executions.recordPending("e1", "send-mail", "mail", 1, null);
        clock.advance(Duration.ofSeconds(1));
        executions.recordPending("e2", "send-mail", "mail", 1, null);
        clock.advance(Duration.ofSeconds(1));
        executions.recordPending("e3", "other", "mail", 1, null);
        executions.recordStart(claimed("e1", 1), "worker-1");

        assertEquals(2, executions.listExecutions("send-mail", null).size());
        assertEquals("e2", executions.listExecutions("send-mail", null).get(0).id());
        assertEquals(1, executions.listExecutions("send-mail", JobStatus.PENDING).size());
    }
}
