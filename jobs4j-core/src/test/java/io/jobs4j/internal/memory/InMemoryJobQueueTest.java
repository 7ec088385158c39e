package io.jobs4j.internal.memory;

import io.jobs4j.core.EnqueueOptions;
import io.jobs4j.core.EnqueueResult;
import io.jobs4j.core.JobPayload;
import io.jobs4j.core.QueueItem;
import io.jobs4j.core.QueueItemState;
import io.jobs4j.core.StalledItem;
import io.jobs4j.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobQueueTest {

    private static final Duration VISIBILITY = Duration.ofSeconds(30);

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final InMemoryJobQueue queue = new InMemoryJobQueue(clock);

    private EnqueueResult enqueue(String dedupKey, int maxAttempts) {
        JobPayload payload = new JobPayload("send-mail", 1, clock.instant(), null);
        return queue.enqueue("mail", payload, new EnqueueOptions(dedupKey, null, Duration.ofHours(1), maxAttempts));
    }

    @Test
    void dedupKeyShouldExpireAfterWindow() {
        EnqueueResult first = enqueue("k", 3);
        assertTrue(enqueue("k", 3).deduplicated());

        clock.advance(Duration.ofHours(1));

        EnqueueResult later = enqueue("k", 3);
        assertFalse(later.deduplicated());
        assertFalse(first.itemId().equals(later.itemId()));
    }

    @Test
    void claimedItemShouldBeInvisibleToOtherWorkers() {
        enqueue(null, 3);

        List<QueueItem> a = queue.claim("mail", 5, VISIBILITY, "worker-a");
        List<QueueItem> b = queue.claim("mail", 5, VISIBILITY, "worker-b");

        assertEquals(1, a.size());
        assertEquals(1, a.get(0).attempts());
        assertEquals(QueueItemState.ACTIVE, a.get(0).state());
        assertTrue(b.isEmpty());
    }

    @Test
    void writeBacksShouldBeGuardedByHolder() {
        String id = enqueue(null, 3).itemId();
        queue.claim("mail", 1, VISIBILITY, "worker-a");

        assertFalse(queue.complete(id, "worker-b", false));
        assertTrue(queue.complete(id, "worker-a", false));
        assertEquals(QueueItemState.COMPLETED, queue.find(id).orElseThrow().state());
    }

    @Test
    void postponeShouldNotConsumeAttempt() {
        String id = enqueue(null, 3).itemId();
        queue.claim("mail", 1, VISIBILITY, "worker-a");

        queue.postpone(id, "worker-a", clock.instant().plusSeconds(5));

        QueueItem item = queue.find(id).orElseThrow();
        assertEquals(QueueItemState.WAITING, item.state());
        assertEquals(0, item.attempts());
        assertTrue(queue.claim("mail", 1, VISIBILITY, "worker-a").isEmpty());
    }

    @Test
    void removeOnCompleteShouldDeleteItem() {
        String id = enqueue(null, 3).itemId();
        queue.claim("mail", 1, VISIBILITY, "worker-a");

        queue.complete(id, "worker-a", true);

        assertTrue(queue.find(id).isEmpty());
    }

    @Test
    void stalledItemShouldBeRedeliveredThenFailed() {
        String id = enqueue(null, 5).itemId();
        queue.claim("mail", 1, VISIBILITY, "worker-a");

        assertTrue(queue.recoverStalled("mail", 1).isEmpty());
        clock.advance(VISIBILITY);

        List<StalledItem> first = queue.recoverStalled("mail", 1);
        assertEquals(1, first.size());
        assertFalse(first.get(0).terminal());
        assertEquals(QueueItemState.WAITING, first.get(0).item().state());
        assertFalse(queue.extend(id, "worker-a", VISIBILITY));

        queue.claim("mail", 1, VISIBILITY, "worker-b");
        clock.advance(VISIBILITY);

        List<StalledItem> second = queue.recoverStalled("mail", 1);
        assertTrue(second.get(0).terminal());
        assertEquals(QueueItemState.FAILED, queue.find(id).orElseThrow().state());
    }

    @Test
    void stallShouldFailWhenAttemptsAreExhausted() {
        enqueue(null, 1);
        queue.claim("mail", 1, VISIBILITY, "worker-a");
        clock.advance(VISIBILITY);

        List<StalledItem> stalled = queue.recoverStalled("mail", 5);

        assertTrue(stalled.get(0).terminal());
    }

    @Test
    void enqueueShouldDropExpiredReservations() {
        for (int i = 0; i < 10; i++) {
            enqueue("k-" + i, 3);
        }
        assertEquals(10, queue.reservationCount());

        clock.advance(Duration.ofHours(1));
        enqueue("k-next", 3);

        assertEquals(1, queue.reservationCount());
    }

    @Test
    void finishedItemsShouldBeDroppedAfterRetention() {
        InMemoryJobQueue bounded = new InMemoryJobQueue(clock, Duration.ofHours(2));
        JobPayload payload = new JobPayload("send-mail", 1, clock.instant(), null);
        EnqueueOptions options = new EnqueueOptions(null, null, Duration.ofHours(1), 1);
        String done = bounded.enqueue("mail", payload, options).itemId();
        String failed = bounded.enqueue("mail", payload, options).itemId();
        String waiting = bounded.enqueue("mail", payload, options).itemId();
        bounded.claim("mail", 2, VISIBILITY, "worker-a");
        bounded.complete(done, "worker-a", false);
        bounded.fail(failed, "worker-a", "boom");

        clock.advance(Duration.ofHours(1));
        bounded.enqueue("mail", payload, options);
        assertEquals(QueueItemState.COMPLETED, bounded.find(done).orElseThrow().state());

        clock.advance(Duration.ofHours(1));
        bounded.enqueue("mail", payload, options);

        assertTrue(bounded.find(done).isEmpty());
        assertTrue(bounded.find(failed).isEmpty());
        assertEquals(QueueItemState.WAITING, bounded.find(waiting).orElseThrow().state());
        assertEquals(3, bounded.size());
    }
}
