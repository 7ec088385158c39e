package io.jobs4j.internal.memory;

import io.jobs4j.core.EnqueueOptions;
import io.jobs4j.core.EnqueueResult;
import io.jobs4j.core.JobPayload;
import io.jobs4j.core.QueueItem;
import io.jobs4j.core.QueueItemState;
import io.jobs4j.core.StalledItem;
import io.jobs4j.spi.JobQueue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local {@link JobQueue}. Every operation is atomic under the instance monitor.
 * <p>
 * Expired dedup reservations and items that finished longer than the retention ago are pruned on enqueue.
 */
public class InMemoryJobQueue implements JobQueue {

    public static final Duration DEFAULT_FINISHED_RETENTION = Duration.ofHours(24);

    private final Clock clock;
    private final Duration finishedRetention;
    private final Map<String, QueueItem> items = new LinkedHashMap<>();
    private final Map<String, DedupReservation> dedupKeys = new LinkedHashMap<>();
    private final Map<String, Instant> finishedAt = new LinkedHashMap<>();

    private record DedupReservation(String itemId, Instant expiresAt) {
    }

    public InMemoryJobQueue() {
        this(Clock.systemUTC());
    }

    public InMemoryJobQueue(Clock clock) {
        this(clock, DEFAULT_FINISHED_RETENTION);
    }

    public InMemoryJobQueue(Clock clock, Duration finishedRetention) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.finishedRetention = Objects.requireNonNull(finishedRetention, "finishedRetention must not be null");
        if (finishedRetention.isNegative()) {
            throw new IllegalArgumentException("finishedRetention must not be negative");
        }
    }

    @Override
    public synchronized EnqueueResult enqueue(String queue, JobPayload payload, EnqueueOptions options) {
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Instant now = clock.instant();
        prune(now);

        String dedupKey = options.dedupKey();
        if (dedupKey != null) {
            DedupReservation reservation = dedupKeys.get(dedupKey);
            if (reservation != null && reservation.expiresAt().isAfter(now)) {
                return EnqueueResult.duplicateOf(reservation.itemId());
            }
        }

        String id = UUID.randomUUID().toString();
        items.put(id, new QueueItem(
                id,
                queue,
                payload.jobName(),
                payload.version(),
                payload.scheduledAt(),
                dedupKey,
                payload.data(),
                QueueItemState.WAITING,
                now.plus(options.delayOrZero()),
                0,
                options.maxAttempts(),
                0,
                null,
                null,
                null
        ));
        if (dedupKey != null) {
            dedupKeys.put(dedupKey, new DedupReservation(id, now.plus(options.dedupWindow())));
        }
        return EnqueueResult.created(id);
    }

    @Override
    public synchronized List<QueueItem> claim(String queue, int max, Duration visibility, String workerId) {
        Instant now = clock.instant();
        List<QueueItem> due = new ArrayList<>();
        for (QueueItem item : items.values()) {
            if (item.queue().equals(queue)
                    && item.state() == QueueItemState.WAITING
                    && !item.runAt().isAfter(now)) {
                due.add(item);
            }
        }
        due.sort(Comparator.comparing(QueueItem::runAt));

        List<QueueItem> claimed = new ArrayList<>();
        for (QueueItem item : due) {
            if (claimed.size() >= max) {
                break;
            }
            QueueItem active = copy(item, QueueItemState.ACTIVE, item.runAt(), item.attempts() + 1,
                    item.stalledCount(), workerId, now.plus(visibility), item.lastError());
            items.put(item.id(), active);
            claimed.add(active);
        }
        return claimed;
    }

    @Override
    public synchronized boolean extend(String itemId, String workerId, Duration visibility) {
        QueueItem item = heldBy(itemId, workerId);
        if (item == null) {
            return false;
        }
        items.put(itemId, copy(item, item.state(), item.runAt(), item.attempts(), item.stalledCount(),
                workerId, clock.instant().plus(visibility), item.lastError()));
        return true;
    }

    @Override
    public synchronized boolean complete(String itemId, String workerId, boolean remove) {
        QueueItem item = heldBy(itemId, workerId);
        if (item == null) {
            return false;
        }
        if (remove) {
            items.remove(itemId);
        } else {
            items.put(itemId, copy(item, QueueItemState.COMPLETED, item.runAt(), item.attempts(),
                    item.stalledCount(), null, null, null));
            finishedAt.put(itemId, clock.instant());
        }
        return true;
    }

    @Override
    public synchronized boolean retry(String itemId, String workerId, Instant runAt, String error) {
        QueueItem item = heldBy(itemId, workerId);
        if (item == null) {
            return false;
        }
        items.put(itemId, copy(item, QueueItemState.WAITING, runAt, item.attempts(), item.stalledCount(),
                null, null, error));
        return true;
    }

    @Override
    public synchronized boolean postpone(String itemId, String workerId, Instant runAt) {
        QueueItem item = heldBy(itemId, workerId);
        if (item == null) {
            return false;
        }
        items.put(itemId, copy(item, QueueItemState.WAITING, runAt, Math.max(0, item.attempts() - 1),
                item.stalledCount(), null, null, item.lastError()));
        return true;
    }

    @Override
    public synchronized boolean fail(String itemId, String workerId, String error) {
        QueueItem item = heldBy(itemId, workerId);
        if (item == null) {
            return false;
        }
        items.put(itemId, copy(item, QueueItemState.FAILED, item.runAt(), item.attempts(), item.stalledCount(),
                null, null, error));
        finishedAt.put(itemId, clock.instant());
        return true;
    }

    @Override
    public synchronized List<StalledItem> recoverStalled(String queue, int maxStalledCount) {
        Instant now = clock.instant();
        List<StalledItem> recovered = new ArrayList<>();
        for (QueueItem item : List.copyOf(items.values())) {
            if (!item.queue().equals(queue)
                    || item.state() != QueueItemState.ACTIVE
                    || item.lockUntil() == null
                    || item.lockUntil().isAfter(now)) {
                continue;
            }
            int stalledCount = item.stalledCount() + 1;
            boolean terminal = stalledCount > maxStalledCount || item.attemptsExhausted();
            QueueItem next = terminal
                    ? copy(item, QueueItemState.FAILED, item.runAt(), item.attempts(), stalledCount, null, null,
                    "job stalled more than allowable limit")
                    : copy(item, QueueItemState.WAITING, now, item.attempts(), stalledCount, null, null,
                    "job stalled");
            items.put(item.id(), next);
            if (terminal) {
                finishedAt.put(item.id(), now);
            }
            recovered.add(new StalledItem(next, terminal));
        }
        return recovered;
    }

    @Override
    public synchronized Optional<QueueItem> find(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    @Override
    public synchronized long count(String queue, QueueItemState state) {
        return items.values().stream()
                .filter(i -> i.queue().equals(queue) && (state == null || i.state() == state))
                .count();
    }

    synchronized int size() {
        return items.size();
    }

    synchronized int reservationCount() {
        return dedupKeys.size();
    }

    private void prune(Instant now) {
        dedupKeys.values().removeIf(r -> !r.expiresAt().isAfter(now));
        Instant cutoff = now.minus(finishedRetention);
        Iterator<Map.Entry<String, Instant>> it = finishedAt.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Instant> entry = it.next();
            if (entry.getValue().isAfter(cutoff)) {
                continue;
            }
            items.remove(entry.getKey());
            it.remove();
        }
    }

    private QueueItem heldBy(String itemId, String workerId) {
        QueueItem item = items.get(itemId);
        if (item == null || item.state() != QueueItemState.ACTIVE || !Objects.equals(item.lockedBy(), workerId)) {
            return null;
        }
        return item;
    }

    private static QueueItem copy(QueueItem item,
                                  QueueItemState state,
                                  Instant runAt,
                                  int attempts,
                                  int stalledCount,
                                  String lockedBy,
                                  Instant lockUntil,
                                  String lastError) {
        return new QueueItem(item.id(), item.queue(), item.jobName(), item.version(), item.scheduledAt(),
                item.dedupKey(), item.data(), state, runAt, attempts, item.maxAttempts(), stalledCount,
                lockedBy, lockUntil, lastError);
    }
}
