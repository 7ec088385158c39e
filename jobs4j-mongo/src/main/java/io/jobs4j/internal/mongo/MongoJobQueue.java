package io.jobs4j.internal.mongo;

import io.jobs4j.core.EnqueueOptions;
import io.jobs4j.core.EnqueueResult;
import io.jobs4j.core.JobPayload;
import io.jobs4j.core.QueueItem;
import io.jobs4j.core.QueueItemState;
import io.jobs4j.core.StalledItem;
import io.jobs4j.spi.JobQueue;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB-backed queue ({@code job_queue_items}) with dedup-key reservations ({@code job_dedup_keys}).
 *
 * <p>Claims use {@code findAndModify}, one document per call, so two workers never get the same
 * item. Write-backs match on {@code lockedBy} so a worker that lost its item to stall recovery
 * cannot overwrite the new holder.
 */
public class MongoJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(MongoJobQueue.class);

    private static final int STALL_SCAN_LIMIT = 100;

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoJobQueue(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoJobQueue(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public EnqueueResult enqueue(String queue, JobPayload payload, EnqueueOptions options) {
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Instant now = clock.instant();
        String itemId = new ObjectId().toHexString();

        if (options.dedupKey() != null) {
            String holder = reserveDedupKey(options.dedupKey(), itemId, now.plus(options.dedupWindow()), now);
            if (!holder.equals(itemId)) {
                return EnqueueResult.duplicateOf(holder);
            }
        }

        QueueItemDocument doc = new QueueItemDocument();
        doc.setId(itemId);
        doc.setQueue(queue);
        doc.setJobName(payload.jobName());
        doc.setVersion(payload.version());
        doc.setScheduledAt(payload.scheduledAt());
        doc.setDedupKey(options.dedupKey());
        doc.setData(payload.data());
        doc.setState(QueueItemState.WAITING);
        doc.setRunAt(now.plus(options.delayOrZero()));
        doc.setAttempts(0);
        doc.setMaxAttempts(options.maxAttempts());
        doc.setStalledCount(0);
        try {
            mongoTemplate.insert(doc);
        } catch (RuntimeException e) {
            if (options.dedupKey() != null) {
                releaseDedupKey(options.dedupKey(), itemId);
            }
            throw e;
        }
        return EnqueueResult.created(itemId);
    }

    // only drops the reservation while it still points at the item that failed to insert
    private void releaseDedupKey(String key, String itemId) {
        try {
            Query reserved = new Query(Criteria.where("_id").is(key).and("itemId").is(itemId));
            mongoTemplate.remove(reserved, DedupKeyDocument.class);
        } catch (RuntimeException cleanupEx) {
            log.error("jobs dedup reservation cleanup failed key={} itemId={} msg={}", key, itemId, cleanupEx.getMessage(), cleanupEx);
        }
    }

    /**
     * @return the id of the item holding the key after this call; {@code itemId} if it was reserved for it
     */
    private String reserveDedupKey(String key, String itemId, Instant expiresAt, Instant now) {
        DedupKeyDocument reservation = new DedupKeyDocument();
        reservation.setKey(key);
        reservation.setItemId(itemId);
        reservation.setExpiresAt(expiresAt);
        try {
            mongoTemplate.insert(reservation);
            return itemId;
        } catch (DuplicateKeyException e) {
            log.debug("Dedup key already reserved key={}", key);
        }

        // take over an expired reservation; the TTL index may not have removed it yet
        Query expired = new Query(Criteria.where("_id").is(key).and("expiresAt").lte(now));
        Update takeOver = new Update()
                .set("itemId", itemId)
                .set("expiresAt", expiresAt);
        if (mongoTemplate.updateFirst(expired, takeOver, DedupKeyDocument.class).getModifiedCount() > 0) {
            return itemId;
        }

        DedupKeyDocument current = mongoTemplate.findById(key, DedupKeyDocument.class);
        if (current == null) {
            // removed by the TTL monitor between our reads; reserve again
            return reserveDedupKey(key, itemId, expiresAt, now);
        }
        return current.getItemId();
    }

    @Override
    public List<QueueItem> claim(String queue, int max, Duration visibility, String workerId) {
        Objects.requireNonNull(visibility, "visibility must not be null");
        if (max <= 0) {
            return List.of();
        }
        if (isBlank(workerId)) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Instant now = clock.instant();
        Query due = new Query(
                Criteria.where("queue").is(queue)
                        .and("state").is(QueueItemState.WAITING)
                        .and("runAt").lte(now)
        );
        due.with(Sort.by(Sort.Order.asc("runAt")));

        Update claim = new Update()
                .set("state", QueueItemState.ACTIVE)
                .set("lockedBy", workerId)
                .set("lockUntil", now.plus(visibility))
                .inc("attempts", 1);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<QueueItem> claimed = new ArrayList<>(Math.min(max, 64));
        for (int i = 0; i < max; i++) {
            QueueItemDocument doc = mongoTemplate.findAndModify(due, claim, options, QueueItemDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(toItem(doc));
        }
        return claimed;
    }

    @Override
    public boolean extend(String itemId, String workerId, Duration visibility) {
        Update u = new Update().set("lockUntil", clock.instant().plus(visibility));
        return mongoTemplate.updateFirst(heldBy(itemId, workerId), u, QueueItemDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean complete(String itemId, String workerId, boolean remove) {
        if (remove) {
            return mongoTemplate.remove(heldBy(itemId, workerId), QueueItemDocument.class).getDeletedCount() > 0;
        }
        Update u = release(new Update().set("state", QueueItemState.COMPLETED)).unset("lastError");
        return mongoTemplate.updateFirst(heldBy(itemId, workerId), u, QueueItemDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean retry(String itemId, String workerId, Instant runAt, String error) {
        Update u = release(new Update()
                .set("state", QueueItemState.WAITING)
                .set("runAt", runAt)
                .set("lastError", error));
        return mongoTemplate.updateFirst(heldBy(itemId, workerId), u, QueueItemDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean postpone(String itemId, String workerId, Instant runAt) {
        Update u = release(new Update()
                .set("state", QueueItemState.WAITING)
                .set("runAt", runAt)
                .inc("attempts", -1));
        return mongoTemplate.updateFirst(heldBy(itemId, workerId), u, QueueItemDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean fail(String itemId, String workerId, String error) {
        Update u = release(new Update()
                .set("state", QueueItemState.FAILED)
                .set("lastError", error));
        return mongoTemplate.updateFirst(heldBy(itemId, workerId), u, QueueItemDocument.class).getModifiedCount() > 0;
    }

    @Override
    public List<StalledItem> recoverStalled(String queue, int maxStalledCount) {
        Instant now = clock.instant();
        Query expired = new Query(
                Criteria.where("queue").is(queue)
                        .and("state").is(QueueItemState.ACTIVE)
                        .and("lockUntil").lte(now)
        ).limit(STALL_SCAN_LIMIT);

        List<StalledItem> recovered = new ArrayList<>();
        for (QueueItemDocument doc : mongoTemplate.find(expired, QueueItemDocument.class)) {
            int stalledCount = doc.getStalledCount() + 1;
            boolean terminal = stalledCount > maxStalledCount || doc.getAttempts() >= doc.getMaxAttempts();

            // match the exact lease we observed so only one sweeper recovers it
            Query lease = new Query(
                    Criteria.where("_id").is(doc.getId())
                            .and("state").is(QueueItemState.ACTIVE)
                            .and("lockedBy").is(doc.getLockedBy())
                            .and("lockUntil").is(doc.getLockUntil())
            );
            Update u = release(new Update().set("stalledCount", stalledCount));
            if (terminal) {
                u.set("state", QueueItemState.FAILED).set("lastError", "job stalled more than allowable limit");
            } else {
                u.set("state", QueueItemState.WAITING).set("runAt", now).set("lastError", "job stalled");
            }

            QueueItemDocument updated = mongoTemplate.findAndModify(lease, u,
                    FindAndModifyOptions.options().returnNew(true), QueueItemDocument.class);
            if (updated != null) {
                recovered.add(new StalledItem(toItem(updated), terminal));
            }
        }
        return recovered;
    }

    @Override
    public Optional<QueueItem> find(String itemId) {
        return Optional.ofNullable(mongoTemplate.findById(itemId, QueueItemDocument.class))
                .map(MongoJobQueue::toItem);
    }

    @Override
    public long count(String queue, QueueItemState state) {
        Criteria c = Criteria.where("queue").is(queue);
        if (state != null) {
            c = c.and("state").is(state);
        }
        return mongoTemplate.count(new Query(c), QueueItemDocument.class);
    }

    private static Query heldBy(String itemId, String workerId) {
        Objects.requireNonNull(itemId, "itemId must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        return new Query(
                Criteria.where("_id").is(itemId)
                        .and("state").is(QueueItemState.ACTIVE)
                        .and("lockedBy").is(workerId)
        );
    }

    private static Update release(Update u) {
        return u.unset("lockedBy").unset("lockUntil");
    }

    private static QueueItem toItem(QueueItemDocument doc) {
        return new QueueItem(
                doc.getId(),
                doc.getQueue(),
                doc.getJobName(),
                doc.getVersion(),
                doc.getScheduledAt(),
                doc.getDedupKey(),
                doc.getData(),
                doc.getState(),
                doc.getRunAt(),
                doc.getAttempts(),
                doc.getMaxAttempts(),
                doc.getStalledCount(),
                doc.getLockedBy(),
                doc.getLockUntil(),
                doc.getLastError()
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
