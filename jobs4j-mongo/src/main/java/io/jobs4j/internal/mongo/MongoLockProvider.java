package io.jobs4j.internal.mongo;

import io.jobs4j.core.LockHandle;
import io.jobs4j.spi.LockProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Named TTL locks in {@code job_locks}, one document per key.
 *
 * <p>Acquisition is an upsert that only matches an expired lock. When the lock is held the
 * filter misses, the upsert tries to insert a second document with the same {@code _id} and
 * the resulting duplicate-key error means "held by someone else".
 */
public class MongoLockProvider implements LockProvider {
    private static final Logger log = LoggerFactory.getLogger(MongoLockProvider.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoLockProvider(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoLockProvider(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public LockHandle acquire(String key, String holder, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(holder, "holder must not be null");
        requirePositive(ttl);
        Instant now = clock.instant();
        Instant until = now.plus(ttl);

        Query expired = new Query(Criteria.where("_id").is(key).and("lockedUntil").lte(now));
        Update take = new Update()
                .set("token", holder)
                .set("lockedUntil", until)
                .set("lockedAt", now);
        try {
            mongoTemplate.upsert(expired, take, LockDocument.class);
        } catch (DuplicateKeyException e) {
            log.debug("Lock is held key={}", key);
            return null;
        }
        return new LockHandle(key, holder, until);
    }

    @Override
    public void release(LockHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        Query owned = new Query(Criteria.where("_id").is(handle.key()).and("token").is(handle.token()));
        if (mongoTemplate.remove(owned, LockDocument.class).getDeletedCount() == 0) {
            log.debug("Lock was already lost before release key={}", handle.key());
        }
    }

    @Override
    public boolean extend(LockHandle handle, Duration ttl) {
        Objects.requireNonNull(handle, "handle must not be null");
        requirePositive(ttl);
        Instant now = clock.instant();
        Query owned = new Query(
                Criteria.where("_id").is(handle.key())
                        .and("token").is(handle.token())
                        .and("lockedUntil").gt(now)
        );
        Update u = new Update().set("lockedUntil", now.plus(ttl));
        return mongoTemplate.updateFirst(owned, u, LockDocument.class).getModifiedCount() > 0;
    }

    private static void requirePositive(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }
    }
}
