package io.jobs4j.internal.memory;

import io.jobs4j.core.LockHandle;
import io.jobs4j.spi.LockProvider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Process-local {@link LockProvider}; only excludes holders within the same JVM.
 */
public class InMemoryLockProvider implements LockProvider {

    private final Clock clock;
    private final Map<String, LockHandle> locks = new HashMap<>();

    public InMemoryLockProvider() {
        this(Clock.systemUTC());
    }

    public InMemoryLockProvider(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized LockHandle acquire(String key, String holder, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(holder, "holder must not be null");
        requirePositive(ttl);
        Instant now = clock.instant();

        LockHandle current = locks.get(key);
        if (current != null && current.lockedUntil().isAfter(now)) {
            return null;
        }
        LockHandle handle = new LockHandle(key, holder, now.plus(ttl));
        locks.put(key, handle);
        return handle;
    }

    @Override
    public synchronized void release(LockHandle handle) {
        LockHandle current = locks.get(handle.key());
        if (current != null && current.token().equals(handle.token())) {
            locks.remove(handle.key());
        }
    }

    @Override
    public synchronized boolean extend(LockHandle handle, Duration ttl) {
        requirePositive(ttl);
        Instant now = clock.instant();
        LockHandle current = locks.get(handle.key());
        if (current == null || !current.token().equals(handle.token()) || !current.lockedUntil().isAfter(now)) {
            return false;
        }
        locks.put(handle.key(), new LockHandle(handle.key(), handle.token(), now.plus(ttl)));
        return true;
    }

    private static void requirePositive(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }
    }
}
