package io.jobs4j.spi;

import io.jobs4j.core.LockHandle;

import java.time.Duration;

/**
 * Named mutual-exclusion lock with TTL, atomic across all worker processes.
 *
 * <p>A lock is never held past its TTL without {@link #extend(LockHandle, Duration)};
 * expired locks can be taken by anyone, which is what recovers locks of crashed holders.
 */
public interface LockProvider {

    /**
     * Non-blocking acquisition.
     *
     * @param holder token identifying the holder; release and extend only succeed with it
     * @return the handle, or null when the lock is held by someone else
     */
    LockHandle acquire(String key, String holder, Duration ttl);

    /**
     * Release if still held by the handle's token. Releasing a lost lock is a no-op.
     */
    void release(LockHandle handle);

    /**
     * Set the expiry to now + {@code ttl} if the lock is still held by the handle's token
     * and has not expired.
     *
     * @return false if the lock was lost
     */
    boolean extend(LockHandle handle, Duration ttl);
}
