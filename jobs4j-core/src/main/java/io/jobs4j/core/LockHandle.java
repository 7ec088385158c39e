package io.jobs4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Proof of a held lock. Release and extend only take effect while {@code token}
 * is still the stored holder.
 */
public record LockHandle(String key, String token, Instant lockedUntil) {

    public LockHandle {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(lockedUntil, "lockedUntil must not be null");
    }
}
