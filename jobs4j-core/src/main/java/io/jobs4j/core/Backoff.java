package io.jobs4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry delay policy applied after a handler failure.
 *
 * <p>attempt starts from 1 (first failure). EXPONENTIAL doubles the base delay per attempt;
 * both types are capped at {@code maxDelay}.
 */
public record Backoff(Type type, Duration delay, Duration maxDelay) {

    public enum Type {
        FIXED,
        EXPONENTIAL
    }

    public Backoff {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(delay, "delay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        if (maxDelay.compareTo(delay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than delay");
        }
    }

    /**
     * Default: 10s, 20s, 40s, 80s, 160s... capped at 10 minutes.
     */
    public static Backoff defaults() {
        return exponential(Duration.ofSeconds(10));
    }

    public static Backoff fixed(Duration delay) {
        return new Backoff(Type.FIXED, delay, delay);
    }

    public static Backoff exponential(Duration delay) {
        Duration cap = Duration.ofMinutes(10);
        return new Backoff(Type.EXPONENTIAL, delay, delay.compareTo(cap) > 0 ? delay : cap);
    }

    public Duration delayFor(int attempt) {
        if (type == Type.FIXED) {
            return delay;
        }
        int exp = Math.max(0, attempt - 1);
        exp = Math.min(exp, 20); // avoid overflow
        long ms = Math.min(delay.toMillis() * (1L << exp), maxDelay.toMillis());
        return Duration.ofMillis(ms);
    }
}
