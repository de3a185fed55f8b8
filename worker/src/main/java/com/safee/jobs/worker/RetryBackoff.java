package com.safee.jobs.worker;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter: {@code min(max, base * 2^(attempt-1))}, scaled by a random
 * factor in [0.8, 1.2).
 */
public class RetryBackoff {
    public static final long DEFAULT_BASE_MS = 5_000;
    public static final long DEFAULT_MAX_MS = 60_000;

    private final long baseMs;
    private final long maxMs;
    private final DoubleSupplier random;

    public RetryBackoff(long baseMs, long maxMs) {
        this(baseMs, maxMs, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryBackoff(long baseMs, long maxMs, DoubleSupplier random) {
        if (baseMs <= 0 || maxMs < baseMs) {
            throw new IllegalArgumentException("need 0 < baseMs <= maxMs, got " + baseMs + "/" + maxMs);
        }
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.random = random;
    }

    public static RetryBackoff defaults() {
        return new RetryBackoff(DEFAULT_BASE_MS, DEFAULT_MAX_MS);
    }

    /**
     * @param attempt attempts made so far, 1 after the first failure
     */
    public long delayMs(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long delay = Math.min(maxMs, baseMs << exponent);
        double jitter = 0.8 + random.getAsDouble() * 0.4;
        return (long) (delay * jitter);
    }
}
