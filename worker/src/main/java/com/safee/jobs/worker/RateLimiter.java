package com.safee.jobs.worker;

import com.safee.jobs.lock.Sleeper;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * Sliding-window limiter: at most {@code maxPermits} acquisitions in any {@code windowMs}.
 */
public class RateLimiter {
    private final int maxPermits;
    private final long windowMs;
    private final LongSupplier millis;
    private final Sleeper sleeper;
    private final Deque<Long> granted = new ArrayDeque<>();

    public RateLimiter(int maxPermits, long windowMs) {
        this(maxPermits, windowMs, System::currentTimeMillis, Sleeper.threadSleep());
    }

    RateLimiter(int maxPermits, long windowMs, LongSupplier millis, Sleeper sleeper) {
        if (maxPermits <= 0 || windowMs <= 0) {
            throw new IllegalArgumentException("maxPermits and windowMs must be > 0");
        }
        this.maxPermits = maxPermits;
        this.windowMs = windowMs;
        this.millis = millis;
        this.sleeper = sleeper;
    }

    /** Blocks until a permit is free. */
    public void acquire() throws InterruptedException {
        while (true) {
            long wait;
            synchronized (this) {
                long now = millis.getAsLong();
                evict(now);
                if (granted.size() < maxPermits) {
                    granted.addLast(now);
                    return;
                }
                wait = granted.peekFirst() + windowMs - now;
            }
            sleeper.sleep(Math.max(1, wait));
        }
    }

    public synchronized boolean tryAcquire() {
        long now = millis.getAsLong();
        evict(now);
        if (granted.size() < maxPermits) {
            granted.addLast(now);
            return true;
        }
        return false;
    }

    private void evict(long now) {
        while (!granted.isEmpty() && granted.peekFirst() + windowMs <= now) {
            granted.removeFirst();
        }
    }
}
