package com.safee.jobs.lock;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/** LeaseStore on a hand-driven clock, for expiry tests. */
class InMemoryLeaseStore implements LeaseStore {
    final AtomicLong nowMillis = new AtomicLong();
    private final Map<String, Long> expiries = new HashMap<>();
    final Map<String, String> values = new HashMap<>();

    @Override
    public synchronized boolean setIfAbsent(String key, String value, int ttlSeconds) {
        Long expiry = expiries.get(key);
        if (expiry != null && expiry > nowMillis.get()) {
            return false;
        }
        expiries.put(key, nowMillis.get() + ttlSeconds * 1000L);
        values.put(key, value);
        return true;
    }

    void advanceSeconds(long seconds) {
        nowMillis.addAndGet(seconds * 1000L);
    }
}
