package com.safee.jobs.lock;

/**
 * Shared key-value store offering one atomic "set if absent, expiring after ttl" operation.
 */
public interface LeaseStore {

    /**
     * Creates {@code key} with {@code value} unless it already exists.
     *
     * @return true iff this call created the key
     */
    boolean setIfAbsent(String key, String value, int ttlSeconds);
}
