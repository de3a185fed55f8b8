package com.safee.jobs.lock;

public class AcquireOptions {
    private final String key;
    private final int ttlSeconds;
    private final int maxRetries;
    private final long retryDelayMs;

    public AcquireOptions(String key, int ttlSeconds, int maxRetries, long retryDelayMs) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("lock key is required");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0, got: " + ttlSeconds);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must be >= 0, got: " + retryDelayMs);
        }
        this.key = key;
        this.ttlSeconds = ttlSeconds;
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
    }

    public String getKey() {
        return key;
    }

    public int getTtlSeconds() {
        return ttlSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    @Override
    public String toString() {
        return "AcquireOptions{key=" + key + ", ttlSeconds=" + ttlSeconds + ", maxRetries=" + maxRetries
                + ", retryDelayMs=" + retryDelayMs + "}";
    }
}
