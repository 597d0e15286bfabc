package com.p14n.shadowsync.broker;

/**
 * Exponential backoff: the initial delay doubled per attempt and capped at
 * the maximum. There is no attempt limit.
 */
public record Backoff(long initialDelayMillis, long maxDelayMillis) {

    public Backoff {
        if (initialDelayMillis <= 0 || maxDelayMillis < initialDelayMillis) {
            throw new IllegalArgumentException("Backoff delays must be positive and max >= initial");
        }
    }

    /**
     * @param attempt zero-based attempt number
     * @return the delay before that attempt in milliseconds
     */
    public long delayFor(int attempt) {
        long delay = initialDelayMillis;
        for (int i = 0; i < attempt && delay < maxDelayMillis; i++) {
            delay <<= 1;
        }
        return Math.min(delay, maxDelayMillis);
    }
}
