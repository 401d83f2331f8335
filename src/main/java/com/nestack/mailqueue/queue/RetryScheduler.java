package com.nestack.mailqueue.queue;

/**
 * Retry scheduler.
 * <p>Computes the default wait before a failed email is retried, used when the caller gives no explicit delay.
 * <p>Wait time grows linearly with the attempt count:
 * <pre>
 *     wait_ms = BASE_DELAY_MS * attempts
 * </pre>
 * <p>With the default 5 second base and 3 attempts the waits are 5s then 10s before the email is dropped.
 */
public class RetryScheduler {

    public static final long DEFAULT_BASE_DELAY_MS = 5000L;

    private final long baseDelayMs;

    /**
     * Constructs a new RetryScheduler with the default base delay.
     */
    public RetryScheduler() {
        this(DEFAULT_BASE_DELAY_MS);
    }

    /**
     * Constructs a new RetryScheduler.
     *
     * @param baseDelayMs Wait before the first retry in milliseconds.
     */
    public RetryScheduler(long baseDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
    }

    /**
     * Get the wait before the next retry.
     *
     * @param attempts Attempts made so far, 1 based. Values below 1 are treated as 1.
     * @return Wait time in milliseconds.
     */
    public long getRetryDelayMs(int attempts) {
        int factor = Math.max(1, attempts);
        if (baseDelayMs > Long.MAX_VALUE / factor) {
            return Long.MAX_VALUE;
        }
        return baseDelayMs * factor;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }
}
