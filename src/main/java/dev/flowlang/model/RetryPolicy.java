package dev.flowlang.model;

/**
 * Retry configuration for task steps.
 */
public record RetryPolicy(
    int maxAttempts,
    long delayMillis,
    double backoff
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 1;
    public static final long DEFAULT_DELAY_MILLIS = 0L;
    public static final double DEFAULT_BACKOFF = 1.0;

    public static RetryPolicy none() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY_MILLIS, DEFAULT_BACKOFF);
    }

    /**
     * Wait before the given attempt (1-based). The first attempt never waits; attempt k waits
     * {@code delay * backoff^(k-2)}.
     */
    public long delayBefore(int attempt) {
        if (attempt <= 1 || delayMillis <= 0) {
            return 0L;
        }
        return Math.round(delayMillis * Math.pow(backoff, attempt - 2));
    }
}
