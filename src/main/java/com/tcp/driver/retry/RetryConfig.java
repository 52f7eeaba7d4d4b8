package com.tcp.driver.retry;

/**
 * Configuration for {@link DefaultRetryPolicy}.
 *
 * @param maxAttempts       total number of runs, including the first
 * @param initialDelayMs    pause before the first retry; 0 retries immediately
 * @param backoffMultiplier factor applied to the pause after every retry (1.0 = fixed delay)
 * @param maxDelayMs        upper bound on the pause
 */
public record RetryConfig(int maxAttempts, long initialDelayMs, double backoffMultiplier, long maxDelayMs) {

    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must be >= 0");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("maxDelayMs cannot be less than initialDelayMs");
        }
    }

    /**
     * Default configuration: 10 attempts, no delay between them.
     */
    public static RetryConfig defaults() {
        return attempts(DEFAULT_MAX_ATTEMPTS);
    }

    public static RetryConfig attempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, 0, 1.0, 0);
    }

    public static RetryConfig fixed(int maxAttempts, long delayMs) {
        return new RetryConfig(maxAttempts, delayMs, 1.0, delayMs);
    }

    public static RetryConfig exponential(int maxAttempts, long initialDelayMs, long maxDelayMs) {
        return new RetryConfig(maxAttempts, initialDelayMs, 2.0, maxDelayMs);
    }

    /**
     * Returns the pause before retry number {@code retry} (1-based).
     */
    public long delayBeforeRetry(int retry) {
        if (initialDelayMs == 0) {
            return 0;
        }
        double delay = initialDelayMs * Math.pow(backoffMultiplier, retry - 1);
        return (long) Math.min(delay, maxDelayMs);
    }
}
