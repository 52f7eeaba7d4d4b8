package com.tcp.driver.retry;

import com.tcp.driver.core.SendAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Retries any {@link RuntimeException} up to {@link RetryConfig#maxAttempts()} runs in
 * total, sleeping between runs as configured. The last failure is rethrown unchanged.
 *
 * <p>An interrupted thread gets no further attempts: the last failure is rethrown with
 * the interrupt flag set. A {@link SendAbortedException} is never retried.</p>
 */
public class DefaultRetryPolicy implements RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(DefaultRetryPolicy.class);

    private final RetryConfig config;

    public DefaultRetryPolicy() {
        this(RetryConfig.defaults());
    }

    public DefaultRetryPolicy(int maxAttempts) {
        this(RetryConfig.attempts(maxAttempts));
    }

    public DefaultRetryPolicy(RetryConfig config) {
        this.config = config;
    }

    public RetryConfig getConfig() {
        return config;
    }

    @Override
    public <T> T withRetry(Supplier<T> operation) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    log.debug("Not retrying after attempt {}: {}", attempt, e.getMessage());
                    throw e;
                }
                if (attempt >= config.maxAttempts()) {
                    log.warn("Giving up after {} attempts: {}", attempt, e.getMessage());
                    throw e;
                }
                long delay = config.delayBeforeRetry(attempt);
                log.debug("Attempt {}/{} failed ({}), retrying in {}ms",
                        attempt, config.maxAttempts(), e.getMessage(), delay);
                if (delay > 0 && !sleep(delay)) {
                    throw e;
                }
            }
        }
    }

    private static boolean isRetryable(RuntimeException e) {
        return !(e instanceof SendAbortedException) && !Thread.currentThread().isInterrupted();
    }

    private static boolean sleep(long delayMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(delayMs);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
