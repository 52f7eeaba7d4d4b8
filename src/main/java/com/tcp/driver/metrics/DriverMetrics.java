package com.tcp.driver.metrics;

import com.tcp.driver.core.AttemptException;
import com.tcp.driver.core.HostAddress;

import java.time.Duration;

/**
 * Interface for recording driver metrics.
 * The default {@link NoOpDriverMetrics} does nothing, so the library works without any
 * metrics dependency on the classpath.
 */
public interface DriverMetrics {

    /**
     * Records the duration of one public send call, retries included.
     */
    void recordSend(Duration duration, boolean success);

    void incrementAttemptFailure(HostAddress endpoint, AttemptException.FailureKind kind);

    void incrementBlacklisted(HostAddress endpoint);

    /**
     * Counts a whole-call retry performed by the retry policy.
     */
    void incrementCallRetry();
}
