package com.tcp.driver.metrics;

import com.tcp.driver.core.AttemptException;
import com.tcp.driver.core.HostAddress;

import java.time.Duration;

/**
 * No-op implementation of {@link DriverMetrics}.
 */
public class NoOpDriverMetrics implements DriverMetrics {

    @Override
    public void recordSend(Duration duration, boolean success) {
    }

    @Override
    public void incrementAttemptFailure(HostAddress endpoint, AttemptException.FailureKind kind) {
    }

    @Override
    public void incrementBlacklisted(HostAddress endpoint) {
    }

    @Override
    public void incrementCallRetry() {
    }
}
