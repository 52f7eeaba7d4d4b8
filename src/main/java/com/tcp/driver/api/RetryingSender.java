package com.tcp.driver.api;

import com.tcp.driver.core.HostAddress;
import com.tcp.driver.metrics.DriverMetrics;
import com.tcp.driver.metrics.NoOpDriverMetrics;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stacks the context's {@link com.tcp.driver.retry.RetryPolicy} on top of a
 * {@link SelectionSender}: every retry re-runs the whole endpoint failover from scratch.
 */
public class RetryingSender {

    private final DriverContext context;
    private final SelectionSender selectionSender;
    private final DriverMetrics metrics;

    public RetryingSender(DriverContext context) {
        this(context, new SelectionSender(context), new NoOpDriverMetrics());
    }

    public RetryingSender(DriverContext context, SelectionSender selectionSender, DriverMetrics metrics) {
        this.context = context;
        this.selectionSender = selectionSender;
        this.metrics = metrics;
    }

    public <T> T send(ConnectionOperation<T> operation, long timeoutMs) {
        return send(null, operation, timeoutMs);
    }

    /**
     * @param endpoint endpoint to use, or {@code null} to let the routing policy choose
     * @return the operation's result
     * @throws RuntimeException the last failure once the retry policy gives up
     */
    public <T> T send(HostAddress endpoint, ConnectionOperation<T> operation, long timeoutMs) {
        AtomicInteger runs = new AtomicInteger();
        return context.retryPolicy().withRetry(() -> {
            if (runs.getAndIncrement() > 0) {
                metrics.incrementCallRetry();
            }
            return selectionSender.send(endpoint, operation, timeoutMs);
        });
    }
}
