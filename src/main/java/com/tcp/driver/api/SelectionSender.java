package com.tcp.driver.api;

import com.tcp.driver.core.AcquisitionTimeoutException;
import com.tcp.driver.core.AttemptException;
import com.tcp.driver.core.AttemptException.FailureKind;
import com.tcp.driver.core.HostAddress;
import com.tcp.driver.core.NoConnectionAvailableException;
import com.tcp.driver.core.SendAbortedException;
import com.tcp.driver.io.TcpConnection;
import com.tcp.driver.logging.LogContext;
import com.tcp.driver.metrics.DriverMetrics;
import com.tcp.driver.metrics.NoOpDriverMetrics;
import com.tcp.driver.pool.ConnectionPool;
import com.tcp.driver.routing.RoutingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Runs one operation on one pooled connection, failing over across endpoints.
 *
 * <p>Each attempt selects an endpoint (the explicit one if given, otherwise through the
 * routing policy), acquires a connection for it and runs the operation. On success the
 * connection goes back to the pool; on any failure it is invalidated, the endpoint is
 * blacklisted and the routing policy is notified before the next attempt.</p>
 *
 * <p>A failure seen while the calling thread is interrupted, or after the pool has been
 * closed, ends the call with a {@link SendAbortedException} instead: the endpoint is
 * left alone and no further attempt is made.</p>
 *
 * <p>The number of attempts is bounded by the number of endpoints known to the routing
 * policy when the call starts (at least one), so a call never loops even if every
 * endpoint keeps failing. Failures are not logged here: they are returned to the caller
 * as an {@link AttemptException} and left to the retry policy.</p>
 */
public class SelectionSender {
    private static final Logger log = LoggerFactory.getLogger(SelectionSender.class);

    private final DriverContext context;
    private final DriverMetrics metrics;

    public SelectionSender(DriverContext context) {
        this(context, new NoOpDriverMetrics());
    }

    public SelectionSender(DriverContext context, DriverMetrics metrics) {
        this.context = context;
        this.metrics = metrics;
    }

    /**
     * Runs the operation against an endpoint chosen by the routing policy.
     *
     * @see #send(HostAddress, ConnectionOperation, long)
     */
    public <T> T send(ConnectionOperation<T> operation, long timeoutMs) {
        return send(null, operation, timeoutMs);
    }

    /**
     * Runs the operation, failing over to other endpoints on error.
     *
     * @param endpoint  endpoint to use for every attempt, or {@code null} to let the routing policy choose
     * @param operation the work to perform on the connection
     * @param timeoutMs maximum time to wait for a pooled connection, per attempt
     * @return the operation's result
     * @throws NoConnectionAvailableException if no endpoint can be selected for the first attempt
     * @throws AttemptException               if every allowed attempt failed; describes the last one
     * @throws SendAbortedException           if the caller was interrupted or the pool closed mid-call
     */
    public <T> T send(HostAddress endpoint, ConnectionOperation<T> operation, long timeoutMs) {
        Objects.requireNonNull(operation, "operation must not be null");
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
        RoutingPolicy routing = context.routingPolicy();
        int maxAttempts = Math.max(1, routing.getHosts().size());

        AttemptException lastFailure = null;
        for (int i = 0; i < maxAttempts; i++) {
            HostAddress target = endpoint != null ? endpoint : routing.selectHost().orElse(null);
            if (target == null) {
                NoConnectionAvailableException none = new NoConnectionAvailableException(
                        "No connection available: no endpoint is configured or all are blacklisted "
                                + routing.getHosts());
                if (lastFailure != null) {
                    lastFailure.addSuppressed(none);
                    throw lastFailure;
                }
                throw none;
            }

            Attempt<T> attempt;
            try (LogContext ignored = LogContext.forAttempt(target, i)) {
                attempt = attempt(target, operation, timeoutMs);
            }
            if (attempt.failure() == null) {
                return attempt.value();
            }
            abortIfNotEndpointFailure(target, attempt.failure());

            routing.blacklist(target);
            metrics.incrementBlacklisted(target);
            routing.onError(target, attempt.failure());
            metrics.incrementAttemptFailure(target, attempt.kind());
            lastFailure = new AttemptException(attempt.failure(), target, i, routing.getHosts(), attempt.kind());
        }
        throw lastFailure;
    }

    /**
     * Ends the call when the failure came from the caller or the pool rather than the endpoint.
     */
    private void abortIfNotEndpointFailure(HostAddress target, Throwable failure) {
        if (Thread.currentThread().isInterrupted()) {
            throw new SendAbortedException(target, "Send interrupted during attempt on " + target, failure);
        }
        if (context.pool().isClosed()) {
            throw new SendAbortedException(target, "Connection pool closed during attempt on " + target, failure);
        }
    }

    private <T> Attempt<T> attempt(HostAddress target, ConnectionOperation<T> operation, long timeoutMs) {
        ConnectionPool pool = context.pool();

        TcpConnection connection;
        try {
            connection = pool.acquire(target, timeoutMs);
        } catch (IOException | RuntimeException e) {
            return Attempt.failed(e, FailureKind.ACQUISITION);
        }
        if (connection == null) {
            return Attempt.failed(new AcquisitionTimeoutException(target,
                    "No connection to " + target + " within " + timeoutMs + "ms"), FailureKind.ACQUISITION);
        }

        T value;
        try {
            value = operation.apply(connection);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            invalidate(pool, target, connection, e);
            return Attempt.failed(e, FailureKind.OPERATION);
        } catch (Error e) {
            invalidate(pool, target, connection, e);
            throw e;
        }

        try {
            pool.release(target, connection);
        } catch (RuntimeException e) {
            log.debug("Ignoring error returning connection for {} to the pool: {}", target, e.getMessage());
        }
        return Attempt.succeeded(value);
    }

    private static void invalidate(ConnectionPool pool, HostAddress target, TcpConnection connection, Throwable cause) {
        try {
            pool.invalidate(target, connection);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private record Attempt<T>(T value, Throwable failure, FailureKind kind) {

        static <T> Attempt<T> succeeded(T value) {
            return new Attempt<>(value, null, null);
        }

        static <T> Attempt<T> failed(Throwable failure, FailureKind kind) {
            return new Attempt<>(null, failure, kind);
        }
    }
}
