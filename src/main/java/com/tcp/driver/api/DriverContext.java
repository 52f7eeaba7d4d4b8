package com.tcp.driver.api;

import com.tcp.driver.pool.ConnectionPool;
import com.tcp.driver.retry.RetryPolicy;
import com.tcp.driver.routing.RoutingPolicy;

import java.util.Objects;

/**
 * The collaborators shared by every caller of a driver. Created once and never
 * changed; the components themselves are thread-safe and stateful.
 *
 * @param pool          keyed connection pool
 * @param routingPolicy endpoint selection and blacklisting
 * @param retryPolicy   whole-call retries
 */
public record DriverContext(ConnectionPool pool, RoutingPolicy routingPolicy, RetryPolicy retryPolicy) {

    public DriverContext {
        Objects.requireNonNull(pool, "pool must not be null");
        Objects.requireNonNull(routingPolicy, "routingPolicy must not be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }
}
