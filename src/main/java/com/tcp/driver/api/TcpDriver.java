package com.tcp.driver.api;

import com.tcp.driver.core.HostAddress;
import com.tcp.driver.health.ConnectionPoolHealthCheck;
import com.tcp.driver.health.HealthCheckRegistry;
import com.tcp.driver.health.HealthStatus;
import com.tcp.driver.health.RoutingHealthCheck;
import com.tcp.driver.io.SocketConnectionFactory;
import com.tcp.driver.logging.LogContext;
import com.tcp.driver.metrics.DriverMetrics;
import com.tcp.driver.metrics.NoOpDriverMetrics;
import com.tcp.driver.pool.ConnectionFactory;
import com.tcp.driver.pool.ConnectionPool;
import com.tcp.driver.pool.PoolConfig;
import com.tcp.driver.pool.PoolStats;
import com.tcp.driver.pool.SimpleKeyedConnectionPool;
import com.tcp.driver.retry.DefaultRetryPolicy;
import com.tcp.driver.retry.RetryConfig;
import com.tcp.driver.retry.RetryPolicy;
import com.tcp.driver.routing.DefaultRoutingPolicy;
import com.tcp.driver.routing.RoutingConfig;
import com.tcp.driver.routing.RoutingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point: gives application code pooled connections to one of several
 * equivalent endpoints, with failover and retries.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * TcpDriver driver = TcpDriver.builder()
 *     .hosts(List.of(HostAddress.of("db1", 5000), HostAddress.of("db2", 5000)))
 *     .poolConf(Map.of("maxTotalPerKey", 4))
 *     .retryLimit(3)
 *     .build();
 *
 * String reply = driver.send(conn -> {
 *     conn.getOutputStream().write(request);
 *     return readReply(conn.getInputStream());
 * }, 1000);
 *
 * driver.close();
 * </pre>
 *
 * <p>A failing operation invalidates its connection and blacklists the endpoint; the
 * call then fails over to another endpoint, and the retry policy may repeat the whole
 * call. Blacklisted endpoints stay excluded until {@link #unblacklistHost} is called
 * (or their TTL expires, when one is configured).</p>
 */
public class TcpDriver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TcpDriver.class);

    private final DriverContext context;
    private final RetryingSender sender;
    private final DriverMetrics metrics;
    private final HealthCheckRegistry healthCheckRegistry = new HealthCheckRegistry();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private TcpDriver(DriverContext context, DriverMetrics metrics) {
        this.context = context;
        this.metrics = metrics;
        this.sender = new RetryingSender(context, new SelectionSender(context, metrics), metrics);
        healthCheckRegistry.register(new RoutingHealthCheck(context.routingPolicy()));
        healthCheckRegistry.register(new ConnectionPoolHealthCheck(context.pool()));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Wraps an existing context. The driver takes ownership of the context's pool.
     */
    public static TcpDriver create(DriverContext context) {
        return new TcpDriver(context, new NoOpDriverMetrics());
    }

    public static TcpDriver create(DriverContext context, DriverMetrics metrics) {
        return new TcpDriver(context, metrics);
    }

    /**
     * Runs the operation on a connection to an endpoint chosen by the routing policy.
     *
     * @param operation work to perform; any exception invalidates the connection
     * @param timeoutMs maximum time to wait for a pooled connection, per attempt
     * @return the operation's result
     * @throws com.tcp.driver.core.DriverException the last failure once retries are exhausted
     * @throws com.tcp.driver.core.SendAbortedException if the calling thread is interrupted or the
     *                                                   driver is closed during the call
     */
    public <T> T send(ConnectionOperation<T> operation, long timeoutMs) {
        return doSend(null, operation, timeoutMs);
    }

    /**
     * Runs the operation on a connection to the given endpoint, whatever the routing
     * policy would choose.
     */
    public <T> T send(HostAddress endpoint, ConnectionOperation<T> operation, long timeoutMs) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        return doSend(endpoint, operation, timeoutMs);
    }

    private <T> T doSend(HostAddress endpoint, ConnectionOperation<T> operation, long timeoutMs) {
        if (closed.get()) {
            throw new IllegalStateException("Driver is closed");
        }
        long start = System.nanoTime();
        boolean success = false;
        try (LogContext ignored = LogContext.forSend(LogContext.generateCorrelationId(), endpoint)) {
            T result = sender.send(endpoint, operation, timeoutMs);
            success = true;
            return result;
        } finally {
            metrics.recordSend(Duration.ofNanos(System.nanoTime() - start), success);
        }
    }

    public void addHost(HostAddress address) {
        context.routingPolicy().addHost(Objects.requireNonNull(address, "address must not be null"));
    }

    public void removeHost(HostAddress address) {
        context.routingPolicy().removeHost(Objects.requireNonNull(address, "address must not be null"));
    }

    public void blacklistHost(HostAddress address) {
        context.routingPolicy().blacklist(Objects.requireNonNull(address, "address must not be null"));
        log.info("Endpoint {} blacklisted", address);
    }

    public void unblacklistHost(HostAddress address) {
        context.routingPolicy().unblacklist(Objects.requireNonNull(address, "address must not be null"));
    }

    public boolean isBlacklisted(HostAddress address) {
        return context.routingPolicy().isBlacklisted(Objects.requireNonNull(address, "address must not be null"));
    }

    public Set<HostAddress> getHosts() {
        return context.routingPolicy().getHosts();
    }

    public DriverContext getContext() {
        return context;
    }

    public PoolStats getPoolStats() {
        return context.pool().getStats();
    }

    /**
     * Runs the routing and pool health checks.
     */
    public HealthStatus checkHealth() {
        return healthCheckRegistry.checkAll();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the connection pool. Further sends fail with {@link IllegalStateException};
     * sends already in flight end with a {@link com.tcp.driver.core.SendAbortedException}.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing driver for endpoints {}", getHosts());
            context.pool().close();
        }
    }

    public static class Builder {
        private final List<HostAddress> hosts = new ArrayList<>();
        private Map<String, ?> routingConf = Map.of();
        private Map<String, ?> poolConf = Map.of();
        private RetryConfig retryConfig = RetryConfig.defaults();
        private ConnectionPool pool;
        private ConnectionFactory connectionFactory;
        private RoutingPolicy routingPolicy;
        private RetryPolicy retryPolicy;
        private DriverMetrics metrics;

        public Builder hosts(Collection<HostAddress> hosts) {
            this.hosts.addAll(Objects.requireNonNull(hosts, "hosts must not be null"));
            return this;
        }

        public Builder host(HostAddress host) {
            this.hosts.add(Objects.requireNonNull(host, "host must not be null"));
            return this;
        }

        /**
         * Settings for the default routing policy, see {@link RoutingConfig#fromMap}.
         */
        public Builder routingConf(Map<String, ?> routingConf) {
            this.routingConf = routingConf != null ? routingConf : Map.of();
            return this;
        }

        /**
         * Settings for the default pool, see {@link PoolConfig#fromMap}.
         */
        public Builder poolConf(Map<String, ?> poolConf) {
            this.poolConf = poolConf != null ? poolConf : Map.of();
            return this;
        }

        /**
         * Total number of runs of a send call by the default retry policy (default 10).
         */
        public Builder retryLimit(int retryLimit) {
            this.retryConfig = RetryConfig.attempts(retryLimit);
            return this;
        }

        public Builder retryConfig(RetryConfig retryConfig) {
            this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig must not be null");
            return this;
        }

        public Builder pool(ConnectionPool pool) {
            this.pool = pool;
            return this;
        }

        public Builder connectionFactory(ConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
            return this;
        }

        public Builder routingPolicy(RoutingPolicy routingPolicy) {
            this.routingPolicy = routingPolicy;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder metrics(DriverMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * @throws IllegalArgumentException if no hosts are given and no routing policy is
         *                                  set, or if a configuration value is invalid
         */
        public TcpDriver build() {
            RoutingPolicy routing = routingPolicy;
            if (routing == null) {
                if (hosts.isEmpty()) {
                    throw new IllegalArgumentException("At least one host is required");
                }
                routing = new DefaultRoutingPolicy(hosts, RoutingConfig.fromMap(routingConf));
            }

            ConnectionPool connectionPool = pool;
            if (connectionPool == null) {
                PoolConfig poolConfig = PoolConfig.fromMap(poolConf);
                ConnectionFactory factory = connectionFactory != null
                        ? connectionFactory : new SocketConnectionFactory(poolConfig);
                connectionPool = new SimpleKeyedConnectionPool(poolConfig, factory);
            }

            RetryPolicy retry = retryPolicy != null ? retryPolicy : new DefaultRetryPolicy(retryConfig);

            DriverContext context = new DriverContext(connectionPool, routing, retry);
            return new TcpDriver(context, metrics != null ? metrics : new NoOpDriverMetrics());
        }
    }
}
