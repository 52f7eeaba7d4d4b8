package com.tcp.driver.health;

import com.tcp.driver.pool.ConnectionPool;
import com.tcp.driver.pool.PoolStats;

/**
 * Reports pool utilization over all endpoints: DOWN when every allowed connection is
 * in use, DEGRADED from 80% usage.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private static final double DEGRADED_THRESHOLD = 0.80;

    private final ConnectionPool pool;

    public ConnectionPoolHealthCheck(ConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return "connectionPool";
    }

    @Override
    public HealthStatus check() {
        try {
            PoolStats stats = pool.getStats();
            int max = stats.maxConnections();
            int active = stats.activeConnections();
            double usage = max > 0 ? (double) active / max : 0.0;

            HealthStatus base = switch (HealthStatus.Status.forRatio(usage, DEGRADED_THRESHOLD)) {
                case DOWN -> HealthStatus.down("Connection pool exhausted: all connections active");
                case DEGRADED -> HealthStatus.of(HealthStatus.Status.DEGRADED,
                        "Connection pool usage high: " + String.format("%.0f%%", usage * 100));
                case UP -> HealthStatus.up();
            };

            return base
                    .withDetail("maxConnections", max)
                    .withDetail("activeConnections", active)
                    .withDetail("idleConnections", stats.idleConnections())
                    .withDetail("totalAcquired", stats.totalAcquired())
                    .withDetail("totalInvalidated", stats.totalInvalidated());
        } catch (Exception e) {
            return HealthStatus.down("Connection pool check failed: " + e.getMessage());
        }
    }
}
