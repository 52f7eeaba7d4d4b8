package com.tcp.driver.health;

/**
 * A check of one driver component (pool, routing) that reports a {@link HealthStatus}.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
