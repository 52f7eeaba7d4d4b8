package com.tcp.driver.health;

import com.tcp.driver.core.HostAddress;
import com.tcp.driver.routing.RoutingPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports endpoint availability: DOWN when no endpoint can be selected, DEGRADED
 * when some configured endpoints are blacklisted.
 */
public class RoutingHealthCheck implements HealthCheck {

    private final RoutingPolicy routingPolicy;

    public RoutingHealthCheck(RoutingPolicy routingPolicy) {
        this.routingPolicy = routingPolicy;
    }

    @Override
    public String getName() {
        return "routing";
    }

    @Override
    public HealthStatus check() {
        List<String> available = new ArrayList<>();
        List<String> blacklisted = new ArrayList<>();
        for (HostAddress host : routingPolicy.getHosts()) {
            (routingPolicy.isBlacklisted(host) ? blacklisted : available).add(host.toString());
        }

        int total = available.size() + blacklisted.size();
        HealthStatus base;
        if (total == 0) {
            base = HealthStatus.down("No endpoints configured");
        } else {
            base = switch (HealthStatus.Status.forRatio((double) blacklisted.size() / total, 0.0)) {
                case DOWN -> HealthStatus.down("All endpoints blacklisted");
                case DEGRADED -> HealthStatus.of(HealthStatus.Status.DEGRADED,
                        blacklisted.size() + " of " + total + " endpoints blacklisted");
                case UP -> HealthStatus.up();
            };
        }
        return base
                .withDetail("available", available)
                .withDetail("blacklisted", blacklisted);
    }
}
