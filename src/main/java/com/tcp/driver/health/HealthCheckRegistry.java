package com.tcp.driver.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered checks and combines them: the aggregate takes the worst status and
 * the message of the check that produced it, and carries every individual result as a
 * detail keyed by check name.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.of(HealthStatus.Status.UP, "No health checks registered");
        }

        HealthStatus worst = HealthStatus.up();
        String worstName = null;
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            HealthStatus result = safeCheck(check);
            results.put(check.getName(), result);
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        HealthStatus aggregate = worstName == null
                ? HealthStatus.up()
                : HealthStatus.of(worst.status(), worst.message()).attributedTo(worstName);
        for (Map.Entry<String, HealthStatus> entry : results.entrySet()) {
            HealthStatus result = entry.getValue();
            aggregate = aggregate.withDetail(entry.getKey(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
        }
        return aggregate;
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus safeCheck(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("Health check failed: " + e.getMessage());
        }
    }
}
