package com.tcp.driver.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Health of a driver component or of the whole driver, with detail values
 * (counts, endpoint lists) for diagnostics.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Ordered from best to worst.
     */
    public enum Status {
        UP, DEGRADED, DOWN;

        /**
         * Classifies the share of a resource that is lost or in use: DOWN when all of it
         * is, DEGRADED from {@code degradedAt} (any non-zero share when it is 0).
         */
        public static Status forRatio(double ratio, double degradedAt) {
            if (ratio >= 1.0) {
                return DOWN;
            }
            if (ratio > 0.0 && ratio >= degradedAt) {
                return DEGRADED;
            }
            return UP;
        }
    }

    public HealthStatus {
        Objects.requireNonNull(status, "status must not be null");
        message = message != null ? message : (status == Status.UP ? "OK" : status.name());
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus of(Status status, String message) {
        return new HealthStatus(status, message, Map.of());
    }

    public static HealthStatus up() {
        return of(Status.UP, "OK");
    }

    public static HealthStatus down(String reason) {
        return of(Status.DOWN, reason);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(details);
        next.put(key, value);
        return new HealthStatus(status, message, next);
    }

    /**
     * This status with its message prefixed by the component that produced it, as used
     * in the aggregate of a {@link HealthCheckRegistry}.
     */
    public HealthStatus attributedTo(String component) {
        return new HealthStatus(status, component + ": " + message, details);
    }

    public boolean isWorseThan(HealthStatus other) {
        return status.compareTo(other.status) > 0;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
