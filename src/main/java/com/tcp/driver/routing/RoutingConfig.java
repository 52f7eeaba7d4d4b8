package com.tcp.driver.routing;

import java.time.Duration;
import java.util.Map;
import java.util.Random;

/**
 * Configuration for {@link DefaultRoutingPolicy}.
 *
 * @param blacklistTtl how long a blacklisted endpoint stays excluded; {@link Duration#ZERO}
 *                     keeps it excluded until explicitly un-blacklisted
 * @param random       source for endpoint selection, or {@code null} for
 *                     {@link java.util.concurrent.ThreadLocalRandom}
 */
public record RoutingConfig(Duration blacklistTtl, Random random) {

    public RoutingConfig {
        if (blacklistTtl == null || blacklistTtl.isNegative()) {
            throw new IllegalArgumentException("blacklistTtl must be >= 0");
        }
    }

    /**
     * Default configuration: permanent blacklisting, thread-local randomness.
     */
    public static RoutingConfig defaults() {
        return new RoutingConfig(Duration.ZERO, null);
    }

    /**
     * Builds a config from the keys {@code blacklistTtlMs} (number or numeric string)
     * and {@code random} (a {@link Random} instance).
     *
     * @throws IllegalArgumentException on an unknown key or an invalid value
     */
    public static RoutingConfig fromMap(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return defaults();
        }
        Duration ttl = Duration.ZERO;
        Random random = null;
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "blacklistTtlMs" -> ttl = Duration.ofMillis(toLong(value));
                case "random" -> {
                    if (!(value instanceof Random r)) {
                        throw new IllegalArgumentException("random must be a java.util.Random");
                    }
                    random = r;
                }
                default -> throw new IllegalArgumentException(
                        "Unknown routing setting '" + entry.getKey() + "', expected blacklistTtlMs or random");
            }
        }
        return new RoutingConfig(ttl, random);
    }

    private static long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("blacklistTtlMs must be a number, was '" + value + "'", e);
        }
    }
}
