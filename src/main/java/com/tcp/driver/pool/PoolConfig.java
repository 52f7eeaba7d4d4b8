package com.tcp.driver.pool;

import java.util.Map;
import java.util.Set;

/**
 * Configuration for {@link SimpleKeyedConnectionPool}. All limits apply per endpoint.
 */
public class PoolConfig {

    static final Set<String> KEYS = Set.of(
            "maxTotalPerKey", "maxIdlePerKey", "minIdlePerKey",
            "testOnBorrow", "connectTimeoutMs", "readTimeoutMs");

    private final int maxTotalPerKey;
    private final int maxIdlePerKey;
    private final int minIdlePerKey;
    private final boolean testOnBorrow;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    private PoolConfig(Builder builder) {
        this.maxTotalPerKey = builder.maxTotalPerKey;
        this.maxIdlePerKey = builder.maxIdlePerKey;
        this.minIdlePerKey = builder.minIdlePerKey;
        this.testOnBorrow = builder.testOnBorrow;
        this.connectTimeoutMs = builder.connectTimeoutMs;
        this.readTimeoutMs = builder.readTimeoutMs;
    }

    public int getMaxTotalPerKey() { return maxTotalPerKey; }
    public int getMaxIdlePerKey() { return maxIdlePerKey; }
    public int getMinIdlePerKey() { return minIdlePerKey; }
    public boolean isTestOnBorrow() { return testOnBorrow; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public int getReadTimeoutMs() { return readTimeoutMs; }

    public static Builder builder() {
        return new Builder();
    }

    public static PoolConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a config from a key/value map. Values may be numbers, booleans or their
     * string forms. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException on an unknown key or an invalid value
     */
    public static PoolConfig fromMap(Map<String, ?> values) {
        Builder builder = builder();
        if (values == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case "maxTotalPerKey" -> builder.maxTotalPerKey(toInt(key, value));
                case "maxIdlePerKey" -> builder.maxIdlePerKey(toInt(key, value));
                case "minIdlePerKey" -> builder.minIdlePerKey(toInt(key, value));
                case "testOnBorrow" -> builder.testOnBorrow(toBoolean(key, value));
                case "connectTimeoutMs" -> builder.connectTimeoutMs(toInt(key, value));
                case "readTimeoutMs" -> builder.readTimeoutMs(toInt(key, value));
                default -> throw new IllegalArgumentException(
                        "Unknown pool setting '" + key + "', expected one of " + KEYS);
            }
        }
        return builder.build();
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, was '" + value + "'", e);
        }
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException(key + " must be true or false, was '" + value + "'");
    }

    public static class Builder {
        private int maxTotalPerKey = 8;
        private int maxIdlePerKey = 8;
        private int minIdlePerKey = 0;
        private boolean testOnBorrow = true;
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 0;

        public Builder maxTotalPerKey(int maxTotalPerKey) {
            if (maxTotalPerKey <= 0) throw new IllegalArgumentException("maxTotalPerKey must be > 0");
            this.maxTotalPerKey = maxTotalPerKey;
            return this;
        }

        public Builder maxIdlePerKey(int maxIdlePerKey) {
            if (maxIdlePerKey < 0) throw new IllegalArgumentException("maxIdlePerKey must be >= 0");
            this.maxIdlePerKey = maxIdlePerKey;
            return this;
        }

        public Builder minIdlePerKey(int minIdlePerKey) {
            if (minIdlePerKey < 0) throw new IllegalArgumentException("minIdlePerKey must be >= 0");
            this.minIdlePerKey = minIdlePerKey;
            return this;
        }

        public Builder testOnBorrow(boolean testOnBorrow) {
            this.testOnBorrow = testOnBorrow;
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            if (connectTimeoutMs < 0) throw new IllegalArgumentException("connectTimeoutMs must be >= 0");
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder readTimeoutMs(int readTimeoutMs) {
            if (readTimeoutMs < 0) throw new IllegalArgumentException("readTimeoutMs must be >= 0");
            this.readTimeoutMs = readTimeoutMs;
            return this;
        }

        public PoolConfig build() {
            if (maxIdlePerKey > maxTotalPerKey) {
                throw new IllegalArgumentException("maxIdlePerKey cannot exceed maxTotalPerKey");
            }
            if (minIdlePerKey > maxIdlePerKey) {
                throw new IllegalArgumentException("minIdlePerKey cannot exceed maxIdlePerKey");
            }
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "maxTotalPerKey=" + maxTotalPerKey +
                ", maxIdlePerKey=" + maxIdlePerKey +
                ", minIdlePerKey=" + minIdlePerKey +
                ", testOnBorrow=" + testOnBorrow +
                ", connectTimeoutMs=" + connectTimeoutMs +
                ", readTimeoutMs=" + readTimeoutMs +
                '}';
    }
}
