package com.tcp.driver.core;

import java.util.Objects;

/**
 * Identity of one server endpoint. Used as the pool key, the routing set member
 * and the blacklist member, so equality is exact on host and port.
 *
 * @param host hostname or IP literal
 * @param port TCP port, 1-65535
 */
public record HostAddress(String host, int port) {

    public HostAddress {
        Objects.requireNonNull(host, "host must not be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be in 1-65535, was " + port);
        }
    }

    public static HostAddress of(String host, int port) {
        return new HostAddress(host, port);
    }

    /**
     * Parses the {@code host:port} form. IPv6 literals must be bracketed, e.g. {@code [::1]:9000}.
     *
     * @param value the textual address
     * @return the parsed address
     * @throws IllegalArgumentException if the value is not a valid address
     */
    public static HostAddress parse(String value) {
        Objects.requireNonNull(value, "value must not be null");
        String trimmed = value.trim();
        int sep = trimmed.lastIndexOf(':');
        if (sep <= 0 || sep == trimmed.length() - 1) {
            throw new IllegalArgumentException("Expected host:port but was '" + value + "'");
        }
        String host = trimmed.substring(0, sep);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        try {
            return new HostAddress(host, Integer.parseInt(trimmed.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
