package com.tcp.driver.core;

/**
 * Thrown when no endpoint can be selected: none is configured, or every
 * configured endpoint is blacklisted. Not retried within a single send attempt.
 */
public class NoConnectionAvailableException extends DriverException {

    public NoConnectionAvailableException(String message) {
        super(message);
    }
}
