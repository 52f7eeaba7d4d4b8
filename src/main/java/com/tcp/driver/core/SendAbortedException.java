package com.tcp.driver.core;

/**
 * Thrown when a send stops for a reason that says nothing about endpoint health: the
 * calling thread was interrupted, or the connection pool was closed underneath it.
 * The endpoint involved is not blacklisted and the call is not retried.
 */
public class SendAbortedException extends DriverException {

    private final HostAddress endpoint;

    public SendAbortedException(HostAddress endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    /**
     * The endpoint of the attempt that was cut short.
     */
    public HostAddress getEndpoint() {
        return endpoint;
    }
}
