package com.tcp.driver.core;

/**
 * Thrown when the pool cannot hand out a connection for an endpoint in time,
 * or when the waiting thread is interrupted.
 */
public class AcquisitionTimeoutException extends DriverException {

    private final HostAddress endpoint;

    public AcquisitionTimeoutException(HostAddress endpoint, String message) {
        super(message);
        this.endpoint = endpoint;
    }

    public AcquisitionTimeoutException(HostAddress endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public HostAddress getEndpoint() {
        return endpoint;
    }
}
