package com.tcp.driver.core;

import java.util.Set;

/**
 * Failure of one acquire-execute cycle against a specific endpoint.
 *
 * <p>Carries the endpoint, the zero-based attempt index within the send call and
 * the endpoint set known to the routing policy right after the failure. The last
 * one raised in a send call is what the caller (or the retry policy) sees.</p>
 */
public class AttemptException extends DriverException {

    /**
     * Which step of the attempt failed.
     */
    public enum FailureKind {
        /** The pool could not supply a connection. */
        ACQUISITION,
        /** The caller-supplied operation failed on the connection. */
        OPERATION
    }

    private final HostAddress endpoint;
    private final int attemptIndex;
    private final Set<HostAddress> endpointsSnapshot;
    private final FailureKind failureKind;

    public AttemptException(Throwable cause, HostAddress endpoint, int attemptIndex,
                            Set<HostAddress> endpointsSnapshot, FailureKind failureKind) {
        super("Error while connecting to " + endpoint + " (attempt " + attemptIndex + "): "
                + cause.getMessage(), cause);
        this.endpoint = endpoint;
        this.attemptIndex = attemptIndex;
        this.endpointsSnapshot = Set.copyOf(endpointsSnapshot);
        this.failureKind = failureKind;
    }

    public HostAddress getEndpoint() {
        return endpoint;
    }

    public int getAttemptIndex() {
        return attemptIndex;
    }

    public Set<HostAddress> getEndpointsSnapshot() {
        return endpointsSnapshot;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }
}
