package com.tcp.driver.routing;

import com.tcp.driver.core.HostAddress;

import java.util.Optional;
import java.util.Set;

/**
 * Owns the set of candidate endpoints and decides which one each send attempt uses.
 *
 * <p>Implementations must be thread-safe: a single policy is shared by every caller of
 * a driver, and reads must never observe a partially applied mutation.</p>
 */
public interface RoutingPolicy {

    /**
     * Selects an endpoint that is not blacklisted.
     *
     * @return the endpoint, or empty if none is configured or all are blacklisted
     */
    Optional<HostAddress> selectHost();

    void addHost(HostAddress address);

    void removeHost(HostAddress address);

    /**
     * Excludes an endpoint from selection until it is explicitly un-blacklisted
     * (or, for policies that support it, until its blacklist entry expires).
     */
    void blacklist(HostAddress address);

    /**
     * Makes a blacklisted endpoint selectable again.
     */
    void unblacklist(HostAddress address);

    boolean isBlacklisted(HostAddress address);

    /**
     * Called after every failed attempt against {@code address}, after it has been
     * blacklisted. Implementations may use it to track error rates.
     */
    default void onError(HostAddress address, Throwable cause) {
    }

    /**
     * Returns a snapshot of the configured endpoints, blacklisted or not.
     */
    Set<HostAddress> getHosts();
}
