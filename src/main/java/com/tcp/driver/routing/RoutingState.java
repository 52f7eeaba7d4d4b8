package com.tcp.driver.routing;

import com.tcp.driver.core.HostAddress;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the routing data: the configured endpoints in insertion order,
 * and the blacklisted endpoints with the instant each was blacklisted.
 *
 * <p>A blacklisted endpoint does not have to be a configured one. Every mutation
 * returns a new snapshot, or {@code this} when nothing changes.</p>
 */
public record RoutingState(Set<HostAddress> hosts, Map<HostAddress, Instant> blacklist) {

    public RoutingState {
        hosts = Collections.unmodifiableSet(new LinkedHashSet<>(hosts));
        blacklist = Collections.unmodifiableMap(new LinkedHashMap<>(blacklist));
    }

    public static RoutingState of(Collection<HostAddress> hosts) {
        return new RoutingState(new LinkedHashSet<>(hosts), Map.of());
    }

    public RoutingState withHost(HostAddress address) {
        if (hosts.contains(address)) {
            return this;
        }
        Set<HostAddress> next = new LinkedHashSet<>(hosts);
        next.add(address);
        return new RoutingState(next, blacklist);
    }

    public RoutingState withoutHost(HostAddress address) {
        if (!hosts.contains(address)) {
            return this;
        }
        Set<HostAddress> next = new LinkedHashSet<>(hosts);
        next.remove(address);
        return new RoutingState(next, blacklist);
    }

    public RoutingState withBlacklisted(HostAddress address, Instant at) {
        Map<HostAddress, Instant> next = new LinkedHashMap<>(blacklist);
        next.put(address, at);
        return new RoutingState(hosts, next);
    }

    public RoutingState withoutBlacklisted(HostAddress address) {
        if (!blacklist.containsKey(address)) {
            return this;
        }
        Map<HostAddress, Instant> next = new LinkedHashMap<>(blacklist);
        next.remove(address);
        return new RoutingState(hosts, next);
    }
}
