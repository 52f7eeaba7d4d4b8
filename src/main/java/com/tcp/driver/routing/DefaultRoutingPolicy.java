package com.tcp.driver.routing;

import com.tcp.driver.core.HostAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Routing policy that picks uniformly at random among the endpoints that are not
 * blacklisted.
 *
 * <p>All state lives in one immutable {@link RoutingState} held by an
 * {@link AtomicReference}. Each mutation computes a new snapshot from the current one
 * and commits it with compare-and-set, retrying on contention, so concurrent
 * add/remove/blacklist calls never lose an update and readers always see a whole
 * snapshot.</p>
 *
 * <p>Blacklisting is permanent unless {@link RoutingConfig#blacklistTtl()} is positive,
 * in which case an entry stops excluding its endpoint once the TTL has elapsed.</p>
 */
public class DefaultRoutingPolicy implements RoutingPolicy {
    private static final Logger log = LoggerFactory.getLogger(DefaultRoutingPolicy.class);

    private final AtomicReference<RoutingState> state;
    private final Duration blacklistTtl;
    private final Random random;
    private final Clock clock;

    public DefaultRoutingPolicy(Collection<HostAddress> hosts) {
        this(hosts, RoutingConfig.defaults());
    }

    public DefaultRoutingPolicy(Collection<HostAddress> hosts, RoutingConfig config) {
        this(hosts, config, Clock.systemUTC());
    }

    public DefaultRoutingPolicy(Collection<HostAddress> hosts, RoutingConfig config, Clock clock) {
        this.state = new AtomicReference<>(RoutingState.of(hosts));
        this.blacklistTtl = config.blacklistTtl();
        this.random = config.random();
        this.clock = clock;
    }

    @Override
    public Optional<HostAddress> selectHost() {
        RoutingState snapshot = state.get();
        Instant now = clock.instant();
        List<HostAddress> candidates = new ArrayList<>(snapshot.hosts().size());
        for (HostAddress host : snapshot.hosts()) {
            if (!isExcluded(snapshot, host, now)) {
                candidates.add(host);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        int index = random != null
                ? random.nextInt(candidates.size())
                : ThreadLocalRandom.current().nextInt(candidates.size());
        return Optional.of(candidates.get(index));
    }

    @Override
    public void addHost(HostAddress address) {
        state.updateAndGet(s -> s.withHost(address));
        log.info("Added endpoint {}", address);
    }

    @Override
    public void removeHost(HostAddress address) {
        state.updateAndGet(s -> s.withoutHost(address));
        log.info("Removed endpoint {}", address);
    }

    @Override
    public void blacklist(HostAddress address) {
        Instant now = clock.instant();
        state.updateAndGet(s -> s.withBlacklisted(address, now));
    }

    @Override
    public void unblacklist(HostAddress address) {
        state.updateAndGet(s -> s.withoutBlacklisted(address));
        log.info("Endpoint {} removed from blacklist", address);
    }

    @Override
    public boolean isBlacklisted(HostAddress address) {
        return isExcluded(state.get(), address, clock.instant());
    }

    @Override
    public Set<HostAddress> getHosts() {
        return state.get().hosts();
    }

    /**
     * Returns the current routing snapshot.
     */
    public RoutingState getState() {
        return state.get();
    }

    private boolean isExcluded(RoutingState snapshot, HostAddress address, Instant now) {
        Map<HostAddress, Instant> blacklist = snapshot.blacklist();
        Instant since = blacklist.get(address);
        if (since == null) {
            return false;
        }
        return blacklistTtl.isZero() || now.isBefore(since.plus(blacklistTtl));
    }
}
