package com.tcp.driver.pool;

import com.tcp.driver.core.AcquisitionTimeoutException;
import com.tcp.driver.core.HostAddress;
import com.tcp.driver.io.TcpConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe keyed connection pool. Each endpoint gets its own sub-pool, created on
 * first use, made of a fair {@link Semaphore} for flow control and a
 * {@link ConcurrentLinkedDeque} of idle connections.
 *
 * <p>A permit is held from {@link #acquire} until the matching {@link #release} or
 * {@link #invalidate}, so at most {@code maxTotalPerKey} connections per endpoint
 * exist at any time.</p>
 */
public class SimpleKeyedConnectionPool implements ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(SimpleKeyedConnectionPool.class);

    private final PoolConfig config;
    private final ConnectionFactory factory;
    private final Map<HostAddress, SubPool> subPools = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SimpleKeyedConnectionPool(PoolConfig config, ConnectionFactory factory) {
        this.config = config;
        this.factory = factory;
        log.info("Connection pool initialized: {}", config);
    }

    public PoolConfig getConfig() {
        return config;
    }

    @Override
    public TcpConnection acquire(HostAddress key, long timeoutMs) throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("Pool is closed");
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        SubPool pool = subPool(key, deadline);
        long remainingMs = Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));

        try {
            if (!pool.permits.tryAcquire(remainingMs, TimeUnit.MILLISECONDS)) {
                throw new AcquisitionTimeoutException(key,
                        "Timeout waiting for connection to " + key + " (timeout=" + timeoutMs + "ms)");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionTimeoutException(key, "Interrupted while waiting for connection to " + key, e);
        }

        TcpConnection conn = null;
        try {
            while ((conn = pool.idle.pollFirst()) != null) {
                if (!config.isTestOnBorrow() || factory.validate(conn)) {
                    break;
                }
                log.debug("Idle connection to {} failed validation, discarding", key);
                destroyQuietly(conn);
            }
            if (conn == null) {
                conn = factory.create(key);
                pool.totalCreated.incrementAndGet();
            }
            pool.active.incrementAndGet();
            pool.totalAcquired.incrementAndGet();
            log.debug("Connection acquired for {} (active={}, idle={})",
                    key, pool.active.get(), pool.idle.size());
            return conn;
        } catch (IOException | RuntimeException e) {
            if (conn != null) {
                destroyQuietly(conn);
            }
            pool.permits.release();
            throw e;
        }
    }

    @Override
    public void release(HostAddress key, TcpConnection connection) {
        if (connection == null) {
            return;
        }
        SubPool pool = subPools.get(key);
        if (pool == null) {
            log.warn("Released connection for unknown endpoint {}, closing it", key);
            destroyQuietly(connection);
            return;
        }

        pool.active.decrementAndGet();
        pool.totalReleased.incrementAndGet();

        if (closed.get() || pool.idle.size() >= config.getMaxIdlePerKey()) {
            destroyQuietly(connection);
        } else {
            pool.idle.addLast(connection);
        }

        pool.permits.release();
        log.debug("Connection released for {} (active={}, idle={})",
                key, pool.active.get(), pool.idle.size());
    }

    @Override
    public void invalidate(HostAddress key, TcpConnection connection) {
        if (connection == null) {
            return;
        }
        destroyQuietly(connection);
        SubPool pool = subPools.get(key);
        if (pool == null) {
            return;
        }
        pool.active.decrementAndGet();
        pool.totalInvalidated.incrementAndGet();
        pool.permits.release();
        log.debug("Connection invalidated for {} (active={}, idle={})",
                key, pool.active.get(), pool.idle.size());
    }

    @Override
    public PoolStats getStats() {
        PoolStats total = PoolStats.empty();
        for (SubPool pool : subPools.values()) {
            total = total.plus(pool.stats());
        }
        return total;
    }

    @Override
    public PoolStats getStats(HostAddress key) {
        SubPool pool = subPools.get(key);
        return pool != null ? pool.stats() : PoolStats.empty();
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing connection pool ({} endpoints)...", subPools.size());
            for (SubPool pool : subPools.values()) {
                TcpConnection conn;
                while ((conn = pool.idle.pollFirst()) != null) {
                    destroyQuietly(conn);
                }
            }
            log.info("Connection pool closed");
        }
    }

    private SubPool subPool(HostAddress key, long deadline) {
        SubPool existing = subPools.get(key);
        if (existing != null) {
            return existing;
        }
        SubPool created = new SubPool(config.getMaxTotalPerKey());
        SubPool raced = subPools.putIfAbsent(key, created);
        if (raced != null) {
            return raced;
        }
        prefill(key, created, deadline);
        return created;
    }

    /**
     * Opens up to {@code minIdlePerKey} idle connections, stopping at the first failure
     * or once the acquiring caller's deadline has passed.
     */
    private void prefill(HostAddress key, SubPool pool, long deadline) {
        for (int i = 0; i < config.getMinIdlePerKey(); i++) {
            if (deadline - System.nanoTime() <= 0) {
                log.debug("Stopped pre-creating connections to {} after {}: acquire deadline reached", key, i);
                return;
            }
            try {
                pool.idle.addLast(factory.create(key));
                pool.totalCreated.incrementAndGet();
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to pre-create connection {}/{} to {}: {}",
                        i + 1, config.getMinIdlePerKey(), key, e.getMessage());
                return;
            }
        }
    }

    private void destroyQuietly(TcpConnection connection) {
        try {
            factory.destroy(connection);
        } catch (Exception e) {
            log.warn("Error closing connection: {}", e.getMessage());
        }
    }

    private static final class SubPool {
        private final int maxTotal;
        private final Semaphore permits;
        private final ConcurrentLinkedDeque<TcpConnection> idle = new ConcurrentLinkedDeque<>();
        private final AtomicInteger active = new AtomicInteger(0);
        private final AtomicLong totalAcquired = new AtomicLong(0);
        private final AtomicLong totalReleased = new AtomicLong(0);
        private final AtomicLong totalInvalidated = new AtomicLong(0);
        private final AtomicLong totalCreated = new AtomicLong(0);

        private SubPool(int maxTotal) {
            this.maxTotal = maxTotal;
            this.permits = new Semaphore(maxTotal, true);
        }

        private PoolStats stats() {
            int idleCount = idle.size();
            int activeCount = active.get();
            return new PoolStats(
                    activeCount + idleCount,
                    activeCount,
                    idleCount,
                    maxTotal,
                    totalAcquired.get(),
                    totalReleased.get(),
                    totalInvalidated.get(),
                    totalCreated.get()
            );
        }
    }
}
