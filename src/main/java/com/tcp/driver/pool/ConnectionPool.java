package com.tcp.driver.pool;

import com.tcp.driver.core.AcquisitionTimeoutException;
import com.tcp.driver.core.HostAddress;
import com.tcp.driver.io.TcpConnection;

import java.io.IOException;

/**
 * Pool of {@link TcpConnection}s keyed by endpoint.
 *
 * <p>A connection obtained from {@link #acquire} is owned exclusively by the caller
 * until it is handed back through exactly one of {@link #release} or {@link #invalidate}.</p>
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * Acquires a connection for the endpoint. Blocks up to {@code timeoutMs} waiting
     * for a free slot. The wait is interrupted, and fails, if the calling thread is
     * interrupted.
     *
     * @param key       the endpoint
     * @param timeoutMs maximum time to wait
     * @return a validated connection, or {@code null} if none became available
     * @throws AcquisitionTimeoutException if the wait timed out or was interrupted
     * @throws IOException                if a new connection cannot be opened
     * @throws IllegalStateException       if the pool is closed
     */
    TcpConnection acquire(HostAddress key, long timeoutMs) throws IOException;

    /**
     * Returns a healthy connection for reuse.
     */
    void release(HostAddress key, TcpConnection connection);

    /**
     * Discards a connection believed to be broken and frees its slot.
     */
    void invalidate(HostAddress key, TcpConnection connection);

    /**
     * Returns statistics summed over all endpoints.
     */
    PoolStats getStats();

    /**
     * Returns statistics for one endpoint.
     */
    PoolStats getStats(HostAddress key);

    /**
     * Whether {@link #close} has been called. A closed pool refuses every acquisition.
     */
    boolean isClosed();

    /**
     * Closes the pool and all idle connections of every endpoint.
     */
    @Override
    void close();
}
