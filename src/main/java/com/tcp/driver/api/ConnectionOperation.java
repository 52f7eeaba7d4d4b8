package com.tcp.driver.api;

import com.tcp.driver.io.TcpConnection;

/**
 * Work performed with a pooled connection. Any exception it throws marks the
 * connection as broken: the connection is invalidated rather than returned to the pool.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ConnectionOperation<T> {

    T apply(TcpConnection connection) throws Exception;
}
