package com.tcp.driver.pool;

import com.tcp.driver.core.HostAddress;
import com.tcp.driver.io.TcpConnection;

import java.io.IOException;

/**
 * Creates and validates the physical connections held by a {@link ConnectionPool}.
 */
public interface ConnectionFactory {

    /**
     * Opens a new connection to the given endpoint.
     *
     * @param address the endpoint
     * @return a connected connection
     * @throws IOException if the endpoint cannot be reached
     */
    TcpConnection create(HostAddress address) throws IOException;

    /**
     * Checks an idle connection before it is handed out again.
     */
    default boolean validate(TcpConnection connection) {
        return connection.isValid();
    }

    /**
     * Disposes of a connection that leaves the pool.
     */
    default void destroy(TcpConnection connection) {
        connection.close();
    }
}
