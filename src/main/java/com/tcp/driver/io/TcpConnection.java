package com.tcp.driver.io;

import com.tcp.driver.core.HostAddress;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A long-lived connection to one endpoint, handed out by a pool.
 * The driver treats it as opaque; byte-level I/O is up to the caller's operation.
 */
public interface TcpConnection extends AutoCloseable {

    /**
     * Returns the endpoint this connection is bound to.
     */
    HostAddress getAddress();

    /**
     * Returns the stream to read bytes sent by the server.
     *
     * @throws IOException if the connection is closed
     */
    InputStream getInputStream() throws IOException;

    /**
     * Returns the stream to write bytes to the server.
     *
     * @throws IOException if the connection is closed
     */
    OutputStream getOutputStream() throws IOException;

    /**
     * Checks if the connection is still usable. Called by the pool before handing
     * out an idle connection.
     *
     * @return true if connected and not closed
     */
    boolean isValid();

    @Override
    void close();
}
