package com.tcp.driver.io;

import com.tcp.driver.core.HostAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

/**
 * {@link TcpConnection} over a plain blocking {@link Socket}.
 */
public class SocketTcpConnection implements TcpConnection {
    private static final Logger log = LoggerFactory.getLogger(SocketTcpConnection.class);

    private final HostAddress address;
    private final Socket socket;

    public SocketTcpConnection(HostAddress address, Socket socket) {
        this.address = address;
        this.socket = socket;
    }

    @Override
    public HostAddress getAddress() {
        return address;
    }

    @Override
    public InputStream getInputStream() throws IOException {
        return socket.getInputStream();
    }

    @Override
    public OutputStream getOutputStream() throws IOException {
        return socket.getOutputStream();
    }

    @Override
    public boolean isValid() {
        return socket.isConnected() && !socket.isClosed()
                && !socket.isInputShutdown() && !socket.isOutputShutdown();
    }

    @Override
    public void close() {
        try {
            socket.close();
        } catch (IOException e) {
            log.warn("Error closing socket to {}: {}", address, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "SocketTcpConnection{" + address + ", local=" + socket.getLocalPort() + '}';
    }
}
