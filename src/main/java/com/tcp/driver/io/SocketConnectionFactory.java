package com.tcp.driver.io;

import com.tcp.driver.core.HostAddress;
import com.tcp.driver.pool.ConnectionFactory;
import com.tcp.driver.pool.PoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Opens {@link SocketTcpConnection}s using the timeouts from {@link PoolConfig}.
 */
public class SocketConnectionFactory implements ConnectionFactory {
    private static final Logger log = LoggerFactory.getLogger(SocketConnectionFactory.class);

    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public SocketConnectionFactory(PoolConfig config) {
        this(config.getConnectTimeoutMs(), config.getReadTimeoutMs());
    }

    public SocketConnectionFactory(int connectTimeoutMs, int readTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    @Override
    public TcpConnection create(HostAddress address) throws IOException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.setKeepAlive(true);
            socket.setSoTimeout(readTimeoutMs);
            socket.connect(new InetSocketAddress(address.host(), address.port()), connectTimeoutMs);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
        log.debug("Opened connection to {}", address);
        return new SocketTcpConnection(address, socket);
    }
}
