package com.tcp.driver.pool;

import com.tcp.driver.chaos.ChaosConnection;
import com.tcp.driver.chaos.ChaosConnectionFactory;
import com.tcp.driver.core.AcquisitionTimeoutException;
import com.tcp.driver.core.HostAddress;
import com.tcp.driver.io.TcpConnection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPoolTest {

    private static final HostAddress H1 = HostAddress.of("h1", 1001);
    private static final HostAddress H2 = HostAddress.of("h2", 1002);

    // ========== PoolConfig Tests ==========

    @Nested
    @DisplayName("PoolConfig")
    class PoolConfigTests {

        @Test
        @DisplayName("Should create pool config with defaults")
        void testPoolConfigDefaults() {
            PoolConfig config = PoolConfig.defaults();
            assertEquals(8, config.getMaxTotalPerKey());
            assertEquals(8, config.getMaxIdlePerKey());
            assertEquals(0, config.getMinIdlePerKey());
            assertTrue(config.isTestOnBorrow());
            assertEquals(10000, config.getConnectTimeoutMs());
            assertEquals(0, config.getReadTimeoutMs());
        }

        @Test
        @DisplayName("Should reject maxIdlePerKey > maxTotalPerKey")
        void testMaxIdleValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().maxTotalPerKey(5).maxIdlePerKey(10).build());
        }

        @Test
        @DisplayName("Should reject minIdlePerKey > maxIdlePerKey")
        void testMinIdleValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().maxIdlePerKey(3).minIdlePerKey(5).build());
        }

        @Test
        @DisplayName("Should reject zero maxTotalPerKey")
        void testZeroMaxTotal() {
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().maxTotalPerKey(0));
        }

        @Test
        @DisplayName("Should read settings from a map")
        void testFromMap() {
            PoolConfig config = PoolConfig.fromMap(Map.of(
                    "maxTotalPerKey", 4,
                    "maxIdlePerKey", "2",
                    "minIdlePerKey", 1L,
                    "testOnBorrow", "false",
                    "connectTimeoutMs", 250,
                    "readTimeoutMs", 3000));

            assertEquals(4, config.getMaxTotalPerKey());
            assertEquals(2, config.getMaxIdlePerKey());
            assertEquals(1, config.getMinIdlePerKey());
            assertFalse(config.isTestOnBorrow());
            assertEquals(250, config.getConnectTimeoutMs());
            assertEquals(3000, config.getReadTimeoutMs());
        }

        @Test
        @DisplayName("Should reject unknown keys and malformed values in a map")
        void testFromMapInvalid() {
            assertThrows(IllegalArgumentException.class, () -> PoolConfig.fromMap(Map.of("maxTotal", 4)));
            assertThrows(IllegalArgumentException.class, () -> PoolConfig.fromMap(Map.of("maxTotalPerKey", "many")));
            assertThrows(IllegalArgumentException.class, () -> PoolConfig.fromMap(Map.of("testOnBorrow", "yes")));
        }

        @Test
        @DisplayName("A null map should give the defaults")
        void testFromNullMap() {
            assertEquals(8, PoolConfig.fromMap(null).getMaxTotalPerKey());
        }
    }

    // ========== PoolStats Tests ==========

    @Test
    @DisplayName("PoolStats should add up per-endpoint values")
    void testPoolStatsPlus() {
        PoolStats a = new PoolStats(3, 1, 2, 8, 10, 9, 1, 4);
        PoolStats b = new PoolStats(1, 1, 0, 8, 5, 4, 0, 1);
        PoolStats sum = a.plus(b);

        assertEquals(4, sum.totalConnections());
        assertEquals(2, sum.activeConnections());
        assertEquals(2, sum.idleConnections());
        assertEquals(16, sum.maxConnections());
        assertEquals(15, sum.totalAcquired());
        assertEquals(13, sum.totalReleased());
        assertEquals(1, sum.totalInvalidated());
        assertEquals(5, sum.totalCreated());
    }

    // ========== SimpleKeyedConnectionPool Tests ==========

    @Nested
    @DisplayName("SimpleKeyedConnectionPool")
    class KeyedPoolTests {

        private final ChaosConnectionFactory factory = new ChaosConnectionFactory();

        private SimpleKeyedConnectionPool pool(PoolConfig config) {
            return new SimpleKeyedConnectionPool(config, factory);
        }

        @Test
        @DisplayName("Should reuse a released connection")
        void testReuse() throws Exception {
            try (SimpleKeyedConnectionPool pool = pool(PoolConfig.defaults())) {
                TcpConnection first = pool.acquire(H1, 100);
                pool.release(H1, first);
                TcpConnection second = pool.acquire(H1, 100);

                assertSame(first, second);
                assertEquals(1, factory.createdFor(H1));
                PoolStats stats = pool.getStats(H1);
                assertEquals(2, stats.totalAcquired());
                assertEquals(1, stats.totalReleased());
                assertEquals(1, stats.activeConnections());
            }
        }

        @Test
        @DisplayName("Should keep endpoints in separate sub-pools")
        void testKeysSeparate() throws Exception {
            try (SimpleKeyedConnectionPool pool = pool(PoolConfig.defaults())) {
                TcpConnection c1 = pool.acquire(H1, 100);
                TcpConnection c2 = pool.acquire(H2, 100);

                assertEquals(H1, c1.getAddress());
                assertEquals(H2, c2.getAddress());
                assertEquals(1, pool.getStats(H1).activeConnections());
                assertEquals(1, pool.getStats(H2).activeConnections());
                assertEquals(2, pool.getStats().activeConnections());
                assertEquals(16, pool.getStats().maxConnections());
            }
        }

        @Test
        @DisplayName("Should close and forget an invalidated connection")
        void testInvalidate() throws Exception {
            try (SimpleKeyedConnectionPool pool = pool(PoolConfig.defaults())) {
                ChaosConnection conn = (ChaosConnection) pool.acquire(H1, 100);
                pool.invalidate(H1, conn);

                assertTrue(conn.isClosed());
                TcpConnection next = pool.acquire(H1, 100);
                assertNotSame(conn, next);
                assertEquals(1, pool.getStats(H1).totalInvalidated());
                assertEquals(2, pool.getStats(H1).totalCreated());
            }
        }

        @Test
        @DisplayName("Should time out when every connection for an endpoint is in use")
        void testTimeoutWhenExhausted() throws Exception {
            PoolConfig config = PoolConfig.builder().maxTotalPerKey(1).maxIdlePerKey(1).build();
            try (SimpleKeyedConnectionPool pool = pool(config)) {
                pool.acquire(H1, 100);

                AcquisitionTimeoutException ex = assertThrows(AcquisitionTimeoutException.class,
                        () -> pool.acquire(H1, 50));
                assertEquals(H1, ex.getEndpoint());

                // other endpoints are not affected
                assertNotNull(pool.acquire(H2, 50));
            }
        }

        @Test
        @DisplayName("Should hand a released connection to a waiting thread")
        void testWaiterServed() throws Exception {
            PoolConfig config = PoolConfig.builder().maxTotalPerKey(1).maxIdlePerKey(1).build();
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try (SimpleKeyedConnectionPool pool = pool(config)) {
                TcpConnection held = pool.acquire(H1, 100);
                CountDownLatch waiting = new CountDownLatch(1);
                Future<TcpConnection> waiter = executor.submit(() -> {
                    waiting.countDown();
                    return pool.acquire(H1, 5000);
                });

                waiting.await();
                Thread.sleep(50);
                pool.release(H1, held);

                assertSame(held, waiter.get(5, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should discard idle connections that fail validation")
        void testTestOnBorrow() throws Exception {
            try (SimpleKeyedConnectionPool pool = pool(PoolConfig.defaults())) {
                ChaosConnection conn = (ChaosConnection) pool.acquire(H1, 100);
                pool.release(H1, conn);
                conn.breakConnection();

                TcpConnection next = pool.acquire(H1, 100);

                assertNotSame(conn, next);
                assertTrue(conn.isClosed());
            }
        }

        @Test
        @DisplayName("Should free the slot when opening a connection fails")
        void testCreateFailureReleasesPermit() throws Exception {
            PoolConfig config = PoolConfig.builder().maxTotalPerKey(1).maxIdlePerKey(1).build();
            try (SimpleKeyedConnectionPool pool = pool(config)) {
                factory.setUnreachable(H1, true);
                assertThrows(ConnectException.class, () -> pool.acquire(H1, 50));
                assertThrows(ConnectException.class, () -> pool.acquire(H1, 50));

                factory.setUnreachable(H1, false);
                assertNotNull(pool.acquire(H1, 50));
            }
        }

        @Test
        @DisplayName("Should close connections beyond maxIdlePerKey on release")
        void testMaxIdle() throws Exception {
            PoolConfig config = PoolConfig.builder().maxTotalPerKey(3).maxIdlePerKey(1).build();
            try (SimpleKeyedConnectionPool pool = pool(config)) {
                ChaosConnection a = (ChaosConnection) pool.acquire(H1, 100);
                ChaosConnection b = (ChaosConnection) pool.acquire(H1, 100);
                pool.release(H1, a);
                pool.release(H1, b);

                assertFalse(a.isClosed());
                assertTrue(b.isClosed());
                assertEquals(1, pool.getStats(H1).idleConnections());
            }
        }

        @Test
        @DisplayName("Should pre-create minIdlePerKey connections on first use of an endpoint")
        void testMinIdle() throws Exception {
            PoolConfig config = PoolConfig.builder().minIdlePerKey(2).build();
            try (SimpleKeyedConnectionPool pool = pool(config)) {
                pool.acquire(H1, 100);

                assertEquals(2, factory.createdFor(H1));
                assertEquals(1, pool.getStats(H1).idleConnections());
            }
        }

        @Test
        @DisplayName("Should stop pre-creating connections once the acquire deadline has passed")
        void testMinIdleHonoursDeadline() throws Exception {
            ChaosConnectionFactory slow = new ChaosConnectionFactory() {
                @Override
                public TcpConnection create(HostAddress address) throws IOException {
                    try {
                        Thread.sleep(50);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new InterruptedIOException("interrupted");
                    }
                    return super.create(address);
                }
            };
            PoolConfig config = PoolConfig.builder().minIdlePerKey(5).build();
            try (SimpleKeyedConnectionPool pool = new SimpleKeyedConnectionPool(config, slow)) {
                assertNotNull(pool.acquire(H1, 60));

                assertTrue(slow.createdFor(H1) < 5,
                        "Prefill should give up at the deadline, created " + slow.createdFor(H1));
            }
        }

        @Test
        @DisplayName("Should close an idle connection whose validation throws")
        void testValidationErrorClosesConnection() throws Exception {
            AtomicBoolean failValidation = new AtomicBoolean(false);
            ChaosConnectionFactory throwing = new ChaosConnectionFactory() {
                @Override
                public boolean validate(TcpConnection connection) {
                    if (failValidation.get()) {
                        throw new IllegalStateException("validation write failed");
                    }
                    return super.validate(connection);
                }
            };
            try (SimpleKeyedConnectionPool pool = new SimpleKeyedConnectionPool(PoolConfig.defaults(), throwing)) {
                ChaosConnection idle = (ChaosConnection) pool.acquire(H1, 100);
                pool.release(H1, idle);

                failValidation.set(true);
                assertThrows(IllegalStateException.class, () -> pool.acquire(H1, 100));

                assertTrue(idle.isClosed());
                assertEquals(0, pool.getStats(H1).activeConnections());
                assertEquals(0, pool.getStats(H1).idleConnections());

                failValidation.set(false);
                assertNotSame(idle, pool.acquire(H1, 100));
            }
        }

        @Test
        @DisplayName("Should close idle connections and refuse acquisition after close")
        void testClose() throws Exception {
            SimpleKeyedConnectionPool pool = pool(PoolConfig.defaults());
            ChaosConnection idle = (ChaosConnection) pool.acquire(H1, 100);
            ChaosConnection active = (ChaosConnection) pool.acquire(H2, 100);
            pool.release(H1, idle);

            pool.close();

            assertTrue(pool.isClosed());
            assertTrue(idle.isClosed());
            assertThrows(IllegalStateException.class, () -> pool.acquire(H1, 100));

            pool.release(H2, active);
            assertTrue(active.isClosed(), "Connections released after close should be closed");
        }

        @Test
        @DisplayName("Should ignore null connections")
        void testNullConnection() {
            try (SimpleKeyedConnectionPool pool = pool(PoolConfig.defaults())) {
                assertDoesNotThrow(() -> pool.release(H1, null));
                assertDoesNotThrow(() -> pool.invalidate(H1, null));
            }
        }

        @Test
        @DisplayName("Should report empty stats for an unused endpoint")
        void testStatsUnknownKey() {
            try (SimpleKeyedConnectionPool pool = pool(PoolConfig.defaults())) {
                assertEquals(PoolStats.empty(), pool.getStats(H1));
                assertEquals(PoolStats.empty(), pool.getStats());
            }
        }
    }

    @Test
    @DisplayName("ConnectionFactory defaults should validate and close through the connection")
    void testFactoryDefaults() throws IOException {
        ChaosConnectionFactory factory = new ChaosConnectionFactory();
        ChaosConnection conn = (ChaosConnection) factory.create(H1);

        assertTrue(factory.validate(conn));
        factory.destroy(conn);
        assertTrue(conn.isClosed());
        assertFalse(factory.validate(conn));
    }
}
