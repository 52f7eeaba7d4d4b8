package com.tcp.driver.chaos;

import com.tcp.driver.api.TcpDriver;
import com.tcp.driver.core.HostAddress;
import com.tcp.driver.pool.PoolStats;
import com.tcp.driver.routing.DefaultRoutingPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Failover behavior under concurrent load with injected endpoint failures.
 */
class ChaosTest {

    private static final HostAddress UP_1 = HostAddress.of("up-1", 7001);
    private static final HostAddress UP_2 = HostAddress.of("up-2", 7002);
    private static final HostAddress DOWN = HostAddress.of("down", 7003);

    @Test
    @DisplayName("Concurrent sends should all succeed while one endpoint is unreachable")
    void testConcurrentFailover() throws Exception {
        ChaosConnectionFactory factory = new ChaosConnectionFactory();
        factory.setUnreachable(DOWN, true);

        try (TcpDriver driver = TcpDriver.builder()
                .hosts(List.of(UP_1, UP_2, DOWN))
                .poolConf(Map.of("maxTotalPerKey", 4, "maxIdlePerKey", 4))
                .connectionFactory(factory)
                .build()) {

            ExecutorService executor = Executors.newFixedThreadPool(8);
            List<Future<HostAddress>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                results.add(executor.submit(() -> driver.send(c -> {
                    Thread.sleep(1);
                    return c.getAddress();
                }, 2000)));
            }
            for (Future<HostAddress> result : results) {
                assertNotEquals(DOWN, result.get(10, TimeUnit.SECONDS));
            }
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

            assertEquals(0, factory.createdFor(DOWN));
            PoolStats stats = driver.getPoolStats();
            assertEquals(0, stats.activeConnections());
            assertTrue(stats.totalCreated() <= 8, "At most maxTotalPerKey connections per healthy endpoint");
        }
    }

    @Test
    @DisplayName("Every acquired connection should be either released or invalidated")
    void testConnectionAccounting() throws Exception {
        ChaosConnectionFactory factory = new ChaosConnectionFactory();
        AtomicInteger failures = new AtomicInteger();

        // failures are injected at random, so let a failed endpoint straight back into rotation
        DefaultRoutingPolicy forgiving = new DefaultRoutingPolicy(List.of(UP_1, UP_2)) {
            @Override
            public void onError(HostAddress address, Throwable cause) {
                unblacklist(address);
            }
        };

        try (TcpDriver driver = TcpDriver.builder()
                .routingPolicy(forgiving)
                .retryLimit(50)
                .connectionFactory(factory)
                .build()) {

            ExecutorService executor = Executors.newFixedThreadPool(4);
            List<Future<?>> tasks = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                tasks.add(executor.submit(() -> {
                    try {
                        driver.send(c -> {
                            if (ThreadLocalRandom.current().nextInt(4) == 0) {
                                failures.incrementAndGet();
                                throw new IOException("injected");
                            }
                            return "ok";
                        }, 2000);
                    } catch (RuntimeException e) {
                        // exhausting the retries is possible but rare; accounting still has to hold
                    }
                }));
            }
            for (Future<?> task : tasks) {
                task.get(10, TimeUnit.SECONDS);
            }
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

            PoolStats stats = driver.getPoolStats();
            assertEquals(0, stats.activeConnections());
            assertEquals(stats.totalAcquired(), stats.totalReleased() + stats.totalInvalidated());
            assertEquals(failures.get(), stats.totalInvalidated());
        }
    }
}
