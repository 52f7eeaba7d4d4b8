package com.tcp.driver.pool;

/**
 * Statistics for a {@link ConnectionPool}, either for one endpoint or summed over all of them.
 *
 * @param totalConnections  total number of managed connections (active + idle)
 * @param activeConnections connections currently acquired
 * @param idleConnections   connections available for acquisition
 * @param maxConnections    upper bound on total connections
 * @param totalAcquired     cumulative acquire count since pool creation
 * @param totalReleased     cumulative release count since pool creation
 * @param totalInvalidated  cumulative invalidation count since pool creation
 * @param totalCreated      cumulative connection creation count
 */
public record PoolStats(
        int totalConnections,
        int activeConnections,
        int idleConnections,
        int maxConnections,
        long totalAcquired,
        long totalReleased,
        long totalInvalidated,
        long totalCreated
) {

    public static PoolStats empty() {
        return new PoolStats(0, 0, 0, 0, 0, 0, 0, 0);
    }

    public PoolStats plus(PoolStats other) {
        return new PoolStats(
                totalConnections + other.totalConnections,
                activeConnections + other.activeConnections,
                idleConnections + other.idleConnections,
                maxConnections + other.maxConnections,
                totalAcquired + other.totalAcquired,
                totalReleased + other.totalReleased,
                totalInvalidated + other.totalInvalidated,
                totalCreated + other.totalCreated
        );
    }
}
