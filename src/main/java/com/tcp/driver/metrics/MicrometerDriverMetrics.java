package com.tcp.driver.metrics;

import com.tcp.driver.core.AttemptException;
import com.tcp.driver.core.HostAddress;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link DriverMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code tcp.driver.send.duration} - Timer (tag: outcome)</li>
 *   <li>{@code tcp.driver.attempt.failures} - Counter (tags: endpoint, kind)</li>
 *   <li>{@code tcp.driver.blacklisted} - Counter (tag: endpoint)</li>
 *   <li>{@code tcp.driver.call.retries} - Counter</li>
 * </ul>
 */
public class MicrometerDriverMetrics implements DriverMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer successTimer;
    private final Timer failureTimer;
    private final Counter callRetryCounter;

    public MicrometerDriverMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.successTimer = sendTimer(registry, "success");
        this.failureTimer = sendTimer(registry, "failure");
        this.callRetryCounter = Counter.builder("tcp.driver.call.retries")
                .description("Number of whole-call retries performed by the retry policy")
                .register(registry);
    }

    private static Timer sendTimer(MeterRegistry registry, String outcome) {
        return Timer.builder("tcp.driver.send.duration")
                .description("Duration of send calls, retries included")
                .tag("outcome", outcome)
                .register(registry);
    }

    @Override
    public void recordSend(Duration duration, boolean success) {
        (success ? successTimer : failureTimer).record(duration);
    }

    @Override
    public void incrementAttemptFailure(HostAddress endpoint, AttemptException.FailureKind kind) {
        String key = "failure:" + endpoint + ":" + kind.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("tcp.driver.attempt.failures")
                        .description("Failed attempts against an endpoint")
                        .tag("endpoint", endpoint.toString())
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();
    }

    @Override
    public void incrementBlacklisted(HostAddress endpoint) {
        counterCache.computeIfAbsent("blacklisted:" + endpoint, k ->
                Counter.builder("tcp.driver.blacklisted")
                        .description("Endpoints blacklisted after a failed attempt")
                        .tag("endpoint", endpoint.toString())
                        .register(registry)
        ).increment();
    }

    @Override
    public void incrementCallRetry() {
        callRetryCounter.increment();
    }
}
