package com.tcp.driver.logging;

import com.tcp.driver.core.HostAddress;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * MDC scope for driver logging. A send call opens one with {@link #forSend}, and each
 * failover attempt opens a nested one with {@link #forAttempt} naming the endpoint
 * actually used. Closing a scope puts back whatever values the enclosing scope had.
 *
 * <pre>
 * try (LogContext send = LogContext.forSend(LogContext.generateCorrelationId(), null)) {
 *     try (LogContext attempt = LogContext.forAttempt(host, 0)) {
 *         log.debug("acquiring");   // endpoint=host, attempt=0
 *     }
 *     // endpoint=any again
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";
    public static final String ENDPOINT = "endpoint";
    public static final String ATTEMPT = "attempt";

    /** {@link #ENDPOINT} value while the routing policy has not picked one yet. */
    public static final String ANY_ENDPOINT = "any";

    // previous MDC value per key set by this scope, null when the key was absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext open() {
        return new LogContext();
    }

    /**
     * Scope of one send call.
     *
     * @param endpoint the explicit endpoint, or {@code null} when routing chooses
     */
    public static LogContext forSend(String correlationId, HostAddress endpoint) {
        return open()
                .with(CORRELATION_ID, correlationId)
                .with(OPERATION, "send")
                .with(ENDPOINT, endpoint != null ? endpoint.toString() : ANY_ENDPOINT);
    }

    /**
     * Scope of one attempt within a send call.
     */
    public static LogContext forAttempt(HostAddress endpoint, int attemptIndex) {
        return open()
                .with(ENDPOINT, endpoint.toString())
                .with(ATTEMPT, Integer.toString(attemptIndex));
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        List<Map.Entry<String, String>> entries = new ArrayList<>(previous.entrySet());
        for (int i = entries.size() - 1; i >= 0; i--) {
            Map.Entry<String, String> entry = entries.get(i);
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
