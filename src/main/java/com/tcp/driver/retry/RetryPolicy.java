package com.tcp.driver.retry;

import java.util.function.Supplier;

/**
 * Decides how often, and with what spacing, a failed operation is run again.
 */
public interface RetryPolicy {

    /**
     * Runs the operation, repeating it after failures as the policy allows.
     *
     * @param operation the operation to run
     * @param <T>       result type
     * @return the result of the first successful run
     * @throws RuntimeException the last failure, unchanged, once the policy gives up
     */
    <T> T withRetry(Supplier<T> operation);
}
