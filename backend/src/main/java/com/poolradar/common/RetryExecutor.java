package com.poolradar.common;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;

/**
 * Runs an operation with exponential-backoff retry. Every attempt is a full invocation of the operation;
 * after {@code maxRetries + 1} failed attempts the last error is rethrown.
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy retryPolicy) {
        this(retryPolicy, Thread::sleep);
    }

    RetryExecutor(RetryPolicy retryPolicy, Sleeper sleeper) {
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.sleeper = sleeper;
    }

    public <T> T run(Callable<T> operation) throws Exception {
        return run(operation, retryPolicy.getMaxRetries());
    }

    /**
     * @param operation  the call to attempt
     * @param maxRetries retries after the first attempt
     * @return the first successful result
     * @throws Exception the last failure once attempts are exhausted
     */
    public <T> T run(Callable<T> operation, int maxRetries) throws Exception {
        Exception lastError = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return operation.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                lastError = e;
                if (attempt < maxRetries) {
                    long delay = retryPolicy.delayMs(attempt);
                    log.debug("Attempt {}/{} failed, retrying in {}ms: {}", attempt + 1, maxRetries + 1, delay, e.getMessage());
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw ie;
                    }
                }
            }
        }
        throw lastError;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /** Backoff sleep; interruptible. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
