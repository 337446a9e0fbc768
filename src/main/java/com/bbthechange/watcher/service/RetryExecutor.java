package com.bbthechange.watcher.service;

import com.bbthechange.watcher.config.WatcherProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Runs calls to external collaborators with bounded exponential backoff.
 * Waits base, 2*base, 4*base... between attempts; only failures the classifier marks recoverable are retried.
 */
@Component
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private static final long CANCELLATION_POLL_MS = 200L;

    private final int maxAttempts;
    private final long baseDelayMs;
    private final FailureClassifier classifier;
    private final MeterRegistry meterRegistry;

    @Autowired
    public RetryExecutor(WatcherProperties properties, FailureClassifier classifier, MeterRegistry meterRegistry) {
        this(properties.getRetry().getMaxAttempts(), properties.getRetry().getBaseDelay(), classifier, meterRegistry);
    }

    public RetryExecutor(int maxAttempts, Duration baseDelay, FailureClassifier classifier, MeterRegistry meterRegistry) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelay.toMillis();
        this.classifier = classifier;
        this.meterRegistry = meterRegistry;
    }

    public <T> T execute(String operationName, Callable<T> operation) throws Exception {
        return execute(operationName, operation, () -> false);
    }

    /**
     * Run the operation until it succeeds, fails permanently, or runs out of attempts.
     * A backoff wait ends early once {@code cancelled} reports true.
     *
     * @param operationName Name used in logs and the operation metric tag
     * @param operation The call to make
     * @param cancelled Stop signal checked while waiting between attempts
     * @return The operation's result
     * @throws CancellationException if cancelled during a backoff wait
     * @throws Exception the last failure, unchanged
     */
    public <T> T execute(String operationName, Callable<T> operation, BooleanSupplier cancelled) throws Exception {
        int attempt = 1;
        while (true) {
            meterRegistry.counter("watcher_retry_attempts", "operation", operationName).increment();
            try {
                T result = operation.call();
                if (attempt > 1) {
                    logger.info("{} succeeded on attempt {}/{}", operationName, attempt, maxAttempts);
                }
                return result;

            } catch (Exception e) {
                if (!classifier.isRecoverable(e)) {
                    logger.warn("{} failed permanently on attempt {}/{}: {}",
                            operationName, attempt, maxAttempts, e.getMessage());
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    meterRegistry.counter("watcher_retry_exhausted", "operation", operationName).increment();
                    logger.error("{} failed after {} attempts: {}", operationName, attempt, e.getMessage());
                    throw e;
                }

                long delayMs = delayForAttempt(attempt);
                logger.warn("{} failed (attempt {}/{}). Retrying in {}ms: {}",
                        operationName, attempt, maxAttempts, delayMs, e.getMessage());
                try {
                    sleep(delayMs, cancelled);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("{} retry interrupted; giving up", operationName);
                    throw e;
                }
                if (cancelled.getAsBoolean()) {
                    logger.info("{} retry abandoned after attempt {}: stop requested", operationName, attempt);
                    CancellationException cancellation = new CancellationException(operationName);
                    cancellation.initCause(e);
                    throw cancellation;
                }
                attempt++;
            }
        }
    }

    /**
     * Delay before the retry that follows the given (1-based) failed attempt.
     */
    long delayForAttempt(int attempt) {
        return baseDelayMs * (1L << Math.min(attempt - 1, 30));
    }

    /**
     * Sleep for the specified duration, waking early when cancelled.
     * Package-private for testing.
     */
    void sleep(long millis, BooleanSupplier cancelled) throws InterruptedException {
        long deadline = System.nanoTime() + millis * 1_000_000L;
        long remainingMs = millis;
        while (remainingMs > 0 && !cancelled.getAsBoolean()) {
            Thread.sleep(Math.min(remainingMs, CANCELLATION_POLL_MS));
            remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
        }
    }
}
