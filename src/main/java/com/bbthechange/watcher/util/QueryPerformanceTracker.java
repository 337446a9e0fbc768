package com.bbthechange.watcher.util;

import com.bbthechange.watcher.config.WatcherProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Times every WatcherTable call made by the repositories and the lease lock.
 * Records dynamodb.query.duration tagged by operation, table and outcome, and warns about slow calls.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);

    private final MeterRegistry meterRegistry;
    private final long slowCallThresholdNanos;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry, WatcherProperties properties) {
        this(meterRegistry, properties.getDynamodb().getSlowCallThreshold());
    }

    public QueryPerformanceTracker(MeterRegistry meterRegistry, Duration slowCallThreshold) {
        this.meterRegistry = meterRegistry;
        this.slowCallThresholdNanos = slowCallThreshold.toNanos();
    }

    /**
     * Run a store call and record how long it took.
     *
     * @param operation The operation name for logging/metrics
     * @param table The table name being accessed
     * @param queryOperation The call to execute; its exceptions pass through unchanged
     * @return The result of the call
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        RuntimeException failure = null;
        try {
            return queryOperation.get();
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            long elapsedNanos = sample.stop(Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", failure == null ? "success" : "error")
                .register(meterRegistry));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);

            if (failure != null) {
                logger.error("DynamoDB call failed: operation={}, table={}, duration={}ms, error={}",
                    operation, table, elapsedMs, failure.getMessage());
            } else if (elapsedNanos > slowCallThresholdNanos) {
                logger.warn("Slow DynamoDB call: operation={}, table={}, duration={}ms",
                    operation, table, elapsedMs);
            } else {
                logger.trace("DynamoDB call: operation={}, table={}, duration={}ms", operation, table, elapsedMs);
            }
        }
    }
}
