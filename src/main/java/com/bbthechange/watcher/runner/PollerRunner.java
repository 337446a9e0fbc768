package com.bbthechange.watcher.runner;

import com.bbthechange.watcher.config.WatcherProperties;
import com.bbthechange.watcher.dto.poll.CycleResult;
import com.bbthechange.watcher.service.CycleOptions;
import com.bbthechange.watcher.service.PollerService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the poller from the command line.
 *
 * <pre>
 *   --once                        run a single cycle and exit (default)
 *   --continuous [--interval=N]   run a cycle every N seconds until stopped
 *   --no-lock                     skip the cycle lock (debugging only)
 * </pre>
 *
 * On shutdown the in-flight cycle is asked to stop and given watcher.poller.shutdown-timeout to release its lock.
 */
@Component
@Order(10)
@ConditionalOnProperty(name = "watcher.runner.enabled", havingValue = "true", matchIfMissing = true)
public class PollerRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(PollerRunner.class);

    static final String ONCE = "once";
    static final String CONTINUOUS = "continuous";
    static final String INTERVAL = "interval";
    static final String NO_LOCK = "no-lock";
    private static final Set<String> KNOWN_OPTIONS = Set.of(ONCE, CONTINUOUS, INTERVAL, NO_LOCK);

    private final PollerService pollerService;
    private final Duration defaultInterval;
    private final Duration shutdownTimeout;

    private final AtomicBoolean cancellation = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean running;

    public PollerRunner(PollerService pollerService, WatcherProperties properties) {
        this.pollerService = pollerService;
        this.defaultInterval = properties.getPoller().getInterval();
        this.shutdownTimeout = properties.getPoller().getShutdownTimeout();
    }

    @Override
    public void run(ApplicationArguments args) {
        validate(args);
        boolean continuous = args.containsOption(CONTINUOUS);
        CycleOptions options = new CycleOptions(cancellation, args.containsOption(NO_LOCK));

        running = true;
        try {
            if (continuous) {
                runContinuously(options, resolveInterval(args));
            } else {
                CycleResult result = pollerService.runCycle(options);
                logger.info("Single cycle finished with status {}", result.getStatus());
            }
        } finally {
            running = false;
            finished.countDown();
        }
    }

    private void runContinuously(CycleOptions options, Duration interval) {
        logger.info("Running continuously every {}s", interval.toSeconds());
        while (!cancellation.get()) {
            pollerService.runCycle(options);
            if (cancellation.get()) {
                break;
            }
            logger.info("Next cycle in {}s", interval.toSeconds());
            try {
                if (stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Interrupted while waiting for next cycle");
                break;
            }
        }
        logger.info("Continuous polling stopped");
    }

    /**
     * Ask the current cycle to stop and wait for it to let go of the lock.
     */
    @PreDestroy
    public void stop() {
        cancellation.set(true);
        stopSignal.countDown();
        if (!running) {
            return;
        }
        logger.info("Stop requested; waiting up to {}s for the current cycle", shutdownTimeout.toSeconds());
        try {
            if (!finished.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Cycle did not finish within {}s of the stop request", shutdownTimeout.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void validate(ApplicationArguments args) {
        for (String option : args.getOptionNames()) {
            // Dotted names are Spring property overrides such as --watcher.lock.type=dynamodb
            if (!KNOWN_OPTIONS.contains(option) && !option.contains(".")) {
                throw new IllegalArgumentException("Unknown option --" + option
                        + " (expected --once, --continuous [--interval=SECONDS], --no-lock)");
            }
        }
        if (!args.getNonOptionArgs().isEmpty()) {
            throw new IllegalArgumentException("Unexpected arguments: " + args.getNonOptionArgs());
        }
        if (args.containsOption(ONCE) && args.containsOption(CONTINUOUS)) {
            throw new IllegalArgumentException("--once and --continuous cannot be combined");
        }
        if (args.containsOption(INTERVAL) && !args.containsOption(CONTINUOUS)) {
            throw new IllegalArgumentException("--interval only applies with --continuous");
        }
    }

    private Duration resolveInterval(ApplicationArguments args) {
        List<String> values = args.getOptionValues(INTERVAL);
        if (values == null || values.isEmpty()) {
            return defaultInterval;
        }
        try {
            long seconds = Long.parseLong(values.get(values.size() - 1).trim());
            if (seconds < 1) {
                throw new IllegalArgumentException("--interval must be at least 1 second");
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--interval must be a whole number of seconds", e);
        }
    }
}
