package com.bbthechange.watcher.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Tunables for the poll cycle, retries, locking, storage and notifications.
 * Bound from watcher.* and validated at startup.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "watcher")
public class WatcherProperties {

    @Valid
    private final Poller poller = new Poller();

    @Valid
    private final Retry retry = new Retry();

    @Valid
    private final Lock lock = new Lock();

    @Valid
    private final Dynamodb dynamodb = new Dynamodb();

    @Valid
    private final Notifier notifier = new Notifier();

    public Poller getPoller() {
        return poller;
    }

    public Retry getRetry() {
        return retry;
    }

    public Lock getLock() {
        return lock;
    }

    public Dynamodb getDynamodb() {
        return dynamodb;
    }

    public Notifier getNotifier() {
        return notifier;
    }

    public static class Poller {

        /**
         * Newest items requested from each source-unit per cycle.
         */
        @Min(1)
        private int fetchLimit = 100;

        /**
         * Pause between cycles in continuous mode.
         */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration interval = Duration.ofSeconds(900);

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public int getFetchLimit() {
            return fetchLimit;
        }

        public void setFetchLimit(int fetchLimit) {
            this.fetchLimit = fetchLimit;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration baseDelay = Duration.ofSeconds(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }
    }

    public static class Lock {

        /**
         * Lock file path for the file lock, lease name for the DynamoDB lock.
         */
        @NotBlank
        private String scope = System.getProperty("java.io.tmpdir") + "/feed-watcher.lock";

        /**
         * "file" or "dynamodb".
         */
        @Pattern(regexp = "file|dynamodb")
        private String type = "file";

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration leaseDuration = Duration.ofMinutes(30);

        public String getScope() {
            return scope;
        }

        public void setScope(String scope) {
            this.scope = scope;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }
    }

    public static class Dynamodb {

        @NotBlank
        private String tableName = "WatcherTable";

        /**
         * Create the table at startup when it does not exist (local development).
         */
        private boolean createTable = false;

        /**
         * Store calls slower than this are logged at WARN.
         */
        @NotNull
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration slowCallThreshold = Duration.ofMillis(500);

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public boolean isCreateTable() {
            return createTable;
        }

        public void setCreateTable(boolean createTable) {
            this.createTable = createTable;
        }

        public Duration getSlowCallThreshold() {
            return slowCallThreshold;
        }

        public void setSlowCallThreshold(Duration slowCallThreshold) {
            this.slowCallThreshold = slowCallThreshold;
        }
    }

    public static class Notifier {

        private String fromAddress;

        /**
         * Log notifications instead of sending them.
         */
        private boolean dryRun = false;

        public String getFromAddress() {
            return fromAddress;
        }

        public void setFromAddress(String fromAddress) {
            this.fromAddress = fromAddress;
        }

        public boolean isDryRun() {
            return dryRun;
        }

        public void setDryRun(boolean dryRun) {
            this.dryRun = dryRun;
        }
    }
}
