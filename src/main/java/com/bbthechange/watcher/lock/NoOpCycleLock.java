package com.bbthechange.watcher.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Lock that always succeeds. Only used when the runner is started with --no-lock.
 */
public class NoOpCycleLock implements CycleLock {

    private static final Logger logger = LoggerFactory.getLogger(NoOpCycleLock.class);

    @Override
    public Optional<LockToken> tryAcquire() {
        logger.warn("Cycle lock bypassed (--no-lock); concurrent runners may send duplicate notifications");
        return Optional.of(new LockToken("none", UUID.randomUUID().toString(), Instant.now()));
    }

    @Override
    public void release(LockToken token) {
        // nothing held
    }
}
