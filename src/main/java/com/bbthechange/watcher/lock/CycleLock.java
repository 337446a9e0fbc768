package com.bbthechange.watcher.lock;

import java.util.Optional;

/**
 * Named mutual-exclusion capability held for the duration of one poll cycle.
 * At most one holder exists at a time across every process sharing the scope.
 */
public interface CycleLock {

    /**
     * Try to take the lock without blocking.
     *
     * @return a token identifying this hold, or empty when another holder has it
     */
    Optional<LockToken> tryAcquire();

    /**
     * Give the lock back. Idempotent; releasing an unknown or already released token does nothing.
     * Never throws.
     */
    void release(LockToken token);
}
