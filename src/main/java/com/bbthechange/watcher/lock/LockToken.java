package com.bbthechange.watcher.lock;

import java.time.Instant;

/**
 * Proof of one successful acquire.
 */
public record LockToken(String scope, String owner, Instant acquiredAt) {
}
