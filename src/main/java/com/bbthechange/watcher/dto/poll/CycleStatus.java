package com.bbthechange.watcher.dto.poll;

/**
 * Terminal state of one poll cycle.
 */
public enum CycleStatus {
    /** Every group was attempted; individual groups may still have failed. */
    COMPLETED,
    /** Another runner held the cycle lock; nothing was touched. */
    SKIPPED,
    /** Stop was requested; remaining groups were skipped. */
    CANCELLED,
    /** Unexpected failure outside group processing; the lock was still released. */
    ABORTED
}
