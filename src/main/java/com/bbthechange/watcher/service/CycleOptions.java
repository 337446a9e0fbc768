package com.bbthechange.watcher.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-run knobs for a poll cycle.
 *
 * @param cancellation Flag checked before every group and item; set it to stop the cycle early
 * @param bypassLock Skip the cycle lock (debugging only)
 */
public record CycleOptions(AtomicBoolean cancellation, boolean bypassLock) {

    public static CycleOptions defaults() {
        return new CycleOptions(new AtomicBoolean(false), false);
    }

    public boolean isCancelled() {
        return cancellation.get();
    }
}
