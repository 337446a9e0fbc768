package com.bbthechange.watcher.service;

import com.bbthechange.watcher.dto.poll.CycleResult;

/**
 * Service for running a watch cycle: aggregate subscriptions, fetch new items,
 * notify matching subscribers, then advance each group's checkpoint.
 */
public interface PollerService {

    /**
     * Run one full cycle under the cycle lock.
     * Never throws for per-group failures; they are reported in the result.
     *
     * @param options Cancellation flag and lock bypass
     * @return Outcome and statistics for the cycle
     */
    CycleResult runCycle(CycleOptions options);
}
