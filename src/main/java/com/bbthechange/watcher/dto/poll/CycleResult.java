package com.bbthechange.watcher.dto.poll;

import java.util.Collections;
import java.util.List;

/**
 * Result object for one poll cycle.
 * Contains statistics about the run and per-group outcomes.
 */
public class CycleResult {

    private final CycleStatus status;
    private final List<GroupResult> groupResults;
    private final long durationMs;

    private CycleResult(CycleStatus status, List<GroupResult> groupResults, long durationMs) {
        this.status = status;
        this.groupResults = groupResults;
        this.durationMs = durationMs;
    }

    public static CycleResult completed(List<GroupResult> groupResults, long durationMs) {
        return new CycleResult(CycleStatus.COMPLETED, List.copyOf(groupResults), durationMs);
    }

    public static CycleResult cancelled(List<GroupResult> groupResults, long durationMs) {
        return new CycleResult(CycleStatus.CANCELLED, List.copyOf(groupResults), durationMs);
    }

    public static CycleResult aborted(List<GroupResult> groupResults, long durationMs) {
        return new CycleResult(CycleStatus.ABORTED, List.copyOf(groupResults), durationMs);
    }

    /**
     * Create a CycleResult for when another runner holds the lock (skip scenario).
     */
    public static CycleResult skipped(long durationMs) {
        return new CycleResult(CycleStatus.SKIPPED, Collections.emptyList(), durationMs);
    }

    public CycleStatus getStatus() {
        return status;
    }

    public List<GroupResult> getGroupResults() {
        return groupResults;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public int getGroupsScanned() {
        return groupResults.size();
    }

    public int getGroupsFailed() {
        return (int) groupResults.stream().filter(r -> !r.isSucceeded()).count();
    }

    public int getItemsExamined() {
        return groupResults.stream().mapToInt(GroupResult::getItemsExamined).sum();
    }

    public int getMatches() {
        return groupResults.stream().mapToInt(GroupResult::getMatches).sum();
    }

    public int getNotificationsSent() {
        return groupResults.stream().mapToInt(GroupResult::getNotificationsSent).sum();
    }

    @Override
    public String toString() {
        return "CycleResult{" +
                "status=" + status +
                ", groupsScanned=" + getGroupsScanned() +
                ", groupsFailed=" + getGroupsFailed() +
                ", itemsExamined=" + getItemsExamined() +
                ", matches=" + getMatches() +
                ", notificationsSent=" + getNotificationsSent() +
                ", durationMs=" + durationMs +
                '}';
    }
}
