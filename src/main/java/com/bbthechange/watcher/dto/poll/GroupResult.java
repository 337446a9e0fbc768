package com.bbthechange.watcher.dto.poll;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of processing one subscription group within a cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupResult {

    private String sourceUnit;

    private String filter;

    private boolean succeeded;

    /**
     * Set when a stop request interrupted the group; the checkpoint is then left untouched.
     */
    private boolean cancelled;

    private int itemsFetched;

    /**
     * Items newer than the watermark that were run through the matcher.
     */
    private int itemsExamined;

    private int matches;

    private int notificationsSent;

    private int duplicatesSkipped;

    private Instant previousWatermark;

    /**
     * Watermark after the group finished; equals previousWatermark when nothing advanced.
     */
    private Instant newWatermark;

    private String failureReason;
}
