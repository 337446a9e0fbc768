package com.bbthechange.watcher.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One piece of content fetched from a source-unit (one Reddit post).
 * Owned by the feed; fetched fresh every cycle and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedItem {

    private String id;

    private String sourceUnit;

    private String title;

    private String body;

    private Instant createdAt;

    /**
     * Absolute URL of the post.
     */
    private String permalink;
}
