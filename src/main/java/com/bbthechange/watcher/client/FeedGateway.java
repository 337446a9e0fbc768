package com.bbthechange.watcher.client;

import com.bbthechange.watcher.dto.FeedItem;

import java.util.List;

/**
 * Read access to a content feed.
 */
public interface FeedGateway {

    /**
     * Fetch the newest items of a source-unit.
     *
     * @param sourceUnit Normalized source-unit name (subreddit without the r/ prefix)
     * @param limit Maximum number of items to return
     * @return Up to {@code limit} items in the order the feed returned them
     * @throws com.bbthechange.watcher.exception.FeedException when the feed cannot be read
     */
    List<FeedItem> fetchLatest(String sourceUnit, int limit);
}
