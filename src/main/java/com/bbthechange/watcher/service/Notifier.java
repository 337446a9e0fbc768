package com.bbthechange.watcher.service;

import com.bbthechange.watcher.dto.FeedItem;
import com.bbthechange.watcher.model.Subscription;

/**
 * Delivers one match notification to one subscriber.
 */
public interface Notifier {

    /**
     * Send the notification. Returning normally means the transport accepted it.
     *
     * @throws com.bbthechange.watcher.exception.NotificationException when the transport refuses or fails
     */
    void send(Subscription subscription, FeedItem item, String filter);
}
