package com.bbthechange.watcher.repository;

import com.bbthechange.watcher.model.Subscription;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the subscription registry.
 * The poller only reads from it; writes come from whatever manages subscriptions.
 */
public interface SubscriptionRepository {

    /**
     * Load every active subscription.
     * Scans the whole table page by page, so callers should treat the result as a snapshot.
     *
     * @return Active subscriptions in no particular order
     */
    List<Subscription> findAllActive();

    Subscription save(Subscription subscription);

    Optional<Subscription> findById(String subscriptionId);

    /**
     * Delete a subscription together with all of its delivery records.
     * Idempotent - succeeds when the subscription does not exist.
     *
     * @return Number of delivery records removed along with it
     */
    int delete(String subscriptionId);
}
