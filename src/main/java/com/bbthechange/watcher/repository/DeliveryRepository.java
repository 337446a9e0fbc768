package com.bbthechange.watcher.repository;

import com.bbthechange.watcher.model.Delivery;

/**
 * Repository interface for the record of which item was delivered to which subscription.
 */
public interface DeliveryRepository {

    boolean exists(String subscriptionId, String itemId);

    /**
     * Insert a delivery record if none exists for its (subscription, item) key.
     *
     * @param delivery The delivery to record
     * @return true if inserted, false if a record for the same key was already present
     */
    boolean record(Delivery delivery);
}
