package com.bbthechange.watcher.util;

import com.bbthechange.watcher.exception.InvalidKeyException;

/**
 * Key factory for the WatcherTable single-table design.
 * Every key written by the repositories and the DynamoDB lock goes through here.
 */
public final class WatcherKeyFactory {
    private static final String DELIMITER = "#";

    public static final String SUBSCRIPTION_PREFIX = "SUBSCRIPTION";
    public static final String CHECKPOINT_PREFIX = "CHECKPOINT";
    public static final String FILTER_PREFIX = "FILTER";
    public static final String DELIVERY_PREFIX = "DELIVERY";
    public static final String LOCK_PREFIX = "LOCK";
    public static final String METADATA_SUFFIX = "METADATA";
    public static final String LEASE_SUFFIX = "LEASE";

    private WatcherKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validatePart(String value, String type) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidKeyException(type + " cannot be null or empty");
        }
    }

    public static String getSubscriptionPk(String subscriptionId) {
        validatePart(subscriptionId, "Subscription ID");
        return SUBSCRIPTION_PREFIX + DELIMITER + subscriptionId;
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    public static String getDeliverySk(String itemId) {
        validatePart(itemId, "Item ID");
        return DELIVERY_PREFIX + DELIMITER + itemId;
    }

    public static String getCheckpointPk(String sourceUnit) {
        validatePart(sourceUnit, "Source unit");
        return CHECKPOINT_PREFIX + DELIMITER + sourceUnit;
    }

    // Filter text is kept verbatim; '#' inside a filter is harmless because it is the last key segment.
    public static String getCheckpointSk(String filter) {
        validatePart(filter, "Filter");
        return FILTER_PREFIX + DELIMITER + filter;
    }

    public static String getLockPk(String scope) {
        validatePart(scope, "Lock scope");
        return LOCK_PREFIX + DELIMITER + scope;
    }

    public static String getLeaseSk() {
        return LEASE_SUFFIX;
    }

    public static boolean isDeliveryItem(String sk) {
        return sk != null && sk.startsWith(DELIVERY_PREFIX + DELIMITER);
    }
}
