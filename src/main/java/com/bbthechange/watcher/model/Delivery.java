package com.bbthechange.watcher.model;

import com.bbthechange.watcher.util.InstantAsLongAttributeConverter;
import com.bbthechange.watcher.util.WatcherKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * Record that a feed item was sent to a subscription.
 *
 * Key Pattern: PK = SUBSCRIPTION#{subscriptionId}, SK = DELIVERY#{itemId}
 * Written once with attribute_not_exists(pk), never updated.
 */
@DynamoDbBean
public class Delivery extends BaseItem {

    public static final String ITEM_TYPE = "DELIVERY";

    private String subscriptionId;
    private String itemId;
    private String sourceUnit;
    private Instant deliveredAt;

    // Default constructor for DynamoDB
    public Delivery() {
        setItemType(ITEM_TYPE);
    }

    public Delivery(String subscriptionId, String itemId, String sourceUnit) {
        setItemType(ITEM_TYPE);
        this.subscriptionId = subscriptionId;
        this.itemId = itemId;
        this.sourceUnit = sourceUnit;
        this.deliveredAt = Instant.now();

        setPk(WatcherKeyFactory.getSubscriptionPk(subscriptionId));
        setSk(WatcherKeyFactory.getDeliverySk(itemId));
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public void setSubscriptionId(String subscriptionId) {
        this.subscriptionId = subscriptionId;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getSourceUnit() {
        return sourceUnit;
    }

    public void setSourceUnit(String sourceUnit) {
        this.sourceUnit = sourceUnit;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    public void setDeliveredAt(Instant deliveredAt) {
        this.deliveredAt = deliveredAt;
    }
}
