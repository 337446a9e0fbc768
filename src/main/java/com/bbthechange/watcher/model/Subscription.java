package com.bbthechange.watcher.model;

import com.bbthechange.watcher.util.WatcherKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.Objects;

/**
 * Subscription entity for the WatcherTable.
 * One subscriber watching one source-unit (subreddit) for one keyword filter.
 *
 * Key Pattern: PK = SUBSCRIPTION#{subscriptionId}, SK = METADATA
 * Deliveries for the subscription share its partition so removing the subscription removes them too.
 */
@DynamoDbBean
public class Subscription extends BaseItem {

    public static final String ITEM_TYPE = "SUBSCRIPTION";

    private String subscriptionId;
    private String subscriberId;
    private String subscriberEmail;     // Denormalized contact address used by the notifier
    private String sourceUnit;
    private String filter;
    private boolean active;

    // Default constructor for DynamoDB
    public Subscription() {
        super();
        setItemType(ITEM_TYPE);
    }

    /**
     * Create a new active Subscription with required fields.
     */
    public Subscription(String subscriptionId, String subscriberId, String subscriberEmail,
                        String sourceUnit, String filter) {
        super();
        setItemType(ITEM_TYPE);
        this.subscriptionId = subscriptionId;
        this.subscriberId = subscriberId;
        this.subscriberEmail = subscriberEmail;
        this.sourceUnit = sourceUnit;
        this.filter = filter;
        this.active = true;

        setPk(WatcherKeyFactory.getSubscriptionPk(subscriptionId));
        setSk(WatcherKeyFactory.getMetadataSk());
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public void setSubscriptionId(String subscriptionId) {
        this.subscriptionId = subscriptionId;
    }

    public String getSubscriberId() {
        return subscriberId;
    }

    public void setSubscriberId(String subscriberId) {
        this.subscriberId = subscriberId;
    }

    public String getSubscriberEmail() {
        return subscriberEmail;
    }

    public void setSubscriberEmail(String subscriberEmail) {
        this.subscriberEmail = subscriberEmail;
    }

    public String getSourceUnit() {
        return sourceUnit;
    }

    public void setSourceUnit(String sourceUnit) {
        this.sourceUnit = sourceUnit;
    }

    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = filter;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Subscription that = (Subscription) o;
        return Objects.equals(subscriptionId, that.subscriptionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subscriptionId);
    }

    @Override
    public String toString() {
        return "Subscription{" +
                "subscriptionId='" + subscriptionId + '\'' +
                ", subscriberId='" + subscriberId + '\'' +
                ", sourceUnit='" + sourceUnit + '\'' +
                ", filter='" + filter + '\'' +
                ", active=" + active +
                '}';
    }
}
