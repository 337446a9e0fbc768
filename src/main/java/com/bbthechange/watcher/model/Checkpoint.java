package com.bbthechange.watcher.model;

import com.bbthechange.watcher.util.InstantAsLongAttributeConverter;
import com.bbthechange.watcher.util.WatcherKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * Progress watermark for one (source-unit, filter) pair.
 *
 * Key Pattern: PK = CHECKPOINT#{sourceUnit}, SK = FILTER#{filter}
 * lastSeenTime only ever moves forward; the repository enforces it with a conditional write.
 */
@DynamoDbBean
public class Checkpoint extends BaseItem {

    public static final String ITEM_TYPE = "CHECKPOINT";

    private String sourceUnit;
    private String filter;
    private Instant lastSeenTime;

    // Default constructor for DynamoDB
    public Checkpoint() {
        super();
        setItemType(ITEM_TYPE);
    }

    public Checkpoint(String sourceUnit, String filter, Instant lastSeenTime) {
        super();
        setItemType(ITEM_TYPE);
        this.sourceUnit = sourceUnit;
        this.filter = filter;
        this.lastSeenTime = lastSeenTime;

        setPk(WatcherKeyFactory.getCheckpointPk(sourceUnit));
        setSk(WatcherKeyFactory.getCheckpointSk(filter));
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

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getLastSeenTime() {
        return lastSeenTime;
    }

    public void setLastSeenTime(Instant lastSeenTime) {
        this.lastSeenTime = lastSeenTime;
    }
}
