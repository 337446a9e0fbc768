package com.bbthechange.watcher.repository.impl;

import com.bbthechange.watcher.exception.RepositoryException;
import com.bbthechange.watcher.model.Checkpoint;
import com.bbthechange.watcher.repository.CheckpointRepository;
import com.bbthechange.watcher.util.InstantAsLongAttributeConverter;
import com.bbthechange.watcher.util.QueryPerformanceTracker;
import com.bbthechange.watcher.util.WatcherKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * DynamoDB implementation of CheckpointRepository.
 * Uses the single-table design pattern with the WatcherTable.
 */
@Repository
public class CheckpointRepositoryImpl implements CheckpointRepository {

    private static final Logger logger = LoggerFactory.getLogger(CheckpointRepositoryImpl.class);

    // Only forward moves pass; equal or older values fail the check and leave the row alone.
    private static final String MONOTONIC_CONDITION =
            "attribute_not_exists(pk) OR lastSeenTime < :lastSeenTime";

    // createdAt is written once, on the first advance for the pair
    private static final String ADVANCE_UPDATE =
            "SET lastSeenTime = :lastSeenTime, updatedAt = :now, createdAt = if_not_exists(createdAt, :now), "
            + "itemType = :itemType, sourceUnit = :sourceUnit, #filter = :filter";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Checkpoint> checkpointSchema;
    private final QueryPerformanceTracker performanceTracker;
    private final String tableName;

    @Autowired
    public CheckpointRepositoryImpl(
            DynamoDbClient dynamoDbClient,
            QueryPerformanceTracker performanceTracker,
            @Value("${watcher.dynamodb.table-name:WatcherTable}") String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.checkpointSchema = TableSchema.fromBean(Checkpoint.class);
        this.performanceTracker = performanceTracker;
        this.tableName = tableName;
    }

    @Override
    public Optional<Checkpoint> find(String sourceUnit, String filter) {
        return performanceTracker.trackQuery("findCheckpoint", tableName, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key(sourceUnit, filter))
                    .consistentRead(true)
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem()) {
                    return Optional.empty();
                }
                return Optional.of(checkpointSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to read checkpoint for r/{} '{}'", sourceUnit, filter, e);
                throw new RepositoryException("Failed to read checkpoint", e);
            }
        });
    }

    @Override
    public boolean advance(String sourceUnit, String filter, Instant lastSeenTime) {
        return performanceTracker.trackQuery("advanceCheckpoint", tableName, () -> {
            AttributeValue now = InstantAsLongAttributeConverter.toAttributeValue(Instant.now());
            try {
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(key(sourceUnit, filter))
                    .updateExpression(ADVANCE_UPDATE)
                    .conditionExpression(MONOTONIC_CONDITION)
                    .expressionAttributeNames(Map.of("#filter", "filter"))
                    .expressionAttributeValues(Map.of(
                        ":lastSeenTime", InstantAsLongAttributeConverter.toAttributeValue(lastSeenTime),
                        ":now", now,
                        ":itemType", AttributeValue.builder().s(Checkpoint.ITEM_TYPE).build(),
                        ":sourceUnit", AttributeValue.builder().s(sourceUnit).build(),
                        ":filter", AttributeValue.builder().s(filter).build()
                    ))
                    .build();

                dynamoDbClient.updateItem(request);
                logger.debug("Advanced checkpoint for r/{} '{}' to {}", sourceUnit, filter, lastSeenTime);
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.warn("Checkpoint for r/{} '{}' already at or past {}; not moving it back",
                    sourceUnit, filter, lastSeenTime);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to advance checkpoint for r/{} '{}'", sourceUnit, filter, e);
                throw new RepositoryException("Failed to advance checkpoint", e);
            }
        });
    }

    private Map<String, AttributeValue> key(String sourceUnit, String filter) {
        return Map.of(
            "pk", AttributeValue.builder().s(WatcherKeyFactory.getCheckpointPk(sourceUnit)).build(),
            "sk", AttributeValue.builder().s(WatcherKeyFactory.getCheckpointSk(filter)).build()
        );
    }
}
