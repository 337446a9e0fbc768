package com.bbthechange.watcher.lock;

import com.bbthechange.watcher.exception.LockException;
import com.bbthechange.watcher.util.InstantAsLongAttributeConverter;
import com.bbthechange.watcher.util.WatcherKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Cycle lock backed by a lease row in the WatcherTable (PK = LOCK#{scope}, SK = LEASE).
 * A lease left behind by a crashed runner can be taken over once it expires.
 */
public class DynamoDbCycleLock implements CycleLock {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbCycleLock.class);

    static final String ITEM_TYPE = "LOCK_LEASE";

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final String scope;
    private final Duration leaseDuration;
    private final Clock clock;

    public DynamoDbCycleLock(DynamoDbClient dynamoDbClient, String tableName, String scope, Duration leaseDuration) {
        this(dynamoDbClient, tableName, scope, leaseDuration, Clock.systemUTC());
    }

    // For testing
    DynamoDbCycleLock(DynamoDbClient dynamoDbClient, String tableName, String scope,
                      Duration leaseDuration, Clock clock) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
        this.scope = scope;
        this.leaseDuration = leaseDuration;
        this.clock = clock;
    }

    @Override
    public Optional<LockToken> tryAcquire() {
        Instant now = clock.instant();
        String owner = UUID.randomUUID().toString();

        Map<String, AttributeValue> item = new HashMap<>(key());
        item.put("itemType", AttributeValue.builder().s(ITEM_TYPE).build());
        item.put("owner", AttributeValue.builder().s(owner).build());
        item.put("acquiredAt", InstantAsLongAttributeConverter.toAttributeValue(now));
        item.put("expiresAt", InstantAsLongAttributeConverter.toAttributeValue(now.plus(leaseDuration)));

        try {
            dynamoDbClient.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .conditionExpression("attribute_not_exists(pk) OR expiresAt < :now")
                .expressionAttributeValues(Map.of(
                    ":now", InstantAsLongAttributeConverter.toAttributeValue(now)
                ))
                .build());

            logger.debug("Acquired lease {} until {}", scope, now.plus(leaseDuration));
            return Optional.of(new LockToken(scope, owner, now));

        } catch (ConditionalCheckFailedException e) {
            logger.info("Lease {} is held by another runner", scope);
            return Optional.empty();
        } catch (DynamoDbException e) {
            throw new LockException("Failed to acquire lease " + scope, e);
        }
    }

    @Override
    public void release(LockToken token) {
        if (token == null) {
            return;
        }
        try {
            dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                .tableName(tableName)
                .key(key())
                .conditionExpression("#owner = :owner")
                .expressionAttributeNames(Map.of("#owner", "owner"))
                .expressionAttributeValues(Map.of(
                    ":owner", AttributeValue.builder().s(token.owner()).build()
                ))
                .build());
            logger.debug("Released lease {}", scope);

        } catch (ConditionalCheckFailedException e) {
            logger.debug("Lease {} no longer owned by {}; nothing to release", scope, token.owner());
        } catch (DynamoDbException e) {
            // Lease expires on its own
            logger.warn("Failed to release lease {}: {}", scope, e.getMessage());
        }
    }

    private Map<String, AttributeValue> key() {
        return Map.of(
            "pk", AttributeValue.builder().s(WatcherKeyFactory.getLockPk(scope)).build(),
            "sk", AttributeValue.builder().s(WatcherKeyFactory.getLeaseSk()).build()
        );
    }
}
