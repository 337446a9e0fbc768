package com.bbthechange.watcher.repository.impl;

import com.bbthechange.watcher.exception.RepositoryException;
import com.bbthechange.watcher.model.Subscription;
import com.bbthechange.watcher.repository.SubscriptionRepository;
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
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DynamoDB implementation of SubscriptionRepository.
 * Uses the single-table design pattern with the WatcherTable.
 */
@Repository
public class SubscriptionRepositoryImpl implements SubscriptionRepository {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRepositoryImpl.class);

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Subscription> subscriptionSchema;
    private final QueryPerformanceTracker performanceTracker;
    private final String tableName;

    @Autowired
    public SubscriptionRepositoryImpl(
            DynamoDbClient dynamoDbClient,
            QueryPerformanceTracker performanceTracker,
            @Value("${watcher.dynamodb.table-name:WatcherTable}") String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.subscriptionSchema = TableSchema.fromBean(Subscription.class);
        this.performanceTracker = performanceTracker;
        this.tableName = tableName;
    }

    @Override
    public List<Subscription> findAllActive() {
        return performanceTracker.trackQuery("findAllActiveSubscriptions", tableName, () -> {
            try {
                List<Subscription> subscriptions = new ArrayList<>();
                Map<String, AttributeValue> lastEvaluatedKey = null;

                do {
                    ScanRequest.Builder requestBuilder = ScanRequest.builder()
                        .tableName(tableName)
                        .filterExpression("itemType = :itemType AND active = :active")
                        .expressionAttributeValues(Map.of(
                            ":itemType", AttributeValue.builder().s(Subscription.ITEM_TYPE).build(),
                            ":active", AttributeValue.builder().bool(true).build()
                        ));
                    if (lastEvaluatedKey != null) {
                        requestBuilder.exclusiveStartKey(lastEvaluatedKey);
                    }

                    ScanResponse response = dynamoDbClient.scan(requestBuilder.build());
                    response.items().stream()
                        .map(subscriptionSchema::mapToItem)
                        .forEach(subscriptions::add);

                    lastEvaluatedKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey()
                        : null;
                } while (lastEvaluatedKey != null);

                logger.debug("Loaded {} active subscriptions", subscriptions.size());
                return subscriptions;

            } catch (DynamoDbException e) {
                logger.error("Failed to scan active subscriptions", e);
                throw new RepositoryException("Failed to load active subscriptions", e);
            }
        });
    }

    @Override
    public Subscription save(Subscription subscription) {
        return performanceTracker.trackQuery("saveSubscription", tableName, () -> {
            try {
                subscription.setPk(WatcherKeyFactory.getSubscriptionPk(subscription.getSubscriptionId()));
                subscription.setSk(WatcherKeyFactory.getMetadataSk());
                subscription.touch();

                PutItemRequest request = PutItemRequest.builder()
                    .tableName(tableName)
                    .item(subscriptionSchema.itemToMap(subscription, true))
                    .build();

                dynamoDbClient.putItem(request);
                logger.debug("Saved subscription {}", subscription.getSubscriptionId());
                return subscription;

            } catch (DynamoDbException e) {
                logger.error("Failed to save subscription {}", subscription.getSubscriptionId(), e);
                throw new RepositoryException("Failed to save subscription", e);
            }
        });
    }

    @Override
    public Optional<Subscription> findById(String subscriptionId) {
        return performanceTracker.trackQuery("findSubscriptionById", tableName, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of(
                        "pk", AttributeValue.builder().s(WatcherKeyFactory.getSubscriptionPk(subscriptionId)).build(),
                        "sk", AttributeValue.builder().s(WatcherKeyFactory.getMetadataSk()).build()
                    ))
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem()) {
                    return Optional.empty();
                }
                return Optional.of(subscriptionSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find subscription {}", subscriptionId, e);
                throw new RepositoryException("Failed to retrieve subscription", e);
            }
        });
    }

    @Override
    public int delete(String subscriptionId) {
        return performanceTracker.trackQuery("deleteSubscription", tableName, () -> {
            try {
                String pk = WatcherKeyFactory.getSubscriptionPk(subscriptionId);
                Map<String, AttributeValue> lastEvaluatedKey = null;
                int deleted = 0;
                int deliveries = 0;

                // Metadata row plus every DELIVERY# row in the partition
                do {
                    QueryRequest.Builder requestBuilder = QueryRequest.builder()
                        .tableName(tableName)
                        .keyConditionExpression("pk = :pk")
                        .expressionAttributeValues(Map.of(
                            ":pk", AttributeValue.builder().s(pk).build()
                        ))
                        .projectionExpression("pk, sk");
                    if (lastEvaluatedKey != null) {
                        requestBuilder.exclusiveStartKey(lastEvaluatedKey);
                    }

                    QueryResponse response = dynamoDbClient.query(requestBuilder.build());
                    for (Map<String, AttributeValue> item : response.items()) {
                        dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                            .tableName(tableName)
                            .key(Map.of("pk", item.get("pk"), "sk", item.get("sk")))
                            .build());
                        deleted++;
                        if (WatcherKeyFactory.isDeliveryItem(item.get("sk").s())) {
                            deliveries++;
                        }
                    }

                    lastEvaluatedKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey()
                        : null;
                } while (lastEvaluatedKey != null);

                logger.info("Deleted subscription {} ({} rows, {} deliveries)", subscriptionId, deleted, deliveries);
                return deliveries;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete subscription {}", subscriptionId, e);
                throw new RepositoryException("Failed to delete subscription", e);
            }
        });
    }
}
