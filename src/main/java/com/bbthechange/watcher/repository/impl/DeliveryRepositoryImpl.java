package com.bbthechange.watcher.repository.impl;

import com.bbthechange.watcher.exception.RepositoryException;
import com.bbthechange.watcher.model.Delivery;
import com.bbthechange.watcher.repository.DeliveryRepository;
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
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.util.Map;

/**
 * DynamoDB implementation of DeliveryRepository.
 * Delivery rows live in their subscription's partition: PK = SUBSCRIPTION#{id}, SK = DELIVERY#{itemId}.
 */
@Repository
public class DeliveryRepositoryImpl implements DeliveryRepository {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryRepositoryImpl.class);

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Delivery> deliverySchema;
    private final QueryPerformanceTracker performanceTracker;
    private final String tableName;

    @Autowired
    public DeliveryRepositoryImpl(
            DynamoDbClient dynamoDbClient,
            QueryPerformanceTracker performanceTracker,
            @Value("${watcher.dynamodb.table-name:WatcherTable}") String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.deliverySchema = TableSchema.fromBean(Delivery.class);
        this.performanceTracker = performanceTracker;
        this.tableName = tableName;
    }

    @Override
    public boolean exists(String subscriptionId, String itemId) {
        return performanceTracker.trackQuery("deliveryExists", tableName, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of(
                        "pk", AttributeValue.builder().s(WatcherKeyFactory.getSubscriptionPk(subscriptionId)).build(),
                        "sk", AttributeValue.builder().s(WatcherKeyFactory.getDeliverySk(itemId)).build()
                    ))
                    .projectionExpression("pk")
                    .consistentRead(true)
                    .build();

                return dynamoDbClient.getItem(request).hasItem();

            } catch (DynamoDbException e) {
                logger.error("Failed to check delivery of item {} to subscription {}", itemId, subscriptionId, e);
                throw new RepositoryException("Failed to check delivery", e);
            }
        });
    }

    @Override
    public boolean record(Delivery delivery) {
        return performanceTracker.trackQuery("recordDelivery", tableName, () -> {
            try {
                delivery.touch();
                PutItemRequest request = PutItemRequest.builder()
                    .tableName(tableName)
                    .item(deliverySchema.itemToMap(delivery, true))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build();

                dynamoDbClient.putItem(request);
                logger.debug("Recorded delivery of item {} to subscription {}",
                    delivery.getItemId(), delivery.getSubscriptionId());
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.info("Delivery of item {} to subscription {} was already recorded",
                    delivery.getItemId(), delivery.getSubscriptionId());
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to record delivery of item {} to subscription {}",
                    delivery.getItemId(), delivery.getSubscriptionId(), e);
                throw new RepositoryException("Failed to record delivery", e);
            }
        });
    }
}
