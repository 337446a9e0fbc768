package com.bbthechange.watcher.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Verifies the WatcherTable is reachable before the first cycle runs.
 * Runs ahead of the poller; any failure here aborts startup.
 */
@Component
@Order(0)
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbClient dynamoDbClient;
    private final WatcherProperties properties;

    public DynamoDBTableInitializer(DynamoDbClient dynamoDbClient, WatcherProperties properties) {
        this.dynamoDbClient = dynamoDbClient;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String tableName = properties.getDynamodb().getTableName();
        try {
            dynamoDbClient.describeTable(DescribeTableRequest.builder().tableName(tableName).build());
            logger.info("Table {} already exists", tableName);

        } catch (ResourceNotFoundException e) {
            if (!properties.getDynamodb().isCreateTable()) {
                logger.error("Table {} does not exist and watcher.dynamodb.create-table is false", tableName);
                throw new IllegalStateException("DynamoDB table " + tableName + " does not exist", e);
            }
            logger.info("Creating table: {}", tableName);
            createTable(tableName);
            logger.info("Table {} created successfully", tableName);
        } catch (RuntimeException e) {
            logger.error("Error checking table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }

    private void createTable(String tableName) {
        CreateTableRequest request = CreateTableRequest.builder()
            .tableName(tableName)
            .billingMode(BillingMode.PAY_PER_REQUEST)
            .attributeDefinitions(
                AttributeDefinition.builder().attributeName("pk").attributeType(ScalarAttributeType.S).build(),
                AttributeDefinition.builder().attributeName("sk").attributeType(ScalarAttributeType.S).build()
            )
            .keySchema(
                KeySchemaElement.builder().attributeName("pk").keyType(KeyType.HASH).build(),
                KeySchemaElement.builder().attributeName("sk").keyType(KeyType.RANGE).build()
            )
            .build();

        dynamoDbClient.createTable(request);
        dynamoDbClient.waiter().waitUntilTableExists(DescribeTableRequest.builder().tableName(tableName).build());
    }
}
