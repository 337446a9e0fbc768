package com.bbthechange.watcher.config;

import com.bbthechange.watcher.lock.CycleLock;
import com.bbthechange.watcher.lock.DynamoDbCycleLock;
import com.bbthechange.watcher.lock.FileCycleLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.nio.file.Path;

/**
 * Picks the cycle lock implementation from watcher.lock.type.
 */
@Configuration
public class LockConfig {

    private static final Logger logger = LoggerFactory.getLogger(LockConfig.class);

    @Bean
    @ConditionalOnProperty(name = "watcher.lock.type", havingValue = "file", matchIfMissing = true)
    public CycleLock fileCycleLock(WatcherProperties properties) {
        logger.info("Using file cycle lock at {}", properties.getLock().getScope());
        return new FileCycleLock(Path.of(properties.getLock().getScope()));
    }

    @Bean
    @ConditionalOnProperty(name = "watcher.lock.type", havingValue = "dynamodb")
    public CycleLock dynamoDbCycleLock(DynamoDbClient dynamoDbClient, WatcherProperties properties) {
        logger.info("Using DynamoDB lease cycle lock '{}'", properties.getLock().getScope());
        return new DynamoDbCycleLock(
            dynamoDbClient,
            properties.getDynamodb().getTableName(),
            properties.getLock().getScope(),
            properties.getLock().getLeaseDuration());
    }
}
