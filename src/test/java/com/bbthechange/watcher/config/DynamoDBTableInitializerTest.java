package com.bbthechange.watcher.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DynamoDBTableInitializerTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private DynamoDbWaiter waiter;

    private WatcherProperties properties;
    private DynamoDBTableInitializer initializer;

    @BeforeEach
    void setUp() {
        properties = new WatcherProperties();
        properties.getDynamodb().setTableName("WatcherTable");
        initializer = new DynamoDBTableInitializer(dynamoDbClient, properties);
    }

    @Test
    void run_TableExists_DoesNothing() {
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
            .thenReturn(DescribeTableResponse.builder().build());

        initializer.run(new DefaultApplicationArguments());

        verify(dynamoDbClient, never()).createTable(any(CreateTableRequest.class));
    }

    @Test
    void run_TableMissing_CreateDisabled_FailsStartup() {
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
            .thenThrow(ResourceNotFoundException.builder().message("no table").build());

        assertThatThrownBy(() -> initializer.run(new DefaultApplicationArguments()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("WatcherTable");
        verify(dynamoDbClient, never()).createTable(any(CreateTableRequest.class));
    }

    @Test
    void run_TableMissing_CreateEnabled_CreatesAndWaits() {
        // Given
        properties.getDynamodb().setCreateTable(true);
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
            .thenThrow(ResourceNotFoundException.builder().message("no table").build());
        when(dynamoDbClient.waiter()).thenReturn(waiter);

        // When
        initializer.run(new DefaultApplicationArguments());

        // Then
        ArgumentCaptor<CreateTableRequest> captor = ArgumentCaptor.forClass(CreateTableRequest.class);
        verify(dynamoDbClient).createTable(captor.capture());
        CreateTableRequest request = captor.getValue();
        assertThat(request.tableName()).isEqualTo("WatcherTable");
        assertThat(request.billingMode()).isEqualTo(BillingMode.PAY_PER_REQUEST);
        assertThat(request.keySchema()).extracting(element -> element.attributeName()).containsExactly("pk", "sk");
        verify(waiter).waitUntilTableExists(any(DescribeTableRequest.class));
    }
}
