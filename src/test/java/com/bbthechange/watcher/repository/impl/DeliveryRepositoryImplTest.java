package com.bbthechange.watcher.repository.impl;

import com.bbthechange.watcher.exception.RepositoryException;
import com.bbthechange.watcher.model.Delivery;
import com.bbthechange.watcher.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeliveryRepositoryImplTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private DeliveryRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        when(performanceTracker.trackQuery(anyString(), anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> supplier = invocation.getArgument(2);
            return supplier.get();
        });

        repository = new DeliveryRepositoryImpl(dynamoDbClient, performanceTracker, "WatcherTable");
    }

    @Test
    void exists_RowPresent_ReturnsTrue() {
        // Given
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder()
            .item(Map.of("pk", AttributeValue.builder().s("SUBSCRIPTION#sub-1").build()))
            .build());

        // When
        boolean exists = repository.exists("sub-1", "abc123");

        // Then
        assertThat(exists).isTrue();
        ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(dynamoDbClient).getItem(captor.capture());
        assertThat(captor.getValue().key().get("pk").s()).isEqualTo("SUBSCRIPTION#sub-1");
        assertThat(captor.getValue().key().get("sk").s()).isEqualTo("DELIVERY#abc123");
        assertThat(captor.getValue().consistentRead()).isTrue();
    }

    @Test
    void exists_NoRow_ReturnsFalse() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        assertThat(repository.exists("sub-1", "abc123")).isFalse();
    }

    @Test
    void record_New_WritesOnce() {
        // Given
        when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

        // When
        boolean recorded = repository.record(new Delivery("sub-1", "abc123", "watchexchange"));

        // Then
        assertThat(recorded).isTrue();
        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDbClient).putItem(captor.capture());
        PutItemRequest request = captor.getValue();
        assertThat(request.conditionExpression()).isEqualTo("attribute_not_exists(pk)");
        assertThat(request.item().get("sk").s()).isEqualTo("DELIVERY#abc123");
        assertThat(request.item().get("itemType").s()).isEqualTo(Delivery.ITEM_TYPE);
        assertThat(request.item().get("sourceUnit").s()).isEqualTo("watchexchange");
        assertThat(request.item().get("createdAt").n()).isNotBlank();
        assertThat(request.item().get("updatedAt").n()).isEqualTo(request.item().get("createdAt").n());
    }

    @Test
    void record_AlreadyRecorded_ReturnsFalse() {
        when(dynamoDbClient.putItem(any(PutItemRequest.class)))
            .thenThrow(ConditionalCheckFailedException.builder().message("exists").build());

        assertThat(repository.record(new Delivery("sub-1", "abc123", "watchexchange"))).isFalse();
    }

    @Test
    void record_DynamoFailure_ThrowsRepositoryException() {
        when(dynamoDbClient.putItem(any(PutItemRequest.class)))
            .thenThrow(DynamoDbException.builder().message("boom").build());

        assertThatThrownBy(() -> repository.record(new Delivery("sub-1", "abc123", "watchexchange")))
            .isInstanceOf(RepositoryException.class);
    }
}
