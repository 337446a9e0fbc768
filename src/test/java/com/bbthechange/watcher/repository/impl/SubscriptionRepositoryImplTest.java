package com.bbthechange.watcher.repository.impl;

import com.bbthechange.watcher.exception.RepositoryException;
import com.bbthechange.watcher.model.Subscription;
import com.bbthechange.watcher.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionRepositoryImplTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private SubscriptionRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        when(performanceTracker.trackQuery(anyString(), anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> supplier = invocation.getArgument(2);
            return supplier.get();
        });

        repository = new SubscriptionRepositoryImpl(dynamoDbClient, performanceTracker, "WatcherTable");
    }

    private static Map<String, AttributeValue> subscriptionRow(String id, String filter) {
        return Map.of(
            "pk", AttributeValue.builder().s("SUBSCRIPTION#" + id).build(),
            "sk", AttributeValue.builder().s("METADATA").build(),
            "itemType", AttributeValue.builder().s(Subscription.ITEM_TYPE).build(),
            "subscriptionId", AttributeValue.builder().s(id).build(),
            "subscriberId", AttributeValue.builder().s("user-" + id).build(),
            "subscriberEmail", AttributeValue.builder().s(id + "@example.com").build(),
            "sourceUnit", AttributeValue.builder().s("watchexchange").build(),
            "filter", AttributeValue.builder().s(filter).build(),
            "active", AttributeValue.builder().bool(true).build()
        );
    }

    private static Map<String, AttributeValue> keyRow(String pk, String sk) {
        return Map.of(
            "pk", AttributeValue.builder().s(pk).build(),
            "sk", AttributeValue.builder().s(sk).build()
        );
    }

    @Test
    void findAllActive_FollowsPagination() {
        // Given
        Map<String, AttributeValue> pageOneEnd = keyRow("SUBSCRIPTION#sub-1", "METADATA");
        when(dynamoDbClient.scan(any(ScanRequest.class)))
            .thenReturn(ScanResponse.builder()
                .items(List.of(subscriptionRow("sub-1", "seiko")))
                .lastEvaluatedKey(pageOneEnd)
                .build())
            .thenReturn(ScanResponse.builder()
                .items(List.of(subscriptionRow("sub-2", "omega")))
                .build());

        // When
        List<Subscription> result = repository.findAllActive();

        // Then
        assertThat(result).extracting(Subscription::getSubscriptionId).containsExactly("sub-1", "sub-2");
        assertThat(result.get(0).getSubscriberEmail()).isEqualTo("sub-1@example.com");
        assertThat(result.get(1).getFilter()).isEqualTo("omega");

        ArgumentCaptor<ScanRequest> captor = ArgumentCaptor.forClass(ScanRequest.class);
        verify(dynamoDbClient, times(2)).scan(captor.capture());
        ScanRequest first = captor.getAllValues().get(0);
        assertThat(first.filterExpression()).isEqualTo("itemType = :itemType AND active = :active");
        assertThat(first.expressionAttributeValues().get(":itemType").s()).isEqualTo(Subscription.ITEM_TYPE);
        assertThat(first.hasExclusiveStartKey()).isFalse();
        assertThat(captor.getAllValues().get(1).exclusiveStartKey()).isEqualTo(pageOneEnd);
    }

    @Test
    void findAllActive_DynamoFailure_ThrowsRepositoryException() {
        when(dynamoDbClient.scan(any(ScanRequest.class)))
            .thenThrow(DynamoDbException.builder().message("boom").build());

        assertThatThrownBy(() -> repository.findAllActive()).isInstanceOf(RepositoryException.class);
    }

    @Test
    void save_SetsKeysAndWrites() {
        // Given
        Subscription subscription = new Subscription("sub-1", "user-1", "sub-1@example.com", "watchexchange", "seiko");
        when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

        // When
        Subscription saved = repository.save(subscription);

        // Then
        assertThat(saved.getPk()).isEqualTo("SUBSCRIPTION#sub-1");
        assertThat(saved.getSk()).isEqualTo("METADATA");
        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDbClient).putItem(captor.capture());
        Map<String, AttributeValue> item = captor.getValue().item();
        assertThat(item.get("filter").s()).isEqualTo("seiko");
        assertThat(item.get("active").bool()).isTrue();
    }

    @Test
    void findById_Missing_ReturnsEmpty() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        Optional<Subscription> result = repository.findById("sub-9");

        assertThat(result).isEmpty();
    }

    @Test
    void delete_RemovesMetadataAndDeliveries() {
        // Given
        when(dynamoDbClient.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder()
            .items(List.of(
                keyRow("SUBSCRIPTION#sub-1", "METADATA"),
                keyRow("SUBSCRIPTION#sub-1", "DELIVERY#abc"),
                keyRow("SUBSCRIPTION#sub-1", "DELIVERY#def")))
            .build());
        when(dynamoDbClient.deleteItem(any(DeleteItemRequest.class)))
            .thenReturn(DeleteItemResponse.builder().build());

        // When
        int deliveries = repository.delete("sub-1");

        // Then
        assertThat(deliveries).isEqualTo(2);
        ArgumentCaptor<QueryRequest> queryCaptor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDbClient).query(queryCaptor.capture());
        assertThat(queryCaptor.getValue().keyConditionExpression()).isEqualTo("pk = :pk");
        assertThat(queryCaptor.getValue().expressionAttributeValues().get(":pk").s()).isEqualTo("SUBSCRIPTION#sub-1");

        ArgumentCaptor<DeleteItemRequest> deleteCaptor = ArgumentCaptor.forClass(DeleteItemRequest.class);
        verify(dynamoDbClient, times(3)).deleteItem(deleteCaptor.capture());
        assertThat(deleteCaptor.getAllValues())
            .extracting(request -> request.key().get("sk").s())
            .containsExactly("METADATA", "DELIVERY#abc", "DELIVERY#def");
    }

    @Test
    void delete_Missing_RemovesNothing() {
        when(dynamoDbClient.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder().build());

        assertThat(repository.delete("sub-9")).isZero();
        verify(dynamoDbClient, never()).deleteItem(any(DeleteItemRequest.class));
    }
}
