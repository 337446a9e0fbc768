package com.bbthechange.watcher.util;

import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;

/**
 * Converts between Instant and DynamoDB Number attribute.
 * Stores Instants as epoch milliseconds so watermarks compare numerically in condition expressions.
 */
public class InstantAsLongAttributeConverter implements AttributeConverter<Instant> {

    public static AttributeValue toAttributeValue(Instant instant) {
        return AttributeValue.builder().n(String.valueOf(instant.toEpochMilli())).build();
    }

    @Override
    public AttributeValue transformFrom(Instant instant) {
        if (instant == null) {
            return AttributeValue.builder().nul(true).build();
        }
        return toAttributeValue(instant);
    }

    @Override
    public Instant transformTo(AttributeValue attributeValue) {
        if (attributeValue == null || Boolean.TRUE.equals(attributeValue.nul())) {
            return null;
        }
        if (attributeValue.n() != null) {
            return Instant.ofEpochMilli(Long.parseLong(attributeValue.n()));
        }
        throw new IllegalArgumentException("Cannot convert attribute value to Instant: " + attributeValue);
    }

    @Override
    public EnhancedType<Instant> type() {
        return EnhancedType.of(Instant.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.N;
    }
}
