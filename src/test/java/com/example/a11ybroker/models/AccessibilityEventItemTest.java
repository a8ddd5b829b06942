package com.example.a11ybroker.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.lang.reflect.Method;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class AccessibilityEventItemTest {

    @Test
    @DisplayName("DynamoDB annotations map keys and snake_case attribute names")
    void dynamoAnnotations() throws Exception {
        assertNotNull(AccessibilityEventItem.class.getAnnotation(DynamoDbBean.class));

        Method appId = AccessibilityEventItem.class.getMethod("getAppId");
        assertNotNull(appId.getAnnotation(DynamoDbPartitionKey.class));
        assertEquals("app_id", appId.getAnnotation(DynamoDbAttribute.class).value());

        Method sequence = AccessibilityEventItem.class.getMethod("getSequence");
        assertNotNull(sequence.getAnnotation(DynamoDbSortKey.class));
        assertEquals("sequence", sequence.getAnnotation(DynamoDbAttribute.class).value());

        assertEquals("accepted_at", AccessibilityEventItem.class.getMethod("getAcceptedAt")
                .getAnnotation(DynamoDbAttribute.class).value());
        assertEquals("compliance_level_hint", AccessibilityEventItem.class.getMethod("getComplianceLevelHint")
                .getAnnotation(DynamoDbAttribute.class).value());

        Method metadata = AccessibilityEventItem.class.getMethod("getMetadata");
        assertEquals(JsonStringMapAttributeConverter.class,
                metadata.getAnnotation(DynamoDbConvertedBy.class).value());
    }

    @Test
    @DisplayName("item conversion preserves every event field")
    void conversionPreservesFields() {
        AccessibilityEvent event = AccessibilityEvent.builder()
                .eventId("evt_abc")
                .appId("app-1")
                .sequence(7L)
                .intent(Intent.REDUCED_MOTION)
                .timestamp(1000L)
                .acceptedAt(2000L)
                .signature("f".repeat(64))
                .userId("user_9")
                .metadata(Map.of("screen", "checkout"))
                .complianceLevelHint(ComplianceLevel.PLATINUM)
                .build();

        AccessibilityEventItem item = AccessibilityEventItem.from(event);
        assertEquals("reduced_motion", item.getIntent());
        assertEquals("platinum", item.getComplianceLevelHint());
        assertEquals(event, item.toEvent());
    }

    @Test
    @DisplayName("optional fields stay absent")
    void optionalFieldsAbsent() {
        AccessibilityEvent event = AccessibilityEvent.builder()
                .eventId("evt_abc")
                .appId("app-1")
                .sequence(1L)
                .intent(Intent.TEXT_PRIMARY)
                .timestamp(1000L)
                .acceptedAt(1000L)
                .signature("a".repeat(64))
                .build();

        AccessibilityEvent back = AccessibilityEventItem.from(event).toEvent();
        assertNull(back.getUserId());
        assertNull(back.getMetadata());
        assertNull(back.getComplianceLevelHint());
    }

    @Test
    @DisplayName("metadata converter stores nested values as a JSON string")
    void metadataConverter() {
        JsonStringMapAttributeConverter converter = new JsonStringMapAttributeConverter();
        Map<String, Object> metadata = Map.of("nested", Map.of("depth", 2));

        AttributeValue stored = converter.transformFrom(metadata);
        assertEquals("{\"nested\":{\"depth\":2}}", stored.s());
        assertEquals(metadata, converter.transformTo(stored));
        assertEquals(Map.of(), converter.transformTo(AttributeValue.builder().build()));
    }
}
