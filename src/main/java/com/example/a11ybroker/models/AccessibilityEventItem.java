package com.example.a11ybroker.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * DynamoDB row for the {@code accessibility_events} table. Mutable only because the enhanced
 * client maps through setters; callers convert to {@link AccessibilityEvent} immediately.
 */
@DynamoDbBean
@NoArgsConstructor
@Getter @Setter
public class AccessibilityEventItem {

    private String appId;         // PK
    private Long sequence;        // SK
    private String eventId;
    private String intent;
    private Long timestamp;
    private Long acceptedAt;
    private String signature;
    private String userId;
    private Map<String, Object> metadata;
    private String complianceLevelHint;

    // ----- DynamoDB annotations on getters -----
    @DynamoDbPartitionKey
    @DynamoDbAttribute("app_id")
    public String getAppId() { return appId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sequence")
    public Long getSequence() { return sequence; }

    @DynamoDbAttribute("event_id")
    public String getEventId() { return eventId; }

    @DynamoDbAttribute("intent")
    public String getIntent() { return intent; }

    @DynamoDbAttribute("timestamp")
    public Long getTimestamp() { return timestamp; }

    @DynamoDbAttribute("accepted_at")
    public Long getAcceptedAt() { return acceptedAt; }

    @DynamoDbAttribute("signature")
    public String getSignature() { return signature; }

    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("metadata")
    public Map<String, Object> getMetadata() { return metadata; }

    @DynamoDbAttribute("compliance_level_hint")
    public String getComplianceLevelHint() { return complianceLevelHint; }

    public static AccessibilityEventItem from(AccessibilityEvent event) {
        AccessibilityEventItem item = new AccessibilityEventItem();
        item.setAppId(event.getAppId());
        item.setSequence(event.getSequence());
        item.setEventId(event.getEventId());
        item.setIntent(event.getIntent().getWireName());
        item.setTimestamp(event.getTimestamp());
        item.setAcceptedAt(event.getAcceptedAt());
        item.setSignature(event.getSignature());
        item.setUserId(event.getUserId());
        item.setMetadata(event.getMetadata());
        item.setComplianceLevelHint(event.getComplianceLevelHint() == null
                ? null : event.getComplianceLevelHint().getWireName());
        return item;
    }

    public AccessibilityEvent toEvent() {
        return AccessibilityEvent.builder()
                .appId(appId)
                .sequence(sequence)
                .eventId(eventId)
                .intent(Intent.fromString(intent))
                .timestamp(timestamp)
                .acceptedAt(acceptedAt)
                .signature(signature)
                .userId(userId)
                .metadata(metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                .complianceLevelHint(complianceLevelHint == null
                        ? null : ComplianceLevel.fromString(complianceLevelHint))
                .build();
    }
}
