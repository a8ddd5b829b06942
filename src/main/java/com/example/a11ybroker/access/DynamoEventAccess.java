package com.example.a11ybroker.access;

import com.example.a11ybroker.models.AccessibilityEvent;
import com.example.a11ybroker.models.AccessibilityEventItem;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * Durable event log on the {@code accessibility_events} table (PK {@code app_id}, numeric SK
 * {@code sequence}). Sequences are dense per application, so the latest sequence is also the count.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "broker.persistence.dynamo.enabled", havingValue = "true")
public class DynamoEventAccess implements EventAccess {

    static final String TABLE_NAME = "accessibility_events";

    private final DynamoDbTable<AccessibilityEventItem> table;

    public DynamoEventAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(AccessibilityEventItem.class));
    }

    @Override
    public AccessibilityEvent append(AccessibilityEvent event) {
        long sequence = countByAppId(event.getAppId()) + 1;
        AccessibilityEventItem item = AccessibilityEventItem.from(event.toBuilder().sequence(sequence).build());
        try {
            // never overwrite: another process holding the same sequence means a concurrent writer
            table.putItem(r -> r.item(item)
                    .conditionExpression(Expression.builder()
                            .expression("attribute_not_exists(app_id)")
                            .build()));
        } catch (ConditionalCheckFailedException ex) {
            log.warn("Sequence {} for app {} already taken by another writer", sequence, event.getAppId());
            throw new IllegalStateException("Concurrent append detected for app " + event.getAppId(), ex);
        }
        return item.toEvent();
    }

    @Override
    public List<AccessibilityEvent> findAllByAppId(String appId) {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(appId)))
                        .scanIndexForward(true)
                        .consistentRead(true))
                .items()
                .stream()
                .map(AccessibilityEventItem::toEvent)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<AccessibilityEvent> findByEventId(String appId, String eventId) {
        Expression filter = Expression.builder()
                .expression("#eid = :eid")
                .putExpressionName("#eid", "event_id")
                .putExpressionValue(":eid", AttributeValue.builder().s(eventId).build())
                .build();
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(appId)))
                        .filterExpression(filter)
                        .consistentRead(true))
                .items()
                .stream()
                .map(AccessibilityEventItem::toEvent)
                .findFirst();
    }

    @Override
    public long countByAppId(String appId) {
        // Query the partition newest-first so the first item carries the highest sequence.
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(appId)))
                        .limit(1)
                        .scanIndexForward(false)
                        .consistentRead(true))
                .items()
                .stream()
                .findFirst()
                .map(AccessibilityEventItem::getSequence)
                .orElse(0L);
    }

    private Key buildKey(String appId) {
        return Key.builder().partitionValue(appId).build();
    }
}
