package com.example.a11ybroker.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * An accepted accessibility event. Instances are frozen once built; the event log only ever
 * appends them and hands the same values back to readers.
 */
@JsonInclude(Include.NON_NULL)
@Value
@Builder(toBuilder = true)
public class AccessibilityEvent {

    @NonNull String eventId;
    @NonNull String appId;
    @NonNull Intent intent;
    // client supplied or broker assigned, display only, never used for ordering
    @NonNull Long timestamp;
    @NonNull Long acceptedAt;
    @NonNull String signature;

    // 1-based position in the application's log, assigned by the event store
    Long sequence;

    String userId;
    Map<String, Object> metadata;
    ComplianceLevel complianceLevelHint;
}
