package com.example.a11ybroker.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventLogEntryResponse(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("app_id") String appId,
        @JsonProperty("sequence") Long sequence,
        @JsonProperty("intent") String intent,
        @JsonProperty("user_id") String userId,
        @JsonProperty("timestamp") Long timestamp,
        @JsonProperty("accepted_at") Long acceptedAt,
        @JsonProperty("signature") String signature,
        @JsonProperty("compliance_level") String complianceLevel,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
}
