package com.example.a11ybroker.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * HTTP-layer payload for POST /v1/events. Intent, level and the ISO-8601 timestamp stay raw
 * strings here so that bad values surface as {@code INVALID_EVENT} for that event alone rather
 * than a parse failure of the whole body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmitEventHttpRequest(
        @JsonProperty("app_id") String appId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("intent") String intent,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("compliance_level") String complianceLevel
) {
}
