package com.example.a11ybroker.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubscriptionResponse(
        @JsonProperty("subscription_id") String subscriptionId,
        @JsonProperty("consumer_id") String consumerId,
        @JsonProperty("status") String status,
        @JsonProperty("event_types") List<String> eventTypes,
        @JsonProperty("webhook_url") String webhookUrl,
        @JsonProperty("filter") FilterResponse filter,
        @JsonProperty("created_at") Long createdAt,
        @JsonProperty("expires_at") Long expiresAt
) {
    public record FilterResponse(
            @JsonProperty("app_ids") List<String> appIds,
            @JsonProperty("intents") List<String> intents,
            @JsonProperty("compliance_levels") List<String> complianceLevels
    ) {
    }
}
