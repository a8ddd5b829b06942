package com.example.a11ybroker.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * HTTP-layer payload for POST /v1/subscribe.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateSubscriptionHttpRequest(
        @JsonProperty("consumer_id") @NotBlank String consumerId,
        @JsonProperty("event_types") @NotEmpty List<String> eventTypes,
        @JsonProperty("webhook_url") String webhookUrl,
        @JsonProperty("filter") SubscriptionFilterHttpRequest filter
) {
}
