package com.example.a11ybroker.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubscriptionFilterHttpRequest(
        @JsonProperty("app_ids") List<String> appIds,
        @JsonProperty("intents") List<String> intents,
        @JsonProperty("compliance_levels") List<String> complianceLevels
) {
}
