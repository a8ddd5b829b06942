package com.example.a11ybroker.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IntentResponse(
        @JsonProperty("intent") String intent,
        @JsonProperty("category") String category
) {
}
