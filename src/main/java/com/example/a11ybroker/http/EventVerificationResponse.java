package com.example.a11ybroker.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EventVerificationResponse(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("signature") String signature,
        @JsonProperty("valid") boolean valid
) {
}
