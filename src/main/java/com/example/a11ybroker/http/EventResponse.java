package com.example.a11ybroker.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventResponse(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("status") String status,
        @JsonProperty("signature") String signature,
        @JsonProperty("timestamp") Long timestamp,
        @JsonProperty("sequence") Long sequence,
        @JsonProperty("matched_consumers") List<String> matchedConsumers
) {
    public static final String ACCEPTED = "accepted";

    public EventResponse {
        if (timestamp != null && timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be a positive epoch millis");
        }
    }
}
