package com.example.a11ybroker.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record EventBatchResponse(
        @JsonProperty("accepted_count") int acceptedCount,
        @JsonProperty("rejected_count") int rejectedCount,
        @JsonProperty("event_ids") List<String> eventIds,
        @JsonProperty("errors") List<BatchErrorResponse> errors
) {
    public record BatchErrorResponse(
            @JsonProperty("index") int index,
            @JsonProperty("code") String code,
            @JsonProperty("message") String message
    ) {
    }
}
