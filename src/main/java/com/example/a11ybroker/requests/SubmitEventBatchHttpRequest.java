package com.example.a11ybroker.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record SubmitEventBatchHttpRequest(
        @JsonProperty("events") List<SubmitEventHttpRequest> events
) {
}
