package com.example.a11ybroker.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;

/**
 * Violation reported by an external auditor. A missing timestamp means "now".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordViolationHttpRequest(
        @JsonProperty("type") @NotBlank String type,
        @JsonProperty("severity") @NotBlank String severity,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("description") String description
) {
}
