package com.example.a11ybroker.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * HTTP-layer payload for POST /v1/capabilities.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeclareCapabilityHttpRequest(
        @JsonProperty("app_id") @NotBlank String appId,
        @JsonProperty("capabilities") @NotEmpty List<String> capabilities,
        @JsonProperty("compliance_level") @NotBlank String complianceLevel,
        @JsonProperty("version") @NotBlank String version
) {
}
