package com.example.a11ybroker.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record CapabilityResponse(
        @JsonProperty("app_id") String appId,
        @JsonProperty("capabilities") List<String> capabilities,
        @JsonProperty("compliance_level") String complianceLevel,
        @JsonProperty("version") String version,
        @JsonProperty("registered_at") Long registeredAt
) {
    public CapabilityResponse {
        if (registeredAt != null && registeredAt < 0) {
            throw new IllegalArgumentException("registeredAt must be a positive epoch millis");
        }
    }
}
