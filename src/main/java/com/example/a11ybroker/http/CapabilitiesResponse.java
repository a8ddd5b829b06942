package com.example.a11ybroker.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record CapabilitiesResponse(
        @JsonProperty("capabilities") List<CapabilityResponse> capabilities,
        @JsonProperty("total") int total
) {
}
