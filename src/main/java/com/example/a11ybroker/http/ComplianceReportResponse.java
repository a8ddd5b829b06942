package com.example.a11ybroker.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComplianceReportResponse(
        @JsonProperty("app_id") String appId,
        @JsonProperty("compliance_level") String complianceLevel,
        @JsonProperty("status") String status,
        @JsonProperty("events_count") long eventsCount,
        @JsonProperty("violations") List<ViolationResponse> violations,
        @JsonProperty("last_event_at") Long lastEventAt,
        @JsonProperty("certificate_url") String certificateUrl
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ViolationResponse(
            @JsonProperty("type") String type,
            @JsonProperty("severity") String severity,
            @JsonProperty("timestamp") Long timestamp,
            @JsonProperty("description") String description
    ) {
    }
}
