package com.example.a11ybroker.models;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class ComplianceReport {
    @NonNull String appId;
    @NonNull ComplianceLevel complianceLevel;
    @NonNull ComplianceStatus status;
    long eventsCount;
    @NonNull List<Violation> violations;
    Long lastEventAt;
    // only present while compliant
    String certificateUrl;
}
