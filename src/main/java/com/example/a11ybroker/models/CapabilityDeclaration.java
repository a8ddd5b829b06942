package com.example.a11ybroker.models;

import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Self-declared capability set for an application. One per {@code appId}; a later declaration
 * replaces the earlier one wholesale.
 */
@Value
@Builder(toBuilder = true)
public class CapabilityDeclaration {
    @NonNull String appId;
    @NonNull Set<Intent> capabilities;
    @NonNull ComplianceLevel complianceLevel;
    @NonNull String version;
    @NonNull Long registeredAt;

    public boolean supports(Intent intent) {
        return capabilities.contains(intent);
    }
}
