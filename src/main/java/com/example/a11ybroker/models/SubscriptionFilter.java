package com.example.a11ybroker.models;

import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Conjunctive filter. An empty (or absent) field places no constraint.
 */
@Value
@Builder
public class SubscriptionFilter {

    @Builder.Default
    Set<String> appIds = Set.of();
    @Builder.Default
    Set<Intent> intents = Set.of();
    @Builder.Default
    Set<ComplianceLevel> complianceLevels = Set.of();

    public boolean matches(String appId, Intent intent, ComplianceLevel level) {
        return (appIds.isEmpty() || appIds.contains(appId))
                && (intents.isEmpty() || intents.contains(intent))
                && (complianceLevels.isEmpty() || complianceLevels.contains(level));
    }
}
