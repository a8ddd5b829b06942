package com.example.a11ybroker.requests;

import com.example.a11ybroker.models.CapabilityDeclaration;
import com.example.a11ybroker.models.ComplianceLevel;
import com.example.a11ybroker.models.Intent;

/**
 * Conjunctive capability filter; a {@code null} field is unconstrained.
 */
public record CapabilityQuery(
        String appId,
        ComplianceLevel complianceLevel,
        Intent intent
) {
    public static final CapabilityQuery ALL = new CapabilityQuery(null, null, null);

    public static CapabilityQuery of(String appId, String complianceLevel, String intent) {
        return new CapabilityQuery(
                appId == null || appId.isBlank() ? null : appId,
                complianceLevel == null || complianceLevel.isBlank() ? null : Parsing.level(complianceLevel),
                intent == null || intent.isBlank() ? null : Parsing.intent(intent)
        );
    }

    public boolean matches(CapabilityDeclaration declaration) {
        return (appId == null || appId.equals(declaration.getAppId()))
                && (complianceLevel == null || complianceLevel == declaration.getComplianceLevel())
                && (intent == null || declaration.supports(intent));
    }
}
