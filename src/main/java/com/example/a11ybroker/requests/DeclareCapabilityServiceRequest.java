package com.example.a11ybroker.requests;

import com.example.a11ybroker.models.ComplianceLevel;
import com.example.a11ybroker.models.Intent;
import com.example.a11ybroker.service.BrokerException;
import java.util.Set;

public record DeclareCapabilityServiceRequest(
        String appId,
        Set<Intent> capabilities,
        ComplianceLevel complianceLevel,
        String version
) {
    public DeclareCapabilityServiceRequest {
        String problem = Identifiers.check("app_id", appId, Identifiers.APP_ID_MIN, Identifiers.APP_ID_MAX);
        if (problem != null) {
            throw BrokerException.invalidRequest(problem);
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw BrokerException.invalidRequest("capabilities must not be empty");
        }
        if (complianceLevel == null) {
            throw BrokerException.invalidRequest("compliance_level is required");
        }
        if (version == null || version.isBlank()) {
            throw BrokerException.invalidRequest("version must be non-blank");
        }
        capabilities = Set.copyOf(capabilities);
    }

    public static DeclareCapabilityServiceRequest from(DeclareCapabilityHttpRequest request) {
        return new DeclareCapabilityServiceRequest(
                request.appId(),
                Parsing.intents(request.capabilities()),
                Parsing.level(request.complianceLevel()),
                request.version()
        );
    }
}
