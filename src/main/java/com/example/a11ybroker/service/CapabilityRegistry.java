package com.example.a11ybroker.service;

import com.example.a11ybroker.access.CapabilityAccess;
import com.example.a11ybroker.models.CapabilityDeclaration;
import com.example.a11ybroker.requests.CapabilityQuery;
import com.example.a11ybroker.requests.DeclareCapabilityServiceRequest;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Holds the declared capability set per application, independent of event history.
 * Declarations are last-write-wins: a second declaration for an application replaces the first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CapabilityRegistry {

    private final CapabilityAccess capabilityAccess;
    private final Clock clock;

    public CapabilityDeclaration declare(DeclareCapabilityServiceRequest request) {
        Objects.requireNonNull(request, "request");

        CapabilityDeclaration declaration = CapabilityDeclaration.builder()
                .appId(request.appId())
                .capabilities(request.capabilities())
                .complianceLevel(request.complianceLevel())
                .version(request.version())
                .registeredAt(clock.millis())
                .build();
        capabilityAccess.save(declaration);

        log.info("Capabilities declared for app {} (version {}, {} intents)",
                declaration.getAppId(), declaration.getVersion(), declaration.getCapabilities().size());
        return declaration;
    }

    /**
     * Declarations matching every supplied filter field.
     */
    public List<CapabilityDeclaration> query(CapabilityQuery query) {
        Objects.requireNonNull(query, "query");
        return capabilityAccess.findAll().stream()
                .filter(query::matches)
                .toList();
    }

    public CapabilityDeclaration get(String appId) {
        return capabilityAccess.findByAppId(appId)
                .orElseThrow(() -> BrokerException.unknownApplication(appId));
    }
}
