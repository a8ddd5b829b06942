package com.example.a11ybroker.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.a11ybroker.access.InMemoryCapabilityAccess;
import com.example.a11ybroker.access.InMemoryEventAccess;
import com.example.a11ybroker.config.ComplianceProperties;
import com.example.a11ybroker.models.AccessibilityEvent;
import com.example.a11ybroker.models.CapabilityDeclaration;
import com.example.a11ybroker.models.ComplianceLevel;
import com.example.a11ybroker.models.ComplianceReport;
import com.example.a11ybroker.models.ComplianceStatus;
import com.example.a11ybroker.models.Intent;
import com.example.a11ybroker.models.Severity;
import com.example.a11ybroker.models.Violation;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ComplianceEngineTest {

    private InMemoryEventAccess eventAccess;
    private InMemoryCapabilityAccess capabilityAccess;
    private ComplianceProperties properties;
    private ComplianceEngine engine;

    @BeforeEach
    void setUp() {
        eventAccess = new InMemoryEventAccess();
        capabilityAccess = new InMemoryCapabilityAccess();
        properties = new ComplianceProperties();
        engine = new ComplianceEngine(eventAccess, capabilityAccess, properties);
    }

    private void acceptEvents(String appId, int n) {
        for (int i = 0; i < n; i++) {
            AccessibilityEvent stored = eventAccess.append(event(appId, i));
            engine.recordEvent(appId, stored.getAcceptedAt());
        }
    }

    private static AccessibilityEvent event(String appId, long at) {
        return AccessibilityEvent.builder()
                .eventId("evt_" + appId + "_" + at)
                .appId(appId)
                .intent(Intent.CAPTIONS_MANDATORY)
                .timestamp(at)
                .acceptedAt(at)
                .signature("0".repeat(64))
                .build();
    }

    private static Violation violation(Severity severity) {
        return Violation.builder()
                .type("contrast_ratio")
                .severity(severity)
                .timestamp(5000L)
                .description("text below 4.5:1")
                .build();
    }

    @Test
    @DisplayName("derive on an application with no history is unknown, never a zero report")
    void unknownApplication() {
        BrokerException ex = assertThrows(BrokerException.class, () -> engine.derive("ghost"));
        assertEquals(BrokerException.Code.UNKNOWN_APPLICATION, ex.getCode());
    }

    @Test
    @DisplayName("a declared application without events derives bronze with zero events")
    void declaredWithoutEvents() {
        capabilityAccess.save(CapabilityDeclaration.builder()
                .appId("app-1")
                .capabilities(Set.of(Intent.SIGN_LANGUAGE))
                .complianceLevel(ComplianceLevel.PLATINUM)
                .version("1")
                .registeredAt(1L)
                .build());

        ComplianceReport report = engine.derive("app-1");

        assertEquals(0, report.getEventsCount());
        assertEquals(ComplianceLevel.BRONZE, report.getComplianceLevel());
        assertEquals(ComplianceStatus.COMPLIANT, report.getStatus());
        assertNull(report.getLastEventAt());
    }

    @Test
    @DisplayName("derived tier follows the event count")
    void tierFollowsCount() {
        acceptEvents("app-1", 49);
        assertEquals(ComplianceLevel.BRONZE, engine.derive("app-1").getComplianceLevel());

        acceptEvents("app-1", 1);
        ComplianceReport report = engine.derive("app-1");
        assertEquals(50, report.getEventsCount());
        assertEquals(ComplianceLevel.SILVER, report.getComplianceLevel());
        assertEquals(0L, report.getLastEventAt());

        acceptEvents("app-1", 150);
        assertEquals(ComplianceLevel.GOLD, engine.derive("app-1").getComplianceLevel());
    }

    @Test
    @DisplayName("compliant reports carry a certificate URL built from the base, app and level")
    void certificateUrl() {
        acceptEvents("app-1", 50);

        assertEquals("https://pinksync.org/certificates/app-1-silver", engine.derive("app-1").getCertificateUrl());

        properties.setCertificateBaseUrl("https://certs.example.org/");
        assertEquals("https://certs.example.org/app-1-gold", engine.certificateUrl("app-1", ComplianceLevel.GOLD));
    }

    @Test
    @DisplayName("a critical violation makes the application non-compliant and drops the certificate")
    void criticalViolation() {
        acceptEvents("app-1", 3);
        engine.recordViolation("app-1", violation(Severity.WARNING));

        ComplianceReport warned = engine.derive("app-1");
        assertEquals(ComplianceStatus.COMPLIANT, warned.getStatus());
        assertEquals(1, warned.getViolations().size());

        engine.recordViolation("app-1", violation(Severity.CRITICAL));

        ComplianceReport report = engine.derive("app-1");
        assertEquals(ComplianceStatus.NON_COMPLIANT, report.getStatus());
        assertNull(report.getCertificateUrl());
        assertEquals(2, report.getViolations().size());
        assertEquals(3, report.getEventsCount());
    }

    @Test
    @DisplayName("violations for an unknown application are rejected")
    void violationUnknownApplication() {
        BrokerException ex = assertThrows(BrokerException.class,
                () -> engine.recordViolation("ghost", violation(Severity.INFO)));
        assertEquals(BrokerException.Code.UNKNOWN_APPLICATION, ex.getCode());
    }

    @Test
    @DisplayName("state is restored from the stored event count on first touch")
    void restoresFromStore() {
        for (int i = 0; i < 60; i++) {
            eventAccess.append(event("app-1", i));
        }

        ComplianceEngine fresh = new ComplianceEngine(eventAccess, capabilityAccess, properties);
        assertEquals(ComplianceLevel.SILVER, fresh.currentLevel("app-1"));
        assertEquals(60, fresh.derive("app-1").getEventsCount());

        eventAccess.append(event("app-1", 60));
        fresh.recordEvent("app-1", 60);
        assertEquals(61, fresh.derive("app-1").getEventsCount());
        assertEquals(60L, fresh.derive("app-1").getLastEventAt());
    }

    @Test
    @DisplayName("derive does not change the state it reads")
    void deriveIsReadOnly() {
        acceptEvents("app-1", 10);

        ComplianceReport first = engine.derive("app-1");
        ComplianceReport second = engine.derive("app-1");

        assertEquals(first, second);
        assertTrue(first.getViolations().isEmpty());
    }
}
