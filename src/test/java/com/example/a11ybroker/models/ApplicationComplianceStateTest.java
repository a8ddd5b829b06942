package com.example.a11ybroker.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ApplicationComplianceStateTest {

    private static Violation violation(Severity severity) {
        return Violation.builder()
                .type("missing_captions")
                .severity(severity)
                .timestamp(1000L)
                .build();
    }

    @Test
    @DisplayName("each accepted event returns a new snapshot and leaves the old one untouched")
    void immutableSnapshots() {
        ApplicationComplianceState first = ApplicationComplianceState.restored("app-1", 49, 10L);
        ApplicationComplianceState second = first.withEventAccepted(20L);

        assertEquals(49, first.getEventsCount());
        assertEquals(ComplianceLevel.BRONZE, first.getComplianceLevel());
        assertEquals(50, second.getEventsCount());
        assertEquals(20L, second.getLastEventAt());
        assertEquals(ComplianceLevel.SILVER, second.getComplianceLevel());
    }

    @Test
    @DisplayName("violations append in order and only critical ones flag the state")
    void violations() {
        ApplicationComplianceState state = ApplicationComplianceState.restored("app-1", 0, null)
                .withViolation(violation(Severity.WARNING))
                .withViolation(violation(Severity.INFO));

        assertEquals(2, state.getViolations().size());
        assertFalse(state.hasCriticalViolation());

        ApplicationComplianceState flagged = state.withViolation(violation(Severity.CRITICAL));
        assertTrue(flagged.hasCriticalViolation());
        assertEquals(Severity.CRITICAL, flagged.getViolations().get(2).getSeverity());
        assertThrows(UnsupportedOperationException.class, () -> flagged.getViolations().clear());
    }

    @Test
    @DisplayName("negative restored counts are rejected")
    void negativeCount() {
        assertThrows(IllegalArgumentException.class,
                () -> ApplicationComplianceState.restored("app-1", -1, null));
    }
}
