package com.example.a11ybroker.requests;

import com.example.a11ybroker.models.ComplianceLevel;
import com.example.a11ybroker.models.Intent;
import com.example.a11ybroker.service.BrokerException;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Wire-string to enum conversion for non-event requests; failures are {@code INVALID_REQUEST}.
 */
final class Parsing {

    private Parsing() {
    }

    static Intent intent(String value) {
        try {
            return Intent.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw BrokerException.invalidRequest("unknown intent '" + value + "'");
        }
    }

    static ComplianceLevel level(String value) {
        try {
            return ComplianceLevel.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw BrokerException.invalidRequest("unknown compliance_level '" + value + "'");
        }
    }

    static Set<Intent> intents(Collection<String> values) {
        Set<Intent> out = EnumSet.noneOf(Intent.class);
        if (values != null) {
            values.forEach(v -> out.add(intent(v)));
        }
        return Set.copyOf(out);
    }

    static Set<ComplianceLevel> levels(Collection<String> values) {
        Set<ComplianceLevel> out = EnumSet.noneOf(ComplianceLevel.class);
        if (values != null) {
            values.forEach(v -> out.add(level(v)));
        }
        return Set.copyOf(out);
    }
}
