package com.example.a11ybroker.models;

import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;

/**
 * Immutable snapshot of an application's accumulated compliance inputs. Every mutation returns
 * a new snapshot, so readers can hold one without locking while writers replace it.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ApplicationComplianceState {

    private final String appId;
    private final long eventsCount;
    private final List<Violation> violations;
    private final Long lastEventAt;

    /**
     * Starts tracking an application whose log already holds {@code eventsCount} events,
     * e.g. the first event accepted in this process, or events restored from durable storage.
     */
    public static ApplicationComplianceState restored(@NonNull String appId, long eventsCount, Long lastEventAt) {
        if (eventsCount < 0) {
            throw new IllegalArgumentException("eventsCount must be >= 0");
        }
        return new ApplicationComplianceState(appId, eventsCount, List.of(), lastEventAt);
    }

    public ApplicationComplianceState withEventAccepted(long acceptedAt) {
        return new ApplicationComplianceState(appId, eventsCount + 1, violations, acceptedAt);
    }

    public ApplicationComplianceState withViolation(@NonNull Violation violation) {
        List<Violation> next = new ArrayList<>(violations.size() + 1);
        next.addAll(violations);
        next.add(violation);
        return new ApplicationComplianceState(appId, eventsCount, List.copyOf(next), lastEventAt);
    }

    public ComplianceLevel getComplianceLevel() {
        return ComplianceLevel.forEventCount(eventsCount);
    }

    public boolean hasCriticalViolation() {
        return violations.stream().anyMatch(Violation::isCritical);
    }
}
