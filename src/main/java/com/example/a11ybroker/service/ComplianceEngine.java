package com.example.a11ybroker.service;

import com.example.a11ybroker.access.CapabilityAccess;
import com.example.a11ybroker.access.EventAccess;
import com.example.a11ybroker.config.ComplianceProperties;
import com.example.a11ybroker.models.ApplicationComplianceState;
import com.example.a11ybroker.models.ComplianceLevel;
import com.example.a11ybroker.models.ComplianceReport;
import com.example.a11ybroker.models.ComplianceStatus;
import com.example.a11ybroker.models.Violation;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns per-application compliance state and derives reports from it. State snapshots are
 * immutable and swapped per key, so {@link #derive} and {@link #currentLevel} never block.
 *
 * <p>Mutating methods expect the caller to hold the application's broker lock; that is what
 * keeps an append and its counter increment from interleaving with another event for the
 * same application.
 */
@Service
@Slf4j
public class ComplianceEngine {

    private final ConcurrentHashMap<String, ApplicationComplianceState> states = new ConcurrentHashMap<>();

    private final EventAccess eventAccess;
    private final CapabilityAccess capabilityAccess;
    private final ComplianceProperties properties;

    public ComplianceEngine(EventAccess eventAccess,
                            CapabilityAccess capabilityAccess,
                            ComplianceProperties properties) {
        this.eventAccess = eventAccess;
        this.capabilityAccess = capabilityAccess;
        this.properties = properties;
    }

    /**
     * Level as it stands right now, i.e. before any event currently being accepted is counted.
     */
    public ComplianceLevel currentLevel(String appId) {
        ApplicationComplianceState state = states.get(appId);
        long count = state != null ? state.getEventsCount() : eventAccess.countByAppId(appId);
        return ComplianceLevel.forEventCount(count);
    }

    /**
     * Counts one stored event. Must run once per successful append, after the append.
     */
    public void recordEvent(String appId, long acceptedAt) {
        ApplicationComplianceState next = states.compute(appId, (key, state) -> state == null
                // first event seen by this process: the log already includes it
                ? ApplicationComplianceState.restored(key, eventAccess.countByAppId(key), acceptedAt)
                : state.withEventAccepted(acceptedAt));
        log.debug("App {} now at {} events ({})", appId, next.getEventsCount(), next.getComplianceLevel());
    }

    /**
     * Fails with {@code UNKNOWN_APPLICATION} unless the app has a state, events or a declaration.
     */
    public void requireKnown(String appId) {
        if (!states.containsKey(appId) && !isKnown(appId)) {
            throw BrokerException.unknownApplication(appId);
        }
    }

    public void recordViolation(String appId, Violation violation) {
        requireKnown(appId);
        states.compute(appId, (key, state) -> (state == null
                ? ApplicationComplianceState.restored(key, eventAccess.countByAppId(key), null)
                : state).withViolation(violation));
        if (violation.isCritical()) {
            log.warn("Critical violation '{}' recorded for app {}", violation.getType(), appId);
        } else {
            log.info("Violation '{}' ({}) recorded for app {}",
                    violation.getType(), violation.getSeverity().getWireName(), appId);
        }
    }

    public ComplianceReport derive(String appId) {
        ApplicationComplianceState state = states.get(appId);
        if (state == null) {
            if (!isKnown(appId)) {
                throw BrokerException.unknownApplication(appId);
            }
            state = ApplicationComplianceState.restored(appId, eventAccess.countByAppId(appId), null);
        }

        ComplianceLevel level = state.getComplianceLevel();
        ComplianceStatus status = state.hasCriticalViolation()
                ? ComplianceStatus.NON_COMPLIANT
                : ComplianceStatus.COMPLIANT;

        return ComplianceReport.builder()
                .appId(appId)
                .complianceLevel(level)
                .status(status)
                .eventsCount(state.getEventsCount())
                .violations(state.getViolations())
                .lastEventAt(state.getLastEventAt())
                .certificateUrl(status == ComplianceStatus.COMPLIANT ? certificateUrl(appId, level) : null)
                .build();
    }

    String certificateUrl(String appId, ComplianceLevel level) {
        String base = properties.getCertificateBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + appId + "-" + level.getWireName();
    }

    private boolean isKnown(String appId) {
        return capabilityAccess.findByAppId(appId).isPresent() || eventAccess.countByAppId(appId) > 0;
    }
}
