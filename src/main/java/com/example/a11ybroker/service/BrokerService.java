package com.example.a11ybroker.service;

import com.example.a11ybroker.access.EventAccess;
import com.example.a11ybroker.config.EventIngestionProperties;
import com.example.a11ybroker.models.AccessibilityEvent;
import com.example.a11ybroker.models.CapabilityDeclaration;
import com.example.a11ybroker.models.ComplianceLevel;
import com.example.a11ybroker.models.ComplianceReport;
import com.example.a11ybroker.models.Subscription;
import com.example.a11ybroker.models.Violation;
import com.example.a11ybroker.requests.CapabilityQuery;
import com.example.a11ybroker.requests.CreateSubscriptionServiceRequest;
import com.example.a11ybroker.requests.DeclareCapabilityServiceRequest;
import com.example.a11ybroker.requests.RecordViolationServiceRequest;
import com.example.a11ybroker.requests.SubmitEventHttpRequest;
import com.example.a11ybroker.requests.SubmitEventServiceRequest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single entry point of the broker. For each incoming event it signs, appends, counts and
 * matches, in that order, while holding a lock scoped to the event's application. Different
 * applications proceed in parallel.
 */
@Service
@Slf4j
public class BrokerService {

    private final EventAccess eventAccess;
    private final SignatureService signatureService;
    private final ComplianceEngine complianceEngine;
    private final CapabilityRegistry capabilityRegistry;
    private final SubscriptionMatcher subscriptionMatcher;
    private final EventIngestionProperties ingestionProperties;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> appLocks = new ConcurrentHashMap<>();

    public BrokerService(EventAccess eventAccess,
                         SignatureService signatureService,
                         ComplianceEngine complianceEngine,
                         CapabilityRegistry capabilityRegistry,
                         SubscriptionMatcher subscriptionMatcher,
                         EventIngestionProperties ingestionProperties,
                         Clock clock) {
        this.eventAccess = eventAccess;
        this.signatureService = signatureService;
        this.complianceEngine = complianceEngine;
        this.capabilityRegistry = capabilityRegistry;
        this.subscriptionMatcher = subscriptionMatcher;
        this.ingestionProperties = ingestionProperties;
        this.clock = clock;
    }

    /**
     * Accepts one validated event. The subscription match uses the compliance level as it stood
     * before this event was counted, so an event never qualifies itself through its own bump.
     */
    public EventSubmissionResult submitEvent(SubmitEventServiceRequest request) {
        Objects.requireNonNull(request, "request");

        long now = clock.millis();
        String eventId = "evt_" + UUID.randomUUID().toString().replace("-", "");
        long timestamp = request.timestamp() != null ? request.timestamp() : now;

        AccessibilityEvent candidate = AccessibilityEvent.builder()
                .eventId(eventId)
                .appId(request.appId())
                .userId(request.userId())
                .intent(request.intent())
                .timestamp(timestamp)
                .acceptedAt(now)
                .metadata(request.metadata())
                .complianceLevelHint(request.complianceLevelHint())
                .signature(signatureService.sign(eventId, request.appId(), request.intent(), timestamp))
                .build();

        ReentrantLock lock = lockFor(request.appId());
        lock.lock();
        try {
            ComplianceLevel levelAtMatch = complianceEngine.currentLevel(request.appId());
            AccessibilityEvent stored = eventAccess.append(candidate);
            complianceEngine.recordEvent(stored.getAppId(), stored.getAcceptedAt());
            Set<String> consumers = subscriptionMatcher.match(stored, levelAtMatch);

            log.debug("Accepted event {} ({}) for app {} at sequence {}, matched {} consumer(s)",
                    stored.getEventId(), stored.getIntent().getWireName(), stored.getAppId(),
                    stored.getSequence(), consumers.size());
            return new EventSubmissionResult(stored, levelAtMatch, consumers);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Accepts each entry independently; a rejected or failed entry is reported by index and does
     * not affect the others.
     */
    public BatchSubmissionResult submitBatch(List<SubmitEventHttpRequest> events) {
        if (events == null || events.isEmpty()) {
            throw BrokerException.invalidRequest("events must not be empty");
        }
        if (events.size() > ingestionProperties.getMaxBatchSize()) {
            throw BrokerException.invalidRequest("batch holds " + events.size()
                    + " events, limit is " + ingestionProperties.getMaxBatchSize());
        }

        List<AccessibilityEvent> accepted = new ArrayList<>();
        List<BatchError> errors = new ArrayList<>();
        for (int i = 0; i < events.size(); i++) {
            try {
                accepted.add(submitEvent(SubmitEventServiceRequest.from(events.get(i))).event());
            } catch (BrokerException ex) {
                log.warn("Batch entry {} rejected: {}", i, ex.getMessage());
                errors.add(new BatchError(i, ex.getCode().name(), ex.getMessage()));
            } catch (RuntimeException ex) {
                log.error("Batch entry {} failed", i, ex);
                errors.add(new BatchError(i, BrokerException.Code.UNKNOWN.name(),
                        "event could not be accepted"));
            }
        }
        return new BatchSubmissionResult(accepted, errors);
    }

    public List<AccessibilityEvent> eventsFor(String appId) {
        return eventAccess.findAllByAppId(appId);
    }

    public EventVerification verifyEvent(String appId, String eventId) {
        AccessibilityEvent event = eventAccess.findByEventId(appId, eventId)
                .orElseThrow(() -> BrokerException.eventNotFound(appId, eventId));
        return new EventVerification(event.getEventId(), event.getSignature(), signatureService.verify(event));
    }

    public CapabilityDeclaration declareCapability(DeclareCapabilityServiceRequest request) {
        return capabilityRegistry.declare(request);
    }

    public List<CapabilityDeclaration> queryCapabilities(CapabilityQuery query) {
        return capabilityRegistry.query(query);
    }

    public CapabilityDeclaration getCapability(String appId) {
        return capabilityRegistry.get(appId);
    }

    public Subscription createSubscription(CreateSubscriptionServiceRequest request) {
        return subscriptionMatcher.subscribe(request);
    }

    public Subscription getSubscription(String consumerId) {
        return subscriptionMatcher.get(consumerId);
    }

    public ComplianceReport getCompliance(String appId) {
        return complianceEngine.derive(appId);
    }

    /**
     * Appends an auditor-reported violation. Serialized with event acceptance for the same
     * application so a first-touch restore cannot race an in-flight append.
     */
    public ComplianceReport recordViolation(RecordViolationServiceRequest request) {
        Objects.requireNonNull(request, "request");

        Violation violation = Violation.builder()
                .type(request.type())
                .severity(request.severity())
                .timestamp(request.timestamp() != null ? request.timestamp() : clock.millis())
                .description(request.description())
                .build();

        complianceEngine.requireKnown(request.appId());
        ReentrantLock lock = lockFor(request.appId());
        lock.lock();
        try {
            complianceEngine.recordViolation(request.appId(), violation);
        } finally {
            lock.unlock();
        }
        return complianceEngine.derive(request.appId());
    }

    int trackedLockCount() {
        return appLocks.size();
    }

    private ReentrantLock lockFor(String appId) {
        return appLocks.computeIfAbsent(appId, k -> new ReentrantLock());
    }

    /**
     * Outcome of accepting one event.
     */
    public record EventSubmissionResult(
            AccessibilityEvent event,
            ComplianceLevel levelAtMatch,
            Set<String> matchedConsumers
    ) { }

    public record BatchSubmissionResult(
            List<AccessibilityEvent> accepted,
            List<BatchError> errors
    ) { }

    public record BatchError(int index, String code, String message) { }

    public record EventVerification(String eventId, String signature, boolean valid) { }
}
