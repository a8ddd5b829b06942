package com.example.a11ybroker.http;

import com.example.a11ybroker.models.AccessibilityEvent;
import com.example.a11ybroker.models.Intent;
import com.example.a11ybroker.requests.SubmitEventBatchHttpRequest;
import com.example.a11ybroker.requests.SubmitEventHttpRequest;
import com.example.a11ybroker.requests.SubmitEventServiceRequest;
import com.example.a11ybroker.service.BrokerException;
import com.example.a11ybroker.service.BrokerService;
import com.example.a11ybroker.service.BrokerService.BatchSubmissionResult;
import com.example.a11ybroker.service.BrokerService.EventSubmissionResult;
import com.example.a11ybroker.service.BrokerService.EventVerification;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for event ingestion and the per-application event log. The log is exposed
 * read-only; there is no update or delete route.
 */
@RestController
public class EventController {

    private final BrokerService brokerService;

    public EventController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @PostMapping("/v1/events")
    public ResponseEntity<EventResponse> submitEvent(
            @RequestBody(required = false) SubmitEventHttpRequest request
    ) {
        EventSubmissionResult result = brokerService.submitEvent(SubmitEventServiceRequest.from(request));
        AccessibilityEvent event = result.event();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new EventResponse(
                        event.getEventId(),
                        EventResponse.ACCEPTED,
                        event.getSignature(),
                        event.getTimestamp(),
                        event.getSequence(),
                        new ArrayList<>(result.matchedConsumers())
                ));
    }

    @PostMapping("/v1/events/batch")
    public ResponseEntity<EventBatchResponse> submitBatch(
            @RequestBody(required = false) SubmitEventBatchHttpRequest request
    ) {
        if (request == null) {
            throw BrokerException.invalidRequest("request body is required");
        }
        BatchSubmissionResult result = brokerService.submitBatch(request.events());
        return ResponseEntity.ok(new EventBatchResponse(
                result.accepted().size(),
                result.errors().size(),
                result.accepted().stream().map(AccessibilityEvent::getEventId).toList(),
                result.errors().stream()
                        .map(e -> new EventBatchResponse.BatchErrorResponse(e.index(), e.code(), e.message()))
                        .toList()
        ));
    }

    @GetMapping("/v1/events/types")
    public ResponseEntity<List<IntentResponse>> listIntents() {
        return ResponseEntity.ok(Arrays.stream(Intent.values())
                .map(i -> new IntentResponse(i.getWireName(), i.getCategory()))
                .toList());
    }

    @GetMapping("/v1/apps/{appId}/events")
    public ResponseEntity<List<EventLogEntryResponse>> eventsFor(@PathVariable String appId) {
        return ResponseEntity.ok(brokerService.eventsFor(appId).stream()
                .map(this::map)
                .toList());
    }

    @GetMapping("/v1/apps/{appId}/events/{eventId}/verification")
    public ResponseEntity<EventVerificationResponse> verifyEvent(
            @PathVariable String appId,
            @PathVariable String eventId
    ) {
        EventVerification verification = brokerService.verifyEvent(appId, eventId);
        return ResponseEntity.ok(new EventVerificationResponse(
                verification.eventId(),
                verification.signature(),
                verification.valid()
        ));
    }

    private EventLogEntryResponse map(AccessibilityEvent event) {
        return new EventLogEntryResponse(
                event.getEventId(),
                event.getAppId(),
                event.getSequence(),
                event.getIntent().getWireName(),
                event.getUserId(),
                event.getTimestamp(),
                event.getAcceptedAt(),
                event.getSignature(),
                event.getComplianceLevelHint() != null ? event.getComplianceLevelHint().getWireName() : null,
                event.getMetadata()
        );
    }
}
