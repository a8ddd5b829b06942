package com.example.a11ybroker.http;

import com.example.a11ybroker.models.ComplianceLevel;
import com.example.a11ybroker.models.Intent;
import com.example.a11ybroker.models.Subscription;
import com.example.a11ybroker.models.SubscriptionFilter;
import com.example.a11ybroker.requests.CreateSubscriptionHttpRequest;
import com.example.a11ybroker.requests.CreateSubscriptionServiceRequest;
import com.example.a11ybroker.service.BrokerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for consumer subscriptions. A consumer holds at most one active subscription;
 * a second create for the same consumer yields a conflict response.
 */
@RestController
public class SubscriptionController {

    private final BrokerService brokerService;

    public SubscriptionController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @PostMapping("/v1/subscribe")
    public ResponseEntity<SubscriptionResponse> subscribe(@Valid @RequestBody CreateSubscriptionHttpRequest request) {
        Subscription subscription = brokerService.createSubscription(
                CreateSubscriptionServiceRequest.from(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(map(subscription));
    }

    @GetMapping("/v1/subscribe/{consumerId}")
    public ResponseEntity<SubscriptionResponse> get(@PathVariable String consumerId) {
        return ResponseEntity.ok(map(brokerService.getSubscription(consumerId)));
    }

    private SubscriptionResponse map(Subscription subscription) {
        return new SubscriptionResponse(
                subscription.getSubscriptionId(),
                subscription.getConsumerId(),
                subscription.getStatus().getWireName(),
                subscription.getEventTypes().stream().sorted().map(Intent::getWireName).toList(),
                subscription.getWebhookUrl(),
                map(subscription.getFilter()),
                subscription.getCreatedAt(),
                subscription.getExpiresAt()
        );
    }

    private SubscriptionResponse.FilterResponse map(SubscriptionFilter filter) {
        if (filter == null) {
            return null;
        }
        return new SubscriptionResponse.FilterResponse(
                filter.getAppIds().stream().sorted().toList(),
                filter.getIntents().stream().sorted().map(Intent::getWireName).toList(),
                filter.getComplianceLevels().stream().sorted().map(ComplianceLevel::getWireName).toList()
        );
    }
}
