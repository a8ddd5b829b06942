package com.example.a11ybroker.service;

import com.example.a11ybroker.access.SubscriptionAccess;
import com.example.a11ybroker.config.SubscriptionProperties;
import com.example.a11ybroker.models.AccessibilityEvent;
import com.example.a11ybroker.models.ComplianceLevel;
import com.example.a11ybroker.models.Subscription;
import com.example.a11ybroker.models.SubscriptionStatus;
import com.example.a11ybroker.requests.CreateSubscriptionServiceRequest;
import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps consumer subscriptions and computes, for each accepted event, which consumers it must
 * be delivered to. Delivery itself happens elsewhere.
 */
@Service
@Slf4j
public class SubscriptionMatcher {

    private static final long MILLIS_PER_DAY = 86400000L;

    private final SubscriptionAccess subscriptionAccess;
    private final SubscriptionProperties properties;
    private final Clock clock;

    public SubscriptionMatcher(SubscriptionAccess subscriptionAccess,
                               SubscriptionProperties properties,
                               Clock clock) {
        this.subscriptionAccess = subscriptionAccess;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates an active subscription. A consumer holds at most one active subscription; a second
     * request fails and leaves the existing one untouched.
     */
    public Subscription subscribe(CreateSubscriptionServiceRequest request) {
        Objects.requireNonNull(request, "request");

        long now = clock.millis();
        Subscription subscription = Subscription.builder()
                .subscriptionId("sub_" + UUID.randomUUID().toString().replace("-", ""))
                .consumerId(request.consumerId())
                .eventTypes(request.eventTypes())
                .webhookUrl(request.webhookUrl())
                .filter(request.filter())
                .status(SubscriptionStatus.ACTIVE)
                .createdAt(now)
                .expiresAt(properties.getTtlDays() > 0 ? now + properties.getTtlDays() * MILLIS_PER_DAY : null)
                .build();

        subscriptionAccess.saveIfNoneActive(subscription).ifPresent(existing -> {
            log.info("Rejected duplicate subscription for consumer {} (active: {})",
                    request.consumerId(), existing.getSubscriptionId());
            throw BrokerException.duplicateSubscription(request.consumerId());
        });

        log.info("Subscription {} created for consumer {}", subscription.getSubscriptionId(), subscription.getConsumerId());
        return subscription;
    }

    public Subscription get(String consumerId) {
        return subscriptionAccess.findByConsumerId(consumerId)
                .orElseThrow(() -> BrokerException.subscriptionNotFound(consumerId));
    }

    /**
     * Consumers whose active subscription matches the event.
     *
     * @param event        the accepted event
     * @param levelAtMatch the application's level before this event was counted
     * @return consumer ids, sorted
     */
    public Set<String> match(AccessibilityEvent event, ComplianceLevel levelAtMatch) {
        long now = clock.millis();
        return subscriptionAccess.findAll().stream()
                .filter(s -> s.isActiveAt(now))
                .filter(s -> s.matches(event, levelAtMatch))
                .map(Subscription::getConsumerId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Moves subscriptions past their expiry to {@code INACTIVE}.
     *
     * @return how many were transitioned
     */
    public int deactivateExpired() {
        long now = clock.millis();
        int count = 0;
        for (Subscription s : subscriptionAccess.findAll()) {
            if (s.getStatus() == SubscriptionStatus.ACTIVE && s.isExpiredAt(now)) {
                subscriptionAccess.update(s.toBuilder().status(SubscriptionStatus.INACTIVE).build());
                count++;
            }
        }
        return count;
    }
}
