package com.example.a11ybroker.models;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SubscriptionTest {

    private static final long NOW = 1_700_000_000_000L;

    private static AccessibilityEvent event(String appId, Intent intent) {
        return AccessibilityEvent.builder()
                .eventId("evt_1")
                .appId(appId)
                .intent(intent)
                .timestamp(NOW)
                .acceptedAt(NOW)
                .signature("0".repeat(64))
                .build();
    }

    private static Subscription.SubscriptionBuilder base() {
        return Subscription.builder()
                .subscriptionId("sub_1")
                .consumerId("consumer-1")
                .eventTypes(Set.of(Intent.CAPTIONS_MANDATORY, Intent.SIGN_LANGUAGE))
                .status(SubscriptionStatus.ACTIVE)
                .createdAt(NOW);
    }

    @Test
    @DisplayName("matches only intents listed in event_types when no filter is set")
    void eventTypesOnly() {
        Subscription s = base().build();

        assertTrue(s.matches(event("app-1", Intent.CAPTIONS_MANDATORY), ComplianceLevel.BRONZE));
        assertFalse(s.matches(event("app-1", Intent.REDUCED_MOTION), ComplianceLevel.GOLD));
    }

    @Test
    @DisplayName("filter fields combine conjunctively")
    void filterConjunction() {
        Subscription s = base()
                .filter(SubscriptionFilter.builder()
                        .appIds(Set.of("app-1"))
                        .complianceLevels(Set.of(ComplianceLevel.SILVER))
                        .build())
                .build();

        assertTrue(s.matches(event("app-1", Intent.SIGN_LANGUAGE), ComplianceLevel.SILVER));
        assertFalse(s.matches(event("app-2", Intent.SIGN_LANGUAGE), ComplianceLevel.SILVER));
        assertFalse(s.matches(event("app-1", Intent.SIGN_LANGUAGE), ComplianceLevel.BRONZE));
    }

    @Test
    @DisplayName("filter intents narrow event_types further")
    void filterIntents() {
        Subscription s = base()
                .filter(SubscriptionFilter.builder().intents(Set.of(Intent.SIGN_LANGUAGE)).build())
                .build();

        assertTrue(s.matches(event("app-1", Intent.SIGN_LANGUAGE), ComplianceLevel.BRONZE));
        assertFalse(s.matches(event("app-1", Intent.CAPTIONS_MANDATORY), ComplianceLevel.BRONZE));
    }

    @Test
    @DisplayName("an empty filter places no constraint")
    void emptyFilter() {
        Subscription s = base().filter(SubscriptionFilter.builder().build()).build();

        assertTrue(s.matches(event("any-app", Intent.CAPTIONS_MANDATORY), ComplianceLevel.PLATINUM));
    }

    @Test
    @DisplayName("subscription stops being active at expires_at")
    void expiry() {
        Subscription s = base().expiresAt(NOW + 1000).build();

        assertTrue(s.isActiveAt(NOW + 999));
        assertFalse(s.isExpiredAt(NOW + 999));
        assertFalse(s.isActiveAt(NOW + 1000));
        assertTrue(s.isExpiredAt(NOW + 1000));
    }

    @Test
    @DisplayName("pending and inactive subscriptions are never active")
    void nonActiveStatuses() {
        assertFalse(base().status(SubscriptionStatus.PENDING).build().isActiveAt(NOW));
        assertFalse(base().status(SubscriptionStatus.INACTIVE).build().isActiveAt(NOW));
        assertTrue(base().build().isActiveAt(Long.MAX_VALUE));
    }
}
