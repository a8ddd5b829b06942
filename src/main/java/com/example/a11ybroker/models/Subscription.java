package com.example.a11ybroker.models;

import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Subscription {
    @NonNull String subscriptionId;
    @NonNull String consumerId;
    @NonNull Set<Intent> eventTypes;
    @NonNull SubscriptionStatus status;
    @NonNull Long createdAt;

    String webhookUrl;
    SubscriptionFilter filter;
    Long expiresAt;

    /**
     * Active means status {@code ACTIVE} and not yet past {@code expiresAt}.
     */
    public boolean isActiveAt(long now) {
        return status == SubscriptionStatus.ACTIVE && (expiresAt == null || now < expiresAt);
    }

    public boolean isExpiredAt(long now) {
        return expiresAt != null && now >= expiresAt;
    }

    public boolean matches(AccessibilityEvent event, ComplianceLevel levelAtMatch) {
        if (!eventTypes.contains(event.getIntent())) {
            return false;
        }
        return filter == null || filter.matches(event.getAppId(), event.getIntent(), levelAtMatch);
    }
}
