package com.example.a11ybroker.access;

import com.example.a11ybroker.models.Subscription;
import java.util.List;
import java.util.Optional;

public interface SubscriptionAccess {

    /**
     * Stores the subscription unless its consumer already holds one that is active at the new
     * subscription's {@code createdAt}. The check and the insert are a single atomic step.
     *
     * @return the conflicting active subscription, or empty when the new one was stored
     */
    Optional<Subscription> saveIfNoneActive(Subscription subscription);

    Optional<Subscription> findByConsumerId(String consumerId);

    List<Subscription> findAll();

    /**
     * Replaces a stored subscription with an updated copy of itself, e.g. to mark it inactive.
     * Does nothing if the consumer's subscription has since been replaced by a different one.
     */
    void update(Subscription subscription);
}
