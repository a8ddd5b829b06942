package com.example.a11ybroker.access;

import com.example.a11ybroker.models.Subscription;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

@Component
public class InMemorySubscriptionAccess implements SubscriptionAccess {

    private final ConcurrentHashMap<String, Subscription> byConsumer = new ConcurrentHashMap<>();

    @Override
    public Optional<Subscription> saveIfNoneActive(Subscription subscription) {
        AtomicReference<Subscription> conflict = new AtomicReference<>();
        // compute() holds the bin lock for this consumer, making check-then-insert atomic
        byConsumer.compute(subscription.getConsumerId(), (consumerId, existing) -> {
            if (existing != null && existing.isActiveAt(subscription.getCreatedAt())) {
                conflict.set(existing);
                return existing;
            }
            return subscription;
        });
        return Optional.ofNullable(conflict.get());
    }

    @Override
    public Optional<Subscription> findByConsumerId(String consumerId) {
        return Optional.ofNullable(byConsumer.get(consumerId));
    }

    @Override
    public List<Subscription> findAll() {
        return List.copyOf(byConsumer.values());
    }

    @Override
    public void update(Subscription subscription) {
        byConsumer.computeIfPresent(subscription.getConsumerId(), (consumerId, existing) ->
                existing.getSubscriptionId().equals(subscription.getSubscriptionId()) ? subscription : existing);
    }
}
