package com.example.a11ybroker.access;

import com.example.a11ybroker.models.AccessibilityEvent;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local event log. Each application's log is copy-on-write, so readers iterate a stable
 * snapshot and never wait on an in-flight append.
 */
@Component
@ConditionalOnProperty(value = "broker.persistence.dynamo.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryEventAccess implements EventAccess {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<AccessibilityEvent>> logs = new ConcurrentHashMap<>();

    @Override
    public AccessibilityEvent append(AccessibilityEvent event) {
        CopyOnWriteArrayList<AccessibilityEvent> log = logs.computeIfAbsent(event.getAppId(),
                k -> new CopyOnWriteArrayList<>());
        synchronized (log) {
            AccessibilityEvent stored = event.toBuilder()
                    .sequence((long) log.size() + 1)
                    .build();
            log.add(stored);
            return stored;
        }
    }

    @Override
    public List<AccessibilityEvent> findAllByAppId(String appId) {
        CopyOnWriteArrayList<AccessibilityEvent> log = logs.get(appId);
        return log == null ? List.of() : List.copyOf(log);
    }

    @Override
    public Optional<AccessibilityEvent> findByEventId(String appId, String eventId) {
        CopyOnWriteArrayList<AccessibilityEvent> log = logs.get(appId);
        if (log == null) {
            return Optional.empty();
        }
        return log.stream()
                .filter(e -> e.getEventId().equals(eventId))
                .findFirst();
    }

    @Override
    public long countByAppId(String appId) {
        CopyOnWriteArrayList<AccessibilityEvent> log = logs.get(appId);
        return log == null ? 0 : log.size();
    }
}
