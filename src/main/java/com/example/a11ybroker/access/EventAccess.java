package com.example.a11ybroker.access;

import com.example.a11ybroker.models.AccessibilityEvent;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the append-only accessibility event log, partitioned by application.
 * Implementations never update or delete a stored event.
 */
public interface EventAccess {

    /**
     * Appends the event to its application's log and returns the stored value, which carries
     * the assigned 1-based {@code sequence}. Callers serialize appends per application.
     */
    AccessibilityEvent append(AccessibilityEvent event);

    /**
     * All events for an application in acceptance order (ascending {@code sequence}).
     *
     * @param appId the application to read
     * @return a snapshot; empty when the application has never emitted
     */
    List<AccessibilityEvent> findAllByAppId(String appId);

    Optional<AccessibilityEvent> findByEventId(String appId, String eventId);

    long countByAppId(String appId);
}
