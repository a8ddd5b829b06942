package com.example.a11ybroker.access;

import com.example.a11ybroker.models.CapabilityDeclaration;
import java.util.List;
import java.util.Optional;

public interface CapabilityAccess {

    /**
     * Stores the declaration, replacing any earlier one for the same application in one step.
     */
    void save(CapabilityDeclaration declaration);

    Optional<CapabilityDeclaration> findByAppId(String appId);

    /**
     * Snapshot of every declaration, in first-registration order.
     */
    List<CapabilityDeclaration> findAll();
}
