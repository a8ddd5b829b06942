package com.example.a11ybroker.access;

import com.example.a11ybroker.models.CapabilityDeclaration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Keyed registry of declarations. Declarations are immutable values, so a replace swaps one
 * reference and readers see either the old declaration or the new one, never a mix.
 */
@Component
public class InMemoryCapabilityAccess implements CapabilityAccess {

    // re-declaring keeps the application's original position
    private final Map<String, CapabilityDeclaration> declarations = new LinkedHashMap<>();

    @Override
    public synchronized void save(CapabilityDeclaration declaration) {
        declarations.put(declaration.getAppId(), declaration);
    }

    @Override
    public synchronized Optional<CapabilityDeclaration> findByAppId(String appId) {
        return Optional.ofNullable(declarations.get(appId));
    }

    @Override
    public synchronized List<CapabilityDeclaration> findAll() {
        return List.copyOf(declarations.values());
    }
}
