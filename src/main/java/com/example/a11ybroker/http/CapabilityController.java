package com.example.a11ybroker.http;

import com.example.a11ybroker.models.CapabilityDeclaration;
import com.example.a11ybroker.models.Intent;
import com.example.a11ybroker.requests.CapabilityQuery;
import com.example.a11ybroker.requests.DeclareCapabilityHttpRequest;
import com.example.a11ybroker.requests.DeclareCapabilityServiceRequest;
import com.example.a11ybroker.service.BrokerService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for self-declared capabilities. Declarations are informational and do not
 * feed the derived compliance level.
 */
@RestController
public class CapabilityController {

    private final BrokerService brokerService;

    public CapabilityController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @PostMapping("/v1/capabilities")
    public ResponseEntity<CapabilityResponse> declare(@Valid @RequestBody DeclareCapabilityHttpRequest request) {
        CapabilityDeclaration declaration = brokerService.declareCapability(
                DeclareCapabilityServiceRequest.from(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(map(declaration));
    }

    @GetMapping("/v1/capabilities")
    public ResponseEntity<CapabilitiesResponse> query(
            @RequestParam(value = "app_id", required = false) String appId,
            @RequestParam(value = "compliance_level", required = false) String complianceLevel,
            @RequestParam(value = "intent", required = false) String intent
    ) {
        List<CapabilityResponse> capabilities = brokerService
                .queryCapabilities(CapabilityQuery.of(appId, complianceLevel, intent))
                .stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(new CapabilitiesResponse(capabilities, capabilities.size()));
    }

    @GetMapping("/v1/capabilities/{appId}")
    public ResponseEntity<CapabilityResponse> get(@PathVariable String appId) {
        return ResponseEntity.ok(map(brokerService.getCapability(appId)));
    }

    private CapabilityResponse map(CapabilityDeclaration declaration) {
        return new CapabilityResponse(
                declaration.getAppId(),
                declaration.getCapabilities().stream().sorted().map(Intent::getWireName).toList(),
                declaration.getComplianceLevel().getWireName(),
                declaration.getVersion(),
                declaration.getRegisteredAt()
        );
    }
}
