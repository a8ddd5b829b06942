package com.example.a11ybroker.http;

import com.example.a11ybroker.models.ComplianceReport;
import com.example.a11ybroker.models.Violation;
import com.example.a11ybroker.requests.RecordViolationHttpRequest;
import com.example.a11ybroker.requests.RecordViolationServiceRequest;
import com.example.a11ybroker.service.BrokerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ComplianceController {

    private final BrokerService brokerService;

    public ComplianceController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @GetMapping("/v1/compliance/{appId}")
    public ResponseEntity<ComplianceReportResponse> getCompliance(@PathVariable String appId) {
        return ResponseEntity.ok(map(brokerService.getCompliance(appId)));
    }

    @PostMapping("/v1/compliance/{appId}/violations")
    public ResponseEntity<ComplianceReportResponse> recordViolation(
            @PathVariable String appId,
            @Valid @RequestBody RecordViolationHttpRequest request
    ) {
        ComplianceReport report = brokerService.recordViolation(
                RecordViolationServiceRequest.from(appId, request));
        return ResponseEntity.status(HttpStatus.CREATED).body(map(report));
    }

    private ComplianceReportResponse map(ComplianceReport report) {
        return new ComplianceReportResponse(
                report.getAppId(),
                report.getComplianceLevel().getWireName(),
                report.getStatus().getWireName(),
                report.getEventsCount(),
                report.getViolations().stream().map(this::map).toList(),
                report.getLastEventAt(),
                report.getCertificateUrl()
        );
    }

    private ComplianceReportResponse.ViolationResponse map(Violation violation) {
        return new ComplianceReportResponse.ViolationResponse(
                violation.getType(),
                violation.getSeverity().getWireName(),
                violation.getTimestamp(),
                violation.getDescription()
        );
    }
}
