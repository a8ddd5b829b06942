package com.example.a11ybroker.requests;

import com.example.a11ybroker.models.Severity;
import com.example.a11ybroker.service.BrokerException;

public record RecordViolationServiceRequest(
        String appId,
        String type,
        Severity severity,
        Long timestamp,
        String description
) {
    public RecordViolationServiceRequest {
        String problem = Identifiers.check("app_id", appId, Identifiers.APP_ID_MIN, Identifiers.APP_ID_MAX);
        if (problem != null) {
            throw BrokerException.invalidRequest(problem);
        }
        if (type == null || type.isBlank()) {
            throw BrokerException.invalidRequest("type must be non-blank");
        }
        if (severity == null) {
            throw BrokerException.invalidRequest("severity is required");
        }
    }

    public static RecordViolationServiceRequest from(String appId, RecordViolationHttpRequest request) {
        Severity severity;
        try {
            severity = Severity.fromString(request.severity());
        } catch (IllegalArgumentException ex) {
            throw BrokerException.invalidRequest("unknown severity '" + request.severity() + "'");
        }
        return new RecordViolationServiceRequest(
                appId,
                request.type(),
                severity,
                epochMillis(request),
                request.description()
        );
    }

    private static Long epochMillis(RecordViolationHttpRequest request) {
        if (request.timestamp() == null) {
            return null;
        }
        try {
            return request.timestamp().toEpochMilli();
        } catch (ArithmeticException ex) {
            throw BrokerException.invalidRequest("timestamp is out of range");
        }
    }
}
