package com.example.a11ybroker.requests;

import com.example.a11ybroker.models.ComplianceLevel;
import com.example.a11ybroker.models.Intent;
import com.example.a11ybroker.service.BrokerException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated event submission. Construction fails with {@code INVALID_EVENT} before anything is
 * signed, stored or counted.
 */
public record SubmitEventServiceRequest(
        String appId,
        String userId,
        Intent intent,
        Long timestamp,
        Map<String, Object> metadata,
        ComplianceLevel complianceLevelHint
) {
    public SubmitEventServiceRequest {
        String problem = Identifiers.check("app_id", appId, Identifiers.APP_ID_MIN, Identifiers.APP_ID_MAX);
        if (problem != null) {
            throw BrokerException.invalidEvent(problem);
        }
        if (userId != null) {
            problem = Identifiers.check("user_id", userId, 1, Identifiers.USER_ID_MAX);
            if (problem != null) {
                throw BrokerException.invalidEvent(problem);
            }
        }
        if (intent == null) {
            throw BrokerException.invalidEvent("intent is required");
        }
        if (timestamp != null && timestamp < 0) {
            throw BrokerException.invalidEvent("timestamp must not precede the epoch");
        }
        metadata = metadata == null ? Map.of() : freezeMap(metadata);
    }

    public static SubmitEventServiceRequest from(SubmitEventHttpRequest request) {
        if (request == null) {
            throw BrokerException.invalidEvent("body is required");
        }
        if (request.intent() == null || !Intent.isKnown(request.intent())) {
            throw BrokerException.invalidEvent("unknown intent '" + request.intent() + "'");
        }
        ComplianceLevel hint = null;
        if (request.complianceLevel() != null) {
            try {
                hint = ComplianceLevel.fromString(request.complianceLevel());
            } catch (IllegalArgumentException ex) {
                throw BrokerException.invalidEvent("unknown compliance_level '" + request.complianceLevel() + "'");
            }
        }
        return new SubmitEventServiceRequest(
                request.appId(),
                request.userId(),
                Intent.fromString(request.intent()),
                parseTimestamp(request.timestamp()),
                request.metadata(),
                hint
        );
    }

    private static Long parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value).toEpochMilli();
        } catch (DateTimeParseException ex) {
            throw BrokerException.invalidEvent("timestamp '" + value + "' is not an ISO-8601 instant");
        } catch (DateTimeException | ArithmeticException ex) {
            throw BrokerException.invalidEvent("timestamp '" + value + "' is out of range");
        }
    }

    // Nested maps and lists are copied too; a stored event must not change through a caller's reference.
    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(freeze(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
