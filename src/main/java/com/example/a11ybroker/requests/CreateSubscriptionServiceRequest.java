package com.example.a11ybroker.requests;

import com.example.a11ybroker.models.Intent;
import com.example.a11ybroker.models.SubscriptionFilter;
import com.example.a11ybroker.service.BrokerException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Set;

public record CreateSubscriptionServiceRequest(
        String consumerId,
        Set<Intent> eventTypes,
        String webhookUrl,
        SubscriptionFilter filter
) {
    public CreateSubscriptionServiceRequest {
        String problem = Identifiers.check("consumer_id", consumerId, 1, Identifiers.CONSUMER_ID_MAX);
        if (problem != null) {
            throw BrokerException.invalidRequest(problem);
        }
        if (eventTypes == null || eventTypes.isEmpty()) {
            throw BrokerException.invalidRequest("event_types must not be empty");
        }
        if (webhookUrl != null && !isHttpUrl(webhookUrl)) {
            throw BrokerException.invalidRequest("webhook_url must be an absolute http(s) URL");
        }
        eventTypes = Set.copyOf(eventTypes);
    }

    public static CreateSubscriptionServiceRequest from(CreateSubscriptionHttpRequest request) {
        SubscriptionFilter filter = null;
        if (request.filter() != null) {
            SubscriptionFilterHttpRequest f = request.filter();
            filter = SubscriptionFilter.builder()
                    .appIds(filterAppIds(f.appIds()))
                    .intents(Parsing.intents(f.intents()))
                    .complianceLevels(Parsing.levels(f.complianceLevels()))
                    .build();
        }
        return new CreateSubscriptionServiceRequest(
                request.consumerId(),
                Parsing.intents(request.eventTypes()),
                request.webhookUrl(),
                filter
        );
    }

    private static Set<String> filterAppIds(List<String> appIds) {
        if (appIds == null) {
            return Set.of();
        }
        for (String appId : appIds) {
            String problem = Identifiers.check("filter.app_ids entry", appId, Identifiers.APP_ID_MIN, Identifiers.APP_ID_MAX);
            if (problem != null) {
                throw BrokerException.invalidRequest(problem);
            }
        }
        return Set.copyOf(appIds);
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            return uri.isAbsolute()
                    && uri.getHost() != null
                    && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()));
        } catch (URISyntaxException ex) {
            return false;
        }
    }
}
