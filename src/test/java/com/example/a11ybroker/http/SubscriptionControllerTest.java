package com.example.a11ybroker.http;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.a11ybroker.models.ComplianceLevel;
import com.example.a11ybroker.models.Intent;
import com.example.a11ybroker.models.Subscription;
import com.example.a11ybroker.models.SubscriptionFilter;
import com.example.a11ybroker.models.SubscriptionStatus;
import com.example.a11ybroker.requests.CreateSubscriptionServiceRequest;
import com.example.a11ybroker.service.BrokerException;
import com.example.a11ybroker.service.BrokerService;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = SubscriptionController.class)
@Import(RequestIdFilter.class)
class SubscriptionControllerTest {

    private static final String BODY = "{\"consumer_id\":\"relay-service\","
            + "\"event_types\":[\"sign_language\"],"
            + "\"webhook_url\":\"https://relay.example.org/hook\","
            + "\"filter\":{\"compliance_levels\":[\"silver\"]}}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BrokerService brokerService;

    private static Subscription subscription() {
        return Subscription.builder()
                .subscriptionId("sub_1")
                .consumerId("relay-service")
                .eventTypes(Set.of(Intent.SIGN_LANGUAGE))
                .webhookUrl("https://relay.example.org/hook")
                .filter(SubscriptionFilter.builder().complianceLevels(Set.of(ComplianceLevel.SILVER)).build())
                .status(SubscriptionStatus.ACTIVE)
                .createdAt(1727740800000L)
                .build();
    }

    @Test
    @DisplayName("POST subscribe returns 201 with the new subscription")
    void subscribe() throws Exception {
        when(brokerService.createSubscription(any())).thenReturn(subscription());

        mockMvc.perform(MockMvcRequestBuilders.post("/v1/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(MockMvcResultMatchers.status().isCreated())
                .andExpect(MockMvcResultMatchers.jsonPath("$.subscription_id", equalTo("sub_1")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.status", equalTo("active")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.created_at", equalTo(1727740800000L)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.filter.compliance_levels[0]", equalTo("silver")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.filter.app_ids", hasSize(0)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.expires_at").doesNotExist());

        ArgumentCaptor<CreateSubscriptionServiceRequest> captor =
                ArgumentCaptor.forClass(CreateSubscriptionServiceRequest.class);
        verify(brokerService).createSubscription(captor.capture());
        assertEquals("relay-service", captor.getValue().consumerId());
        assertEquals(Set.of(ComplianceLevel.SILVER), captor.getValue().filter().getComplianceLevels());
    }

    @Test
    @DisplayName("POST subscribe returns 409 when the consumer already has an active subscription")
    void subscribeConflict() throws Exception {
        when(brokerService.createSubscription(any()))
                .thenThrow(BrokerException.duplicateSubscription("relay-service"));

        mockMvc.perform(MockMvcRequestBuilders.post("/v1/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(MockMvcResultMatchers.status().isConflict())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("DUPLICATE_SUBSCRIPTION")));
    }

    @Test
    @DisplayName("POST subscribe without event types is 400")
    void subscribeWithoutTypes() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/v1/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"consumer_id\":\"relay-service\",\"event_types\":[]}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INVALID_REQUEST")));
    }

    @Test
    @DisplayName("GET subscription returns it, or 404 when none exists")
    void get() throws Exception {
        when(brokerService.getSubscription("relay-service")).thenReturn(subscription());
        when(brokerService.getSubscription("ghost")).thenThrow(BrokerException.subscriptionNotFound("ghost"));

        mockMvc.perform(MockMvcRequestBuilders.get("/v1/subscribe/relay-service"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.event_types[0]", equalTo("sign_language")));

        mockMvc.perform(MockMvcRequestBuilders.get("/v1/subscribe/ghost"))
                .andExpect(MockMvcResultMatchers.status().isNotFound())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("SUBSCRIPTION_NOT_FOUND")));
    }
}
