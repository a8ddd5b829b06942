package com.example.a11ybroker.service;

import lombok.Getter;

public class BrokerException extends RuntimeException {

    public enum Code {
        INVALID_EVENT,
        INVALID_REQUEST,
        UNKNOWN_APPLICATION,
        DUPLICATE_SUBSCRIPTION,
        SUBSCRIPTION_NOT_FOUND,
        EVENT_NOT_FOUND,
        UNKNOWN
    }

    @Getter
    private final Code code;

    private BrokerException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public static BrokerException invalidEvent(String reason) {
        return new BrokerException(Code.INVALID_EVENT, "Invalid event: " + reason);
    }

    public static BrokerException invalidRequest(String reason) {
        return new BrokerException(Code.INVALID_REQUEST, reason);
    }

    public static BrokerException unknownApplication(String appId) {
        return new BrokerException(Code.UNKNOWN_APPLICATION,
                "Application " + appId + " has no events and no capability declaration");
    }

    public static BrokerException duplicateSubscription(String consumerId) {
        return new BrokerException(Code.DUPLICATE_SUBSCRIPTION,
                "Consumer " + consumerId + " already has an active subscription");
    }

    public static BrokerException subscriptionNotFound(String consumerId) {
        return new BrokerException(Code.SUBSCRIPTION_NOT_FOUND,
                "Consumer " + consumerId + " has no subscription");
    }

    public static BrokerException eventNotFound(String appId, String eventId) {
        return new BrokerException(Code.EVENT_NOT_FOUND,
                "Event " + eventId + " does not exist for application " + appId);
    }
}
