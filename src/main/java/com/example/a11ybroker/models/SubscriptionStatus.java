package com.example.a11ybroker.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SubscriptionStatus {
    ACTIVE,
    PENDING,
    INACTIVE;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }
}
