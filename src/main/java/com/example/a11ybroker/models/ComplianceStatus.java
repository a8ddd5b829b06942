package com.example.a11ybroker.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplianceStatus {
    COMPLIANT("compliant"),
    NON_COMPLIANT("non-compliant");

    private final String wireName;

    ComplianceStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
