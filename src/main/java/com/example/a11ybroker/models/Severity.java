package com.example.a11ybroker.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Severity fromString(String v) {
        for (Severity s : values()) {
            if (s.getWireName().equals(v)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown Severity: " + v);
    }
}
