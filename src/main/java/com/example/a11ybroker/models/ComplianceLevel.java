package com.example.a11ybroker.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Compliance tiers, declared order is rank order. Derived levels only ever reach {@link #GOLD};
 * {@link #PLATINUM} exists for self-declared capability levels and event hints.
 */
public enum ComplianceLevel {
    BRONZE,
    SILVER,
    GOLD,
    PLATINUM;

    static final long SILVER_THRESHOLD = 50;
    static final long GOLD_THRESHOLD = 200;

    /**
     * Tier reached after {@code eventsCount} accepted events. Non-decreasing in its argument.
     */
    public static ComplianceLevel forEventCount(long eventsCount) {
        if (eventsCount >= GOLD_THRESHOLD) {
            return GOLD;
        }
        if (eventsCount >= SILVER_THRESHOLD) {
            return SILVER;
        }
        // 10+ events is formally bronze; below that there is no lower tier
        return BRONZE;
    }

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ComplianceLevel fromString(String v) {
        for (ComplianceLevel l : values()) {
            if (l.getWireName().equals(v)) {
                return l;
            }
        }
        throw new IllegalArgumentException("Unknown ComplianceLevel: " + v);
    }
}
