package com.example.a11ybroker.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed taxonomy of accessibility intents an application may declare or emit. The wire form is
 * the lower snake_case name; anything outside this set is rejected at the boundary.
 */
public enum Intent {
    VISUAL_ONLY("visual_only", "visual"),
    SIGN_LANGUAGE("sign_language", "visual"),
    REDUCED_MOTION("reduced_motion", "motion"),
    HIGH_CONTRAST("high_contrast", "visual"),
    CAPTIONS_MANDATORY("captions_mandatory", "text"),
    NO_AUDIO_CUES("no_audio_cues", "audio"),
    VISUAL_ALERTS("visual_alerts", "visual"),
    TEXT_PRIMARY("text_primary", "text");

    private final String wireName;
    private final String category;

    Intent(String wireName, String category) {
        this.wireName = wireName;
        this.category = category;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getCategory() {
        return category;
    }

    @JsonCreator
    public static Intent fromString(String v) {
        for (Intent i : values()) {
            if (i.wireName.equals(v)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Unknown Intent: " + v);
    }

    public static boolean isKnown(String v) {
        for (Intent i : values()) {
            if (i.wireName.equals(v)) {
                return true;
            }
        }
        return false;
    }
}
