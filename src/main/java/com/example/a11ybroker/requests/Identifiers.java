package com.example.a11ybroker.requests;

import java.util.regex.Pattern;

/**
 * Format rules shared by every caller-declared identifier (app, user and consumer ids).
 */
final class Identifiers {

    private static final Pattern CHARSET = Pattern.compile("^[a-zA-Z0-9_-]+$");

    static final int APP_ID_MIN = 3;
    static final int APP_ID_MAX = 64;
    static final int USER_ID_MAX = 128;
    static final int CONSUMER_ID_MAX = 128;

    private Identifiers() {
    }

    /**
     * Returns {@code null} when the value is acceptable, otherwise a short reason.
     */
    static String check(String field, String value, int min, int max) {
        if (value == null || value.isEmpty()) {
            return field + " is required";
        }
        if (value.length() < min || value.length() > max) {
            return field + " must be " + min + "-" + max + " characters";
        }
        if (!CHARSET.matcher(value).matches()) {
            return field + " may only contain letters, digits, '_' and '-'";
        }
        return null;
    }
}
