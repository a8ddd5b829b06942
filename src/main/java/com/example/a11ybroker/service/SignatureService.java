package com.example.a11ybroker.service;

import com.example.a11ybroker.models.AccessibilityEvent;
import com.example.a11ybroker.models.Intent;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Service;

/**
 * Deterministic integrity stamp for accepted events: hex SHA-256 over
 * {@code event_id|app_id|intent|timestamp}, with the intent in its wire form and the timestamp in
 * epoch milliseconds. No salt and no key, so any third party holding the four fields can
 * recompute it.
 */
@Service
public class SignatureService {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    public String sign(String eventId, String appId, Intent intent, long timestamp) {
        byte[] digest = sha256().digest(canonical(eventId, appId, intent, timestamp)
                .getBytes(StandardCharsets.UTF_8));
        return bytesToHex(digest);
    }

    /**
     * Recomputes the stamp from the stored fields and compares it to the stored signature.
     */
    public boolean verify(AccessibilityEvent event) {
        String expected = sign(event.getEventId(), event.getAppId(), event.getIntent(), event.getTimestamp());
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                event.getSignature().getBytes(StandardCharsets.UTF_8));
    }

    static String canonical(String eventId, String appId, Intent intent, long timestamp) {
        return String.join("|", eventId, appId, intent.getWireName(), String.valueOf(timestamp));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0F];
        }
        return new String(out);
    }
}
