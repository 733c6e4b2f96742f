package com.panelgate.gateway.proxy;

import java.nio.charset.StandardCharsets;

/**
 * WebSocket close-reason truncation. A close frame carries at most 123 bytes of reason.
 */
public final class CloseReason {

    private CloseReason() {
    }

    /** Maximum bytes allowed in a close-reason payload. */
    public static final int CLOSE_REASON_MAX_BYTES = 120;

    public static String truncate(String reason) {
        return truncate(reason, CLOSE_REASON_MAX_BYTES);
    }

    public static String truncate(String reason, int maxBytes) {
        if (reason == null || reason.isEmpty()) {
            return "";
        }
        byte[] encoded = reason.getBytes(StandardCharsets.UTF_8);
        if (encoded.length <= maxBytes) {
            return reason;
        }
        // may drop a trailing partial character
        String cut = new String(encoded, 0, maxBytes, StandardCharsets.UTF_8);
        return cut.endsWith("\uFFFD") ? cut.substring(0, cut.length() - 1) : cut;
    }
}
