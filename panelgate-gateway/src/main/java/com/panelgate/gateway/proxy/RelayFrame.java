package com.panelgate.gateway.proxy;

import java.nio.charset.StandardCharsets;

/**
 * One WebSocket data frame moving through the relay. Exactly one of {@code text} and
 * {@code binary} is set, except for the {@link #END} marker that closes a direction.
 */
public record RelayFrame(String text, byte[] binary) {

    public static final RelayFrame END = new RelayFrame(null, null);

    public static RelayFrame text(String text) {
        return new RelayFrame(text, null);
    }

    public static RelayFrame binary(byte[] data) {
        return new RelayFrame(null, data);
    }

    public boolean isText() {
        return text != null;
    }

    public boolean isEnd() {
        return this == END;
    }

    private int size() {
        if (text != null) {
            return text.getBytes(StandardCharsets.UTF_8).length;
        }
        return binary != null ? binary.length : 0;
    }

    @Override
    public String toString() {
        if (isEnd()) {
            return "RelayFrame[END]";
        }
        return isText() ? "RelayFrame[text " + text.length() + " chars]" : "RelayFrame[binary " + size() + " bytes]";
    }
}
