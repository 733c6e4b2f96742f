package com.panelgate.gateway.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelgate.common.fleet.CapabilityTable;

import java.io.IOException;
import java.util.Optional;

/**
 * Interpretation of a relayed frame. Only the relay decisions depend on this view; the
 * original frame is always what gets forwarded.
 */
public sealed interface RelayMessage permits RelayMessage.GatedRequest, RelayMessage.Response,
        RelayMessage.Passthrough {

    /** Parsed JSON body, when the frame was a JSON object. */
    JsonNode json();

    /**
     * @return true when the frame is a JSON object whose {@code id} is the integer {@code id}
     */
    default boolean hasId(long id) {
        JsonNode node = json();
        if (node == null) {
            return false;
        }
        JsonNode v = node.get("id");
        return v != null && v.isIntegralNumber() && v.asLong() == id;
    }

    /**
     * Request for a fleet command that needs a capability check before it may reach the device.
     */
    record GatedRequest(JsonNode id, String event, String capability, JsonNode json) implements RelayMessage {
    }

    /**
     * Reply to an earlier request: an object with an {@code id} and no {@code event}.
     */
    record Response(JsonNode id, JsonNode json) implements RelayMessage {
    }

    /**
     * Anything else: ungated events, non-JSON text, binary frames.
     */
    record Passthrough(JsonNode json) implements RelayMessage {
        static final Passthrough OPAQUE = new Passthrough(null);
    }

    static RelayMessage classify(RelayFrame frame, ObjectMapper mapper) {
        if (frame == null || !frame.isText()) {
            return Passthrough.OPAQUE;
        }
        JsonNode node;
        try {
            node = mapper.readTree(frame.text());
        } catch (IOException e) {
            return Passthrough.OPAQUE;
        }
        if (node == null || !node.isObject()) {
            return Passthrough.OPAQUE;
        }

        JsonNode event = node.get("event");
        if (event != null && event.isTextual()) {
            Optional<String> capability = CapabilityTable.requiredCapability(event.asText());
            if (capability.isPresent()) {
                return new GatedRequest(node.get("id"), event.asText(), capability.get(), node);
            }
            return new Passthrough(node);
        }
        if (event == null && node.has("id")) {
            return new Response(node.get("id"), node);
        }
        return new Passthrough(node);
    }
}
