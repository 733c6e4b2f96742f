package com.panelgate.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.List;

/**
 * Answer of the authorization service for one credential/capability pair.
 *
 * @param granted        whether the capability is granted
 * @param userIdentifier identity of the credential holder, when the service reports one
 * @param attributes     the raw response body
 */
public record GrantRecord(boolean granted, String userIdentifier, JsonNode attributes) {

    private static final List<String> IDENTITY_FIELDS = List.of("email", "user", "username", "user_id");

    public static GrantRecord fromResponse(JsonNode body) {
        JsonNode attrs = body != null ? body : JsonNodeFactory.instance.objectNode();
        JsonNode granted = attrs.get("granted");
        return new GrantRecord(granted != null && granted.asBoolean(false), identityOf(attrs), attrs);
    }

    private static String identityOf(JsonNode body) {
        for (String field : IDENTITY_FIELDS) {
            JsonNode v = body.get(field);
            if (v != null && v.isValueNode() && !v.asText().isBlank()) {
                return v.asText();
            }
        }
        return null;
    }
}
