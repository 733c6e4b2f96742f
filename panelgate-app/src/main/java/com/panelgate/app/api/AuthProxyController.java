package com.panelgate.app.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.panelgate.common.logging.LogRedact;
import com.panelgate.gateway.auth.AuthorizationClient;
import com.panelgate.gateway.auth.TokenValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Map;

/**
 * Login/logout pass-through to the authorization service, plus an unauthenticated ping.
 */
@Slf4j
@RestController
public class AuthProxyController {

    private final AuthorizationClient authorizationClient;
    private final TokenValidator tokenValidator;

    public AuthProxyController(AuthorizationClient authorizationClient, TokenValidator tokenValidator) {
        this.authorizationClient = authorizationClient;
        this.tokenValidator = tokenValidator;
    }

    @PostMapping(value = "/api/login", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Object> login(@RequestBody(required = false) JsonNode body) {
        return proxy("/api/login", body, "Login service unavailable");
    }

    /**
     * Drops the cached grant of the session token before forwarding, so a logged-out
     * token cannot open new relays from cache.
     */
    @PostMapping(value = "/api/logout", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Object> logout(@RequestBody(required = false) JsonNode body) {
        JsonNode token = body != null ? body.get("session_token") : null;
        if (token != null && token.isTextual() && tokenValidator.revoke(token.asText())) {
            log.info("revoked cached grant cred={}", LogRedact.fingerprint(token.asText()));
        }
        return proxy("/api/logout", body, "Logout service unavailable");
    }

    @GetMapping("/api/ping")
    public Map<String, String> ping() {
        return Map.of("status", "ok", "source", "cloud");
    }

    private ResponseEntity<Object> proxy(String path, JsonNode body, String unavailable) {
        JsonNode payload = body != null ? body : JsonNodeFactory.instance.objectNode();
        try {
            AuthorizationClient.UpstreamResponse response = authorizationClient.post(path, payload);
            Object responseBody = response.body().isNull() || response.body().isMissingNode()
                    ? Map.of()
                    : response.body();
            return ResponseEntity.status(response.status()).body(responseBody);
        } catch (IOException e) {
            log.warn("{} proxy failed: {}", path, LogRedact.redactSensitiveText(e.getMessage()));
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", unavailable));
        }
    }
}
