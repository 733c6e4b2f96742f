package com.panelgate.app.api;

import com.panelgate.gateway.secret.ServiceSecretProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Readiness probe: the gateway can only serve sessions when the device secret is available.
 */
@RestController
public class StatusController {

    private final ServiceSecretProvider secretProvider;

    public StatusController(ServiceSecretProvider secretProvider) {
        this.secretProvider = secretProvider;
    }

    @GetMapping("/api/status")
    public ResponseEntity<Map<String, String>> status() {
        if (secretProvider.isAvailable()) {
            return ResponseEntity.ok(Map.of("status", "ok"));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("status", "error", "missing", "WSS API key"));
    }
}
