package com.panelgate.gateway.secret;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Supplies the bearer secret the gateway presents to kiosks.
 * <p>
 * The secret is fetched on first use and kept for the life of the process. Failed
 * fetches are not remembered, so the next caller tries again.
 */
@Slf4j
public class ServiceSecretProvider {

    static final List<String> KEY_FIELDS = List.of("WSS_API_KEY", "api_key", "KEY_SCANNER_API_KEY");

    private final SecretStore store;
    private final String secretId;
    private final ObjectMapper objectMapper;

    private volatile String cached;

    public ServiceSecretProvider(SecretStore store, String secretId, ObjectMapper objectMapper) {
        this.store = store;
        this.secretId = secretId;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the secret, or empty when it cannot be obtained
     */
    public Optional<String> get() {
        String value = cached;
        if (value != null) {
            return Optional.of(value);
        }
        synchronized (this) {
            if (cached != null) {
                return Optional.of(cached);
            }
            String raw;
            try {
                raw = store.getSecretString(secretId);
            } catch (IOException e) {
                log.error("service secret {} unavailable: {}", secretId, e.getMessage());
                return Optional.empty();
            }
            Optional<String> extracted = extract(raw);
            if (extracted.isEmpty()) {
                log.error("service secret {} holds no usable key", secretId);
                return Optional.empty();
            }
            cached = extracted.get();
            return extracted;
        }
    }

    public boolean isAvailable() {
        return get().isPresent();
    }

    /**
     * Pull the key out of a secret string: a JSON object yields its first known key field,
     * anything else is used verbatim.
     */
    Optional<String> extract(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{")) {
            try {
                JsonNode node = objectMapper.readTree(trimmed);
                if (node != null && node.isObject()) {
                    for (String field : KEY_FIELDS) {
                        JsonNode v = node.get(field);
                        if (v != null && v.isTextual() && !v.asText().isBlank()) {
                            return Optional.of(v.asText());
                        }
                    }
                    return Optional.empty();
                }
            } catch (IOException e) {
                log.debug("service secret is not JSON, using it verbatim");
            }
        }
        return Optional.of(trimmed);
    }
}
