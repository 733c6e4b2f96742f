package com.panelgate.gateway.auth;

import com.panelgate.common.cache.CredentialCache;
import com.panelgate.common.logging.LogRedact;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;

/**
 * Per-command capability check used by the relay for gated fleet commands.
 * <p>
 * Never throws: transport failures and non-success answers are logged and reported as
 * a denial, so an authorization outage only blocks gated commands.
 */
@Slf4j
public class PermissionChecker {

    private final AuthorizationClient client;
    private final CredentialCache<CapabilityKey, PermissionDecision> cache;
    private final boolean relaxed;

    public PermissionChecker(AuthorizationClient client, CredentialCache<CapabilityKey, PermissionDecision> cache,
            boolean relaxed) {
        this.client = client;
        this.cache = cache;
        this.relaxed = relaxed;
    }

    public PermissionDecision check(String credential, String capability) {
        if (relaxed) {
            return PermissionDecision.bypassed();
        }
        if (credential == null || credential.isBlank()) {
            return PermissionDecision.denied();
        }

        CapabilityKey key = new CapabilityKey(credential, capability);
        Optional<PermissionDecision> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        AuthorizationClient.UpstreamResponse response;
        try {
            response = client.checkPermission(credential, capability);
        } catch (IOException e) {
            log.warn("permission check '{}' failed cred={}: {}", capability,
                    LogRedact.fingerprint(credential), e.getMessage());
            return PermissionDecision.denied();
        } catch (IllegalArgumentException e) {
            log.info("permission check '{}' skipped for malformed cred={}", capability,
                    LogRedact.fingerprint(credential));
            return PermissionDecision.denied();
        }

        if (!response.isSuccessful()) {
            log.info("permission check '{}' returned {} cred={}", capability, response.status(),
                    LogRedact.fingerprint(credential));
            return PermissionDecision.denied();
        }

        PermissionDecision decision = PermissionDecision.of(GrantRecord.fromResponse(response.body()));
        cache.put(key, decision);
        return decision;
    }

    /**
     * Cache key for a credential/capability pair.
     */
    public record CapabilityKey(String credential, String capability) {
        @Override
        public String toString() {
            return "CapabilityKey[" + LogRedact.fingerprint(credential) + ", " + capability + "]";
        }
    }
}
