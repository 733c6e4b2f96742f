package com.panelgate.gateway.auth;

import com.panelgate.common.cache.CredentialCache;
import com.panelgate.common.logging.LogRedact;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Connect-time validation of a browser credential.
 * <p>
 * Flow: empty credential is rejected locally; a cached grant is returned without an
 * upstream call; otherwise the authorization service is asked for the connect
 * capability and a successful answer is cached for the cache TTL.
 * {@link #validate(String)} and {@link #validateAsync(String)} behave identically and
 * share one cache.
 */
@Slf4j
public class TokenValidator {

    private final AuthorizationClient client;
    private final CredentialCache<String, GrantRecord> cache;
    private final String connectCapability;
    private final boolean relaxed;
    private final Executor executor;

    /**
     * @param relaxed  when true a credential only has to be valid; the capability grant is
     *                 not required
     * @param executor bounded pool that runs {@link #validateAsync(String)}
     */
    public TokenValidator(AuthorizationClient client, CredentialCache<String, GrantRecord> cache,
            String connectCapability, boolean relaxed, Executor executor) {
        this.client = client;
        this.cache = cache;
        this.connectCapability = connectCapability;
        this.relaxed = relaxed;
        this.executor = executor;
    }

    /**
     * Validate a credential, blocking the caller for at most the upstream timeout.
     *
     * @throws AuthException when the credential is missing, invalid or lacks the capability
     */
    public GrantRecord validate(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new AuthException(AuthException.Reason.MISSING_CREDENTIAL);
        }

        Optional<GrantRecord> cached = cache.get(credential);
        if (cached.isPresent()) {
            return cached.get();
        }

        AuthorizationClient.UpstreamResponse response;
        try {
            response = client.checkPermission(credential, connectCapability);
        } catch (IOException e) {
            log.warn("authorization check failed cred={}: {}", LogRedact.fingerprint(credential), e.getMessage());
            throw new AuthException(AuthException.Reason.VALIDATION_UNREACHABLE, e);
        } catch (IllegalArgumentException e) {
            log.info("malformed credential cred={}", LogRedact.fingerprint(credential));
            throw new AuthException(AuthException.Reason.INVALID_OR_EXPIRED);
        }

        if (!response.isSuccessful()) {
            log.info("authorization service returned {} cred={}", response.status(),
                    LogRedact.fingerprint(credential));
            throw new AuthException(AuthException.Reason.INVALID_OR_EXPIRED);
        }

        GrantRecord record = GrantRecord.fromResponse(response.body());
        if (!record.granted() && !relaxed) {
            log.info("connect capability '{}' not granted cred={}", connectCapability,
                    LogRedact.fingerprint(credential));
            throw new AuthException(AuthException.Reason.INSUFFICIENT_CAPABILITY);
        }

        cache.put(credential, record);
        return record;
    }

    /**
     * Same as {@link #validate(String)} but runs on the authorization worker pool.
     * The future fails with the {@link AuthException} itself, not a wrapper.
     */
    public CompletableFuture<GrantRecord> validateAsync(String credential) {
        CompletableFuture<GrantRecord> result = new CompletableFuture<>();
        CompletableFuture.supplyAsync(() -> validate(credential), executor)
                .whenComplete((record, ex) -> {
                    if (ex != null) {
                        result.completeExceptionally(ex instanceof CompletionException && ex.getCause() != null
                                ? ex.getCause()
                                : ex);
                    } else {
                        result.complete(record);
                    }
                });
        return result;
    }

    /**
     * Drop the cached connect-time grant for a credential (logout).
     */
    public boolean revoke(String credential) {
        return cache.pop(credential).isPresent();
    }
}
