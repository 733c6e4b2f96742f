package com.panelgate.common.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Deployment environment the gateway runs in. Selected once at startup.
 * <p>
 * {@link #STG} is the restrictive deployment: it may never drive a kiosk that is
 * serving customers, so every session runs the panel-info handshake gate. The staging
 * authorization service does not carry per-capability grants, so the same mode only
 * requires a valid credential and skips capability checks.
 */
public enum DeploymentEnv {

    STG("stg", "http://anf.k8s.staging.keymecloud.com"),
    PROD("prod", "https://anf.k8s.production.keymecloud.com");

    private final String id;
    private final String defaultAuthBaseUrl;

    DeploymentEnv(String id, String defaultAuthBaseUrl) {
        this.id = id;
        this.defaultAuthBaseUrl = defaultAuthBaseUrl;
    }

    public String id() {
        return id;
    }

    public String defaultAuthBaseUrl() {
        return defaultAuthBaseUrl;
    }

    /** Whether sessions must pass the deployed-kiosk handshake gate. */
    public boolean isRestrictive() {
        return this == STG;
    }

    /** Whether capability grants are skipped and only credential validity counts. */
    public boolean isRelaxedAuthorization() {
        return this == STG;
    }

    /**
     * Parse an environment id.
     *
     * @throws IllegalArgumentException if the value is not a known environment
     */
    public static DeploymentEnv parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (DeploymentEnv env : values()) {
            if (env.id.equals(normalized)) {
                return env;
            }
        }
        String valid = Arrays.stream(values()).map(DeploymentEnv::id).sorted()
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
                "Invalid deployment env '" + value + "'. Must be one of [" + valid + "].");
    }
}
