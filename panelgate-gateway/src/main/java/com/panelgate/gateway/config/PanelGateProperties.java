package com.panelgate.gateway.config;

import com.panelgate.common.config.DeploymentEnv;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the PanelGate gateway.
 */
@Data
@ConfigurationProperties(prefix = "panelgate")
public class PanelGateProperties {

    /**
     * Deployment environment: "stg" or "prod". Anything else aborts startup.
     */
    private String env;

    /**
     * Authorization service configuration
     */
    private AuthConfig auth = new AuthConfig();

    /**
     * Kiosk device connection configuration
     */
    private DeviceConfig device = new DeviceConfig();

    /**
     * Service-to-service secret configuration
     */
    private SecretConfig secret = new SecretConfig();

    /**
     * Relay configuration
     */
    private RelayConfig relay = new RelayConfig();

    /**
     * Resolve and validate {@link #env}.
     *
     * @throws IllegalArgumentException when the environment is missing or unknown
     */
    public DeploymentEnv resolveEnv() {
        return DeploymentEnv.parse(env);
    }

    /**
     * Base URL of the authorization service; defaults per environment.
     */
    public String resolveAuthBaseUrl() {
        String configured = auth.getBaseUrl();
        if (configured != null && !configured.isBlank()) {
            return configured.endsWith("/") ? configured.substring(0, configured.length() - 1) : configured;
        }
        return resolveEnv().defaultAuthBaseUrl();
    }

    @Data
    public static class AuthConfig {
        /**
         * Override for the authorization service base URL
         */
        private String baseUrl;

        /**
         * Upper bound for one authorization service call
         */
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Lifetime of cached validation results
         */
        private Duration cacheTtl = Duration.ofSeconds(300);

        /**
         * Capability every connecting user must hold
         */
        private String connectCapability = "admin_access";

        /**
         * Worker threads for blocking authorization calls
         */
        private int workerThreads = 16;
    }

    @Data
    public static class DeviceConfig {
        /**
         * Domain appended to bare kiosk names
         */
        private String domainSuffix = "keymekiosk.com";

        /**
         * Port the kiosk WebSocket server listens on
         */
        private int port = 2026;

        /**
         * Path of the kiosk WebSocket endpoint
         */
        private String path = "/ws";

        /**
         * Bucket holding device public certificates
         */
        private String certBucket = "keyme-calibration";

        /**
         * Key prefix for device certificates: {prefix}/{KIOSK}/{fqdn}.crt
         */
        private String certPrefix = "wss_certs";

        /**
         * Timeout for opening the device WebSocket
         */
        private Duration connectTimeout = Duration.ofSeconds(10);

        /**
         * Largest frame relayed in either direction
         */
        private int maxMessageBytes = 10 * 1024 * 1024;
    }

    @Data
    public static class SecretConfig {
        /**
         * Secrets Manager id of the gateway-to-device bearer secret
         */
        private String secretId = "/prod/key-scanner/env";

        /**
         * AWS region for Secrets Manager and S3
         */
        private String region = "us-east-1";
    }

    @Data
    public static class RelayConfig {
        /**
         * How long the deployed-kiosk gate waits for the panel-info reply
         */
        private Duration handshakeGateTimeout = Duration.ofSeconds(8);

        /**
         * Idle timeout of browser sessions
         */
        private Duration sessionIdleTimeout = Duration.ofMinutes(30);
    }
}
