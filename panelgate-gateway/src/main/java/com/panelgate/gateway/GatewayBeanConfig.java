package com.panelgate.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelgate.common.cache.CredentialCache;
import com.panelgate.common.config.DeploymentEnv;
import com.panelgate.gateway.auth.AuthorizationClient;
import com.panelgate.gateway.auth.GrantRecord;
import com.panelgate.gateway.auth.PermissionChecker;
import com.panelgate.gateway.auth.PermissionDecision;
import com.panelgate.gateway.auth.TokenValidator;
import com.panelgate.gateway.config.PanelGateProperties;
import com.panelgate.gateway.device.DeviceCertStore;
import com.panelgate.gateway.device.DeviceIdentityResolver;
import com.panelgate.gateway.device.ObjectStorage;
import com.panelgate.gateway.device.S3ObjectStorage;
import com.panelgate.gateway.proxy.ConnectionGateway;
import com.panelgate.gateway.proxy.DeviceDialer;
import com.panelgate.gateway.proxy.OkHttpDeviceDialer;
import com.panelgate.gateway.runtime.ConnectionCounter;
import com.panelgate.gateway.runtime.HealthMonitor;
import com.panelgate.gateway.runtime.ProcResourceProbe;
import com.panelgate.gateway.runtime.ResourceProbe;
import com.panelgate.gateway.secret.SecretStore;
import com.panelgate.gateway.secret.SecretsManagerSecretStore;
import com.panelgate.gateway.secret.ServiceSecretProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for gateway beans.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PanelGateProperties.class)
public class GatewayBeanConfig {

    @Bean
    public DeploymentEnv deploymentEnv(PanelGateProperties properties) {
        DeploymentEnv env = properties.resolveEnv();
        log.info("deployment env={} restrictive={} relaxedAuthorization={} authBaseUrl={}",
                env.id(), env.isRestrictive(), env.isRelaxedAuthorization(), properties.resolveAuthBaseUrl());
        return env;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService authExecutor(PanelGateProperties properties) {
        return Executors.newFixedThreadPool(properties.getAuth().getWorkerThreads(), daemonThreads("auth-worker-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService relayExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("relay-"));
    }

    @Bean
    public AuthorizationClient authorizationClient(PanelGateProperties properties, ObjectMapper objectMapper) {
        return new AuthorizationClient(properties.resolveAuthBaseUrl(), properties.getAuth().getTimeout(), objectMapper);
    }

    @Bean
    public TokenValidator tokenValidator(AuthorizationClient client, PanelGateProperties properties,
            DeploymentEnv env, @Qualifier("authExecutor") ExecutorService authExecutor) {
        CredentialCache<String, GrantRecord> cache = new CredentialCache<>(properties.getAuth().getCacheTtl());
        return new TokenValidator(client, cache, properties.getAuth().getConnectCapability(),
                env.isRelaxedAuthorization(), authExecutor);
    }

    @Bean
    public PermissionChecker permissionChecker(AuthorizationClient client, PanelGateProperties properties,
            DeploymentEnv env) {
        CredentialCache<PermissionChecker.CapabilityKey, PermissionDecision> cache =
                new CredentialCache<>(properties.getAuth().getCacheTtl());
        return new PermissionChecker(client, cache, env.isRelaxedAuthorization());
    }

    @Bean
    public DeviceIdentityResolver deviceIdentityResolver(PanelGateProperties properties) {
        return new DeviceIdentityResolver(properties.getDevice().getDomainSuffix());
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public S3Client s3Client(PanelGateProperties properties) {
        return S3Client.builder().region(Region.of(properties.getSecret().getRegion())).build();
    }

    @Bean
    public ObjectStorage objectStorage(@Lazy S3Client s3Client) {
        return new S3ObjectStorage(s3Client);
    }

    @Bean
    public DeviceCertStore deviceCertStore(ObjectStorage objectStorage, PanelGateProperties properties) {
        return new DeviceCertStore(objectStorage, properties.getDevice().getCertBucket(),
                properties.getDevice().getCertPrefix());
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public SecretsManagerClient secretsManagerClient(PanelGateProperties properties) {
        return SecretsManagerClient.builder().region(Region.of(properties.getSecret().getRegion())).build();
    }

    @Bean
    public SecretStore secretStore(@Lazy SecretsManagerClient secretsManagerClient) {
        return new SecretsManagerSecretStore(secretsManagerClient);
    }

    @Bean
    public ServiceSecretProvider serviceSecretProvider(SecretStore secretStore, PanelGateProperties properties,
            ObjectMapper objectMapper) {
        return new ServiceSecretProvider(secretStore, properties.getSecret().getSecretId(), objectMapper);
    }

    @Bean
    public DeviceDialer deviceDialer(PanelGateProperties properties) {
        return new OkHttpDeviceDialer(properties.getDevice().getConnectTimeout());
    }

    @Bean
    public ConnectionCounter connectionCounter() {
        return new ConnectionCounter();
    }

    @Bean
    public ResourceProbe resourceProbe() {
        return new ProcResourceProbe();
    }

    @Bean
    public HealthMonitor healthMonitor(ResourceProbe resourceProbe, ConnectionCounter connectionCounter) {
        return new HealthMonitor(resourceProbe, connectionCounter);
    }

    @Bean
    public ConnectionGateway connectionGateway(TokenValidator tokenValidator, PermissionChecker permissionChecker,
            DeviceIdentityResolver deviceIdentityResolver, DeviceCertStore deviceCertStore,
            ServiceSecretProvider serviceSecretProvider, DeviceDialer deviceDialer,
            ConnectionCounter connectionCounter, DeploymentEnv env, PanelGateProperties properties,
            @Qualifier("relayExecutor") ExecutorService relayExecutor, ObjectMapper objectMapper) {
        ConnectionGateway.Settings settings = new ConnectionGateway.Settings(
                properties.getDevice().getPort(),
                properties.getDevice().getPath(),
                properties.getRelay().getHandshakeGateTimeout());
        return new ConnectionGateway(tokenValidator, permissionChecker, deviceIdentityResolver, deviceCertStore,
                serviceSecretProvider, deviceDialer, connectionCounter, env, settings, relayExecutor, objectMapper);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
