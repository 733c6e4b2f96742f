package com.panelgate.gateway.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelgate.common.config.DeploymentEnv;
import com.panelgate.common.logging.LogRedact;
import com.panelgate.gateway.auth.AuthException;
import com.panelgate.gateway.auth.GrantRecord;
import com.panelgate.gateway.auth.PermissionChecker;
import com.panelgate.gateway.auth.PermissionDecision;
import com.panelgate.gateway.auth.TokenValidator;
import com.panelgate.gateway.device.DeviceCertStore;
import com.panelgate.gateway.device.DeviceIdentity;
import com.panelgate.gateway.device.DeviceIdentityResolver;
import com.panelgate.gateway.device.DeviceTlsContext;
import com.panelgate.gateway.device.InvalidDeviceException;
import com.panelgate.gateway.device.TlsResolution;
import com.panelgate.gateway.runtime.ConnectionCounter;
import com.panelgate.gateway.secret.ServiceSecretProvider;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Drives relay sessions from the accepted browser socket to teardown.
 * <p>
 * Per session: authenticate, resolve the kiosk and its TLS trust, count the session,
 * dial the kiosk (retrying once with a refreshed certificate), run the deployed-kiosk
 * gate in restrictive environments, then relay both directions until one ends.
 */
@Slf4j
public class ConnectionGateway {

    static final String PANEL_INFO_PROBE = "{\"id\":0,\"event\":\"get_panel_info\"}";
    static final String DEPLOYED_REASON = "Staging cannot connect to deployed kiosk";

    private final TokenValidator tokenValidator;
    private final PermissionChecker permissionChecker;
    private final DeviceIdentityResolver deviceResolver;
    private final DeviceCertStore certStore;
    private final ServiceSecretProvider secretProvider;
    private final DeviceDialer dialer;
    private final ConnectionCounter counter;
    private final DeploymentEnv env;
    private final Settings settings;
    private final Executor relayExecutor;
    private final ObjectMapper objectMapper;

    /**
     * Device endpoint and timing settings.
     */
    public record Settings(int devicePort, String devicePath, Duration gateTimeout) {
        public static Settings defaults() {
            return new Settings(2026, "/ws", Duration.ofSeconds(8));
        }
    }

    public ConnectionGateway(TokenValidator tokenValidator, PermissionChecker permissionChecker,
            DeviceIdentityResolver deviceResolver, DeviceCertStore certStore,
            ServiceSecretProvider secretProvider, DeviceDialer dialer, ConnectionCounter counter,
            DeploymentEnv env, Settings settings, Executor relayExecutor, ObjectMapper objectMapper) {
        this.tokenValidator = tokenValidator;
        this.permissionChecker = permissionChecker;
        this.deviceResolver = deviceResolver;
        this.certStore = certStore;
        this.secretProvider = secretProvider;
        this.dialer = dialer;
        this.counter = counter;
        this.env = env;
        this.settings = settings;
        this.relayExecutor = relayExecutor;
        this.objectMapper = objectMapper;
    }

    /**
     * Register a freshly accepted browser socket. Frames may be fed to the returned session
     * right away; they are held until the relay starts.
     */
    public ProxySession open(ClientEndpoint client, String credential, String rawDevice) {
        return new ProxySession(client, credential, rawDevice);
    }

    /**
     * Run the session asynchronously. The future completes after teardown.
     */
    public CompletableFuture<Void> start(ProxySession session) {
        log.debug("session={} opening device={} cred={}", session.getId(), session.getRawDevice(),
                LogRedact.fingerprint(session.getCredential()));
        return tokenValidator.validateAsync(session.getCredential())
                .thenAcceptAsync(grant -> run(session, grant), relayExecutor)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof AuthException auth) {
                        log.info("session={} rejected: {}", session.getId(), auth.getMessage());
                        rejectUnaccepted(session, CloseCodes.UNAUTHORIZED, auth.getMessage());
                    } else {
                        log.error("session={} setup failed", session.getId(), cause);
                        teardown(session, CloseCodes.BACKEND_ERROR, "internal error");
                    }
                    return null;
                });
    }

    void run(ProxySession session, GrantRecord grant) {
        session.setUserIdentifier(grant.userIdentifier());

        DeviceIdentity identity;
        try {
            identity = deviceResolver.resolve(session.getRawDevice());
        } catch (InvalidDeviceException e) {
            rejectUnaccepted(session, CloseCodes.INVALID_DEVICE, "Invalid device");
            return;
        }
        session.setDevice(identity);
        TlsResolution tls = certStore.resolveTlsContext(identity);

        counter.increment();
        session.markCounted();

        int code = CloseCodes.NORMAL;
        String reason = "";
        try {
            String secret = secretProvider.get()
                    .orElseThrow(() -> new ServerConfigException("WSS API key unavailable"));
            session.setLink(dialWithRetry(session, identity, tls, secret));
            log.info("session={} device={} connected pinned={}", session.getId(), identity,
                    tls.usedCachedCert());

            if (env.isRestrictive()) {
                handshakeGate(session);
            }

            FirstToFinish.Outcome outcome = FirstToFinish.run(relayExecutor,
                    () -> deviceToClient(session),
                    () -> clientToDevice(session));
            if (outcome.failed()) {
                log.debug("session={} relay ended with {}", session.getId(),
                        LogRedact.redactSensitiveText(outcome.error().toString()));
            }
            if (session.getDeviceFailure() != null) {
                code = CloseCodes.BACKEND_ERROR;
                reason = BackendConnectException.classify(session.getDeviceFailure()).closeReason();
            }
        } catch (ServerConfigException e) {
            log.error("session={} {}", session.getId(), e.getMessage());
            code = CloseCodes.SERVER_CONFIG;
            reason = "server config: " + e.getMessage();
        } catch (ForbiddenEnvironmentException e) {
            log.warn("session={} device={} refused: {}", session.getId(), identity, e.getMessage());
            code = CloseCodes.FORBIDDEN_ENVIRONMENT;
            reason = e.getMessage();
        } catch (BackendConnectException e) {
            log.warn("session={} device={} connect failed ({}): {}", session.getId(), identity,
                    e.getKind(), LogRedact.redactSensitiveText(e.getMessage()));
            code = CloseCodes.BACKEND_ERROR;
            reason = e.closeReason();
        } catch (IOException e) {
            log.warn("session={} device={} link error: {}", session.getId(), identity,
                    LogRedact.redactSensitiveText(e.getMessage()));
            code = CloseCodes.BACKEND_ERROR;
            reason = e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            code = CloseCodes.BACKEND_ERROR;
            reason = "shutting down";
        } catch (RuntimeException e) {
            log.error("session={} device={} relay failed", session.getId(), identity, e);
            code = CloseCodes.BACKEND_ERROR;
            reason = "internal error";
        } finally {
            teardown(session, code, reason);
        }
    }

    private DeviceLink dialWithRetry(ProxySession session, DeviceIdentity identity, TlsResolution tls,
            String secret) throws BackendConnectException, InterruptedException {
        URI uri = URI.create("wss://" + identity.fullyQualifiedName() + ":" + settings.devicePort()
                + settings.devicePath());
        Map<String, String> headers = Map.of("Authorization", "Bearer " + secret);
        try {
            return dialer.dial(uri, tls.context(), headers, session.deviceListener());
        } catch (BackendConnectException first) {
            log.info("session={} device={} dial failed ({}), refreshing certificate",
                    session.getId(), identity, first.getKind());
            certStore.invalidate(identity);
            Optional<DeviceTlsContext> refreshed = certStore.refetch(identity);
            if (refreshed.isEmpty()) {
                throw first;
            }
            return dialer.dial(uri, refreshed.get(), headers, session.deviceListener());
        }
    }

    /**
     * Probe the kiosk for its deployment state. Everything the device sends meanwhile,
     * including the reply, is buffered for the browser.
     *
     * @throws ForbiddenEnvironmentException when the kiosk reports {@code deployed: true}
     */
    void handshakeGate(ProxySession session) throws IOException, InterruptedException {
        session.getLink().send(RelayFrame.text(PANEL_INFO_PROBE));
        try {
            RelayMessage reply = awaitPanelInfo(session);
            if (reply == null) {
                return;
            }
            JsonNode deployed = reply.json().path("data").path("deployed");
            if (deployed.isBoolean() && deployed.booleanValue()) {
                throw new ForbiddenEnvironmentException(DEPLOYED_REASON);
            }
        } catch (HandshakeTimeoutException e) {
            log.info("session={} device={} {}, continuing", session.getId(), session.getDevice(), e.getMessage());
        }
    }

    /**
     * @return the reply, or null when the device closed before answering
     */
    private RelayMessage awaitPanelInfo(ProxySession session) throws InterruptedException, HandshakeTimeoutException {
        long deadline = System.nanoTime() + settings.gateTimeout().toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            RelayFrame frame = remaining > 0
                    ? session.getDeviceInbox().pollFirst(remaining, TimeUnit.NANOSECONDS)
                    : null;
            if (frame == null) {
                throw new HandshakeTimeoutException(settings.gateTimeout());
            }
            if (frame.isEnd()) {
                session.getDeviceInbox().addFirst(frame);
                return null;
            }
            session.getPreGateBuffer().add(frame);
            RelayMessage message = RelayMessage.classify(frame, objectMapper);
            if (message.hasId(0)) {
                return message;
            }
        }
    }

    private Void deviceToClient(ProxySession session) throws IOException, InterruptedException {
        ClientEndpoint client = session.getClient();
        for (RelayFrame buffered : session.getPreGateBuffer()) {
            client.send(buffered);
        }
        session.getPreGateBuffer().clear();
        while (true) {
            RelayFrame frame = session.getDeviceInbox().take();
            if (frame.isEnd()) {
                return null;
            }
            client.send(frame);
        }
    }

    private Void clientToDevice(ProxySession session) throws IOException, InterruptedException {
        while (true) {
            RelayFrame frame = session.getClientInbox().take();
            if (frame.isEnd()) {
                return null;
            }
            RelayMessage message = RelayMessage.classify(frame, objectMapper);
            if (message instanceof RelayMessage.GatedRequest gated) {
                PermissionDecision decision = permissionChecker.check(session.getCredential(), gated.capability());
                if (!decision.granted()) {
                    String user = decision.userIdentifier() != null
                            ? decision.userIdentifier()
                            : session.getUserIdentifier();
                    log.info("session={} device={} denied {} ({})", session.getId(), session.getDevice(),
                            gated.event(), gated.capability());
                    session.getClient().send(RelayFrame.text(denial(gated, user)));
                    continue;
                }
            }
            session.getLink().send(frame);
        }
    }

    String denial(RelayMessage.GatedRequest request, String user) {
        String message = "Permission denied: '" + request.capability() + "' required";
        if (user != null && !user.isBlank()) {
            message += " for " + user;
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.set("id", request.id());
        body.put("success", false);
        body.putArray("errors").add(message);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new IllegalStateException("cannot serialize denial", e);
        }
    }

    private void rejectUnaccepted(ProxySession session, int code, String reason) {
        if (session.beginTeardown()) {
            session.getClient().close(code, CloseReason.truncate(reason));
        }
    }

    void teardown(ProxySession session, int code, String reason) {
        if (!session.beginTeardown()) {
            return;
        }
        ClientEndpoint client = session.getClient();
        if (client.isOpen()) {
            client.close(code, CloseReason.truncate(reason));
        }
        DeviceLink link = session.getLink();
        if (link != null) {
            link.close();
        }
        if (session.isCounted()) {
            counter.decrement();
        }
        log.info("session={} device={} closed code={}", session.getId(), session.getDevice(), code);
    }
}
