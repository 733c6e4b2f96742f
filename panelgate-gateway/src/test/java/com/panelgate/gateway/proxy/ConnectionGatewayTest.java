package com.panelgate.gateway.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelgate.common.cache.CredentialCache;
import com.panelgate.common.config.DeploymentEnv;
import com.panelgate.gateway.auth.AuthException;
import com.panelgate.gateway.auth.AuthorizationClient;
import com.panelgate.gateway.auth.GrantRecord;
import com.panelgate.gateway.auth.PermissionChecker;
import com.panelgate.gateway.auth.PermissionDecision;
import com.panelgate.gateway.auth.TokenValidator;
import com.panelgate.gateway.device.DeviceCertStore;
import com.panelgate.gateway.device.DeviceIdentityResolver;
import com.panelgate.gateway.device.ObjectStorage;
import com.panelgate.gateway.proxy.RelayFakes.Close;
import com.panelgate.gateway.proxy.RelayFakes.FakeClient;
import com.panelgate.gateway.proxy.RelayFakes.FakeDialer;
import com.panelgate.gateway.proxy.RelayFakes.FakeLink;
import com.panelgate.gateway.runtime.ConnectionCounter;
import com.panelgate.gateway.secret.ServiceSecretProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionGatewayTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String CERT_KEY = "wss_certs/NS1234/ns1234.keymekiosk.com.crt";
    private static final String HELLO = "{\"event\":\"hello\",\"data\":{\"connected\":true,\"kiosk_name\":\"ns1234\"}}";

    private ExecutorService relayExecutor;
    private FakeDialer dialer;
    private ConnectionCounter counter;
    private final Map<String, String> storedObjects = new ConcurrentHashMap<>();
    private volatile String secret = "wss-key";
    private volatile PermissionDecision permission = PermissionDecision.denied();
    private volatile String grantedUser = "user@example.com";

    @BeforeEach
    void setUp() {
        relayExecutor = Executors.newCachedThreadPool();
        dialer = new FakeDialer();
        counter = new ConnectionCounter();
    }

    @AfterEach
    void tearDown() {
        relayExecutor.shutdownNow();
    }

    private static String pem() throws IOException {
        try (InputStream in = ConnectionGatewayTest.class.getResourceAsStream("/certs/ns1234.keymekiosk.com.crt")) {
            assertNotNull(in);
            return new String(in.readAllBytes(), StandardCharsets.US_ASCII);
        }
    }

    private ConnectionGateway gateway(DeploymentEnv env, Duration gateTimeout) {
        return gateway(env, gateTimeout, stubValidator());
    }

    private TokenValidator stubValidator() {
        return new TokenValidator(null, new CredentialCache<>(), "admin_access",
                false, Runnable::run) {
            @Override
            public GrantRecord validate(String credential) {
                if (credential == null || credential.isBlank()) {
                    throw new AuthException(AuthException.Reason.MISSING_CREDENTIAL);
                }
                if (credential.startsWith("bad")) {
                    throw new AuthException(AuthException.Reason.INVALID_OR_EXPIRED);
                }
                return new GrantRecord(true, grantedUser, null);
            }
        };
    }

    private ConnectionGateway gateway(DeploymentEnv env, Duration gateTimeout, TokenValidator validator) {
        PermissionChecker checker = new PermissionChecker(null, new CredentialCache<>(), false) {
            @Override
            public PermissionDecision check(String credential, String capability) {
                return permission;
            }
        };
        ObjectStorage storage = (bucket, key) -> {
            String value = storedObjects.get(key);
            if (value == null) {
                throw new IOException("NoSuchKey");
            }
            return value;
        };
        ServiceSecretProvider secrets = new ServiceSecretProvider(id -> {
            if (secret == null) {
                throw new IOException("AccessDenied");
            }
            return secret;
        }, "/prod/key-scanner/env", MAPPER);

        return new ConnectionGateway(validator, checker, new DeviceIdentityResolver("keymekiosk.com"),
                new DeviceCertStore(storage, "keyme-calibration", "wss_certs"), secrets, dialer, counter, env,
                new ConnectionGateway.Settings(2026, "/ws", gateTimeout), relayExecutor, MAPPER);
    }

    private ConnectionGateway prod() {
        return gateway(DeploymentEnv.PROD, Duration.ofSeconds(8));
    }

    private static void await(CompletableFuture<Void> done) throws Exception {
        done.get(RelayFakes.WAIT_MS, TimeUnit.MILLISECONDS);
    }

    @Nested
    class Setup {

        @ParameterizedTest
        @ValueSource(strings = {"", "bad-token"})
        void rejectedCredentialClosesWith4401WithoutDial(String token) throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();

            await(gw.start(gw.open(client, token, "ns1234")));

            Close close = client.awaitClose();
            assertEquals(CloseCodes.UNAUTHORIZED, close.code());
            assertFalse(close.reason().isEmpty());
            assertTrue(dialer.dials.isEmpty());
            assertEquals(0, counter.snapshot().totalAccepted());
        }

        @ParameterizedTest
        @ValueSource(strings = {"t\u00e9st-secret", "a\nb"})
        void credentialUnfitForHeaderClosesWith4401(String token) throws Exception {
            // nothing listens on the discard port; a malformed credential must fail before any request
            AuthorizationClient authClient = new AuthorizationClient("http://127.0.0.1:9",
                    Duration.ofMillis(200), MAPPER);
            TokenValidator validator = new TokenValidator(authClient, new CredentialCache<>(), "admin_access",
                    false, Runnable::run);
            FakeClient client = new FakeClient();
            ConnectionGateway gw = gateway(DeploymentEnv.PROD, Duration.ofSeconds(8), validator);

            await(gw.start(gw.open(client, token, "ns1234")));

            assertEquals(new Close(CloseCodes.UNAUTHORIZED, "Invalid or expired token"), client.awaitClose());
            assertTrue(dialer.dials.isEmpty());
            assertEquals(0, counter.snapshot().totalAccepted());
        }

        @Test
        void invalidDeviceClosesWith4400WithoutDial() throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();

            await(gw.start(gw.open(client, "tok", "https://")));

            assertEquals(new Close(CloseCodes.INVALID_DEVICE, "Invalid device"), client.awaitClose());
            assertTrue(dialer.dials.isEmpty());
            assertEquals(0, counter.current());
        }

        @Test
        void missingSecretClosesWith4500WithoutDial() throws Exception {
            secret = null;
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();

            await(gw.start(gw.open(client, "tok", "ns1234")));

            assertEquals(new Close(CloseCodes.SERVER_CONFIG, "server config: WSS API key unavailable"),
                    client.awaitClose());
            assertTrue(dialer.dials.isEmpty());
            assertEquals(0, counter.current());
            assertEquals(1, counter.snapshot().totalAccepted());
        }

        @Test
        void dialUsesDeviceUrlAndBearerSecret() throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();
            CompletableFuture<Void> done = gw.start(gw.open(client, "tok", "NS1234"));

            FakeLink link = dialer.awaitLink();
            assertNotNull(link);
            RelayFakes.Dial dial = dialer.dials.get(0);
            assertEquals("wss://ns1234.keymekiosk.com:2026/ws", dial.uri().toString());
            assertEquals("Bearer wss-key", dial.headers().get("Authorization"));
            assertFalse(dial.tls().isPinned());
            assertEquals(1, counter.current());

            link.listener.onClosed(1000, "");
            await(done);
            assertEquals(0, counter.current());
        }
    }

    @Nested
    class Relay {

        @Test
        void framesFlowBothWaysUnchanged() throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();
            ProxySession session = gw.open(client, "tok", "ns1234");
            CompletableFuture<Void> done = gw.start(session);
            FakeLink link = dialer.awaitLink();

            link.deviceSends(HELLO);
            assertEquals(HELLO, client.next().text());

            String ungated = "{\"id\":7,  \"event\":\"get_panel_info\"}";
            session.onClientFrame(RelayFrame.text(ungated));
            assertEquals(ungated, link.nextSent().text());

            session.onClientFrame(RelayFrame.text("not json at all"));
            assertEquals("not json at all", link.nextSent().text());

            byte[] bytes = {1, 2, 3};
            session.onClientFrame(RelayFrame.binary(bytes));
            assertArrayEquals(bytes, link.nextSent().binary());

            client.open = false;
            session.onClientClosed();
            await(done);
            assertTrue(link.closed);
            assertEquals(0, counter.current());
        }

        @Test
        void framesSentBeforeDialAreDeliveredInOrder() throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();
            ProxySession session = gw.open(client, "tok", "ns1234");
            session.onClientFrame(RelayFrame.text("{\"event\":\"a\"}"));
            session.onClientFrame(RelayFrame.text("{\"event\":\"b\"}"));
            CompletableFuture<Void> done = gw.start(session);
            FakeLink link = dialer.awaitLink();

            assertEquals("{\"event\":\"a\"}", link.nextSent().text());
            assertEquals("{\"event\":\"b\"}", link.nextSent().text());

            link.listener.onClosed(1000, "");
            await(done);
        }

        @Test
        void deniedCommandIsAnsweredAndNotForwarded() throws Exception {
            permission = new PermissionDecision(false, "user@example.com");
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();
            ProxySession session = gw.open(client, "tok", "ns1234");
            CompletableFuture<Void> done = gw.start(session);
            FakeLink link = dialer.awaitLink();

            session.onClientFrame(RelayFrame.text("{\"id\":\"req-1\",\"event\":\"fleet_reboot_kiosk\",\"data\":{}}"));

            JsonNode reply = MAPPER.readTree(client.next().text());
            assertEquals("req-1", reply.get("id").asText());
            assertFalse(reply.get("success").asBoolean());
            assertEquals(1, reply.get("errors").size());
            String error = reply.get("errors").get(0).asText();
            assertTrue(error.contains("Permission denied"));
            assertTrue(error.contains("'reboot_kiosk'"));
            assertTrue(error.contains("user@example.com"));
            assertNull(link.sent.poll(200, TimeUnit.MILLISECONDS));

            link.listener.onClosed(1000, "");
            await(done);
        }

        @Test
        void denialFallsBackToConnectIdentity() throws Exception {
            permission = PermissionDecision.denied();
            grantedUser = "connect@example.com";
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();
            ProxySession session = gw.open(client, "tok", "ns1234");
            CompletableFuture<Void> done = gw.start(session);
            FakeLink link = dialer.awaitLink();

            session.onClientFrame(RelayFrame.text("{\"id\":5,\"event\":\"fleet_switch_process_list\"}"));

            JsonNode reply = MAPPER.readTree(client.next().text());
            assertEquals(5, reply.get("id").asInt());
            String error = reply.get("errors").get(0).asText();
            assertTrue(error.contains("switch_processes"));
            assertTrue(error.contains("connect@example.com"));

            link.listener.onClosed(1000, "");
            await(done);
        }

        @Test
        void grantedCommandIsForwardedVerbatim() throws Exception {
            permission = new PermissionDecision(true, "user@example.com");
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();
            ProxySession session = gw.open(client, "tok", "ns1234");
            CompletableFuture<Void> done = gw.start(session);
            FakeLink link = dialer.awaitLink();

            String request = "{\"id\": \"req-3\", \"event\": \"fleet_reboot_kiosk\"}";
            session.onClientFrame(RelayFrame.text(request));

            assertEquals(request, link.nextSent().text());
            assertTrue(client.received.isEmpty());

            link.listener.onClosed(1000, "");
            await(done);
        }

        @Test
        void deviceCloseEndsSessionNormally() throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();
            CompletableFuture<Void> done = gw.start(gw.open(client, "tok", "ns1234"));
            FakeLink link = dialer.awaitLink();

            link.listener.onClosed(1000, "bye");

            await(done);
            assertEquals(CloseCodes.NORMAL, client.awaitClose().code());
            assertTrue(link.closed);
            assertEquals(0, counter.current());
        }

        @Test
        void deviceFailureClosesWith1011() throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();
            CompletableFuture<Void> done = gw.start(gw.open(client, "tok", "ns1234"));
            FakeLink link = dialer.awaitLink();

            link.listener.onFailure(new EOFException("stream reset"));

            await(done);
            Close close = client.awaitClose();
            assertEquals(CloseCodes.BACKEND_ERROR, close.code());
            assertEquals("stream reset", close.reason());
            assertEquals(0, counter.current());
        }

        @Test
        void counterReflectsConcurrentSessions() throws Exception {
            ConnectionGateway gw = prod();
            FakeClient a = new FakeClient();
            FakeClient b = new FakeClient();
            CompletableFuture<Void> doneA = gw.start(gw.open(a, "tok", "ns1234"));
            FakeLink linkA = dialer.awaitLink();
            CompletableFuture<Void> doneB = gw.start(gw.open(b, "tok", "ns1234"));
            FakeLink linkB = dialer.awaitLink();

            assertEquals(2, counter.current());
            linkA.listener.onClosed(1000, "");
            await(doneA);
            assertEquals(1, counter.current());
            linkB.listener.onClosed(1000, "");
            await(doneB);
            assertEquals(0, counter.current());
        }
    }

    @Nested
    class DeployedGate {

        private String panelInfo(boolean deployed) {
            return "{\"id\":0,\"success\":true,\"data\":{\"activity\":\"inactive\",\"deployed\":" + deployed + "}}";
        }

        @Test
        void deployedKioskIsRefusedInStaging() throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = gateway(DeploymentEnv.STG, Duration.ofSeconds(8));
            CompletableFuture<Void> done = gw.start(gw.open(client, "tok", "ns1234"));
            FakeLink link = dialer.awaitLink();

            assertEquals(ConnectionGateway.PANEL_INFO_PROBE, link.nextSent().text());
            link.deviceSends(HELLO);
            link.deviceSends(panelInfo(true));

            await(done);
            Close close = client.awaitClose();
            assertEquals(CloseCodes.FORBIDDEN_ENVIRONMENT, close.code());
            assertEquals("Staging cannot connect to deployed kiosk", close.reason());
            assertTrue(client.received.isEmpty());
            assertTrue(link.closed);
            assertEquals(0, counter.current());
        }

        @Test
        void undeployedKioskGetsBufferedFramesFirst() throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = gateway(DeploymentEnv.STG, Duration.ofSeconds(8));
            CompletableFuture<Void> done = gw.start(gw.open(client, "tok", "ns1234"));
            FakeLink link = dialer.awaitLink();

            assertEquals(ConnectionGateway.PANEL_INFO_PROBE, link.nextSent().text());
            link.deviceSends(HELLO);
            link.deviceSends(panelInfo(false));
            link.deviceSends("{\"event\":\"status\"}");

            assertEquals(HELLO, client.next().text());
            assertEquals(panelInfo(false), client.next().text());
            assertEquals("{\"event\":\"status\"}", client.next().text());

            link.listener.onClosed(1000, "");
            await(done);
            assertEquals(CloseCodes.NORMAL, client.awaitClose().code());
        }

        @Test
        void silentKioskFailsOpenAfterTimeout() throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = gateway(DeploymentEnv.STG, Duration.ofMillis(200));
            ProxySession session = gw.open(client, "tok", "ns1234");
            CompletableFuture<Void> done = gw.start(session);
            FakeLink link = dialer.awaitLink();

            assertEquals(ConnectionGateway.PANEL_INFO_PROBE, link.nextSent().text());
            link.deviceSends(HELLO);

            assertEquals(HELLO, client.next().text());
            session.onClientFrame(RelayFrame.text("{\"event\":\"ping\"}"));
            assertEquals("{\"event\":\"ping\"}", link.nextSent().text());

            link.listener.onClosed(1000, "");
            await(done);
        }

        @Test
        void productionSkipsTheProbe() throws Exception {
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();
            CompletableFuture<Void> done = gw.start(gw.open(client, "tok", "ns1234"));
            FakeLink link = dialer.awaitLink();

            link.deviceSends(panelInfo(true));
            assertEquals(panelInfo(true), client.next().text());
            assertTrue(link.sent.isEmpty());

            link.listener.onClosed(1000, "");
            await(done);
        }
    }

    @Nested
    class DialRetry {

        @Test
        void failedDialRetriesOnceWithRefetchedCertificate() throws Exception {
            storedObjects.put(CERT_KEY, pem());
            dialer.failWith(BackendConnectException.FailureKind.SSL);
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();
            CompletableFuture<Void> done = gw.start(gw.open(client, "tok", "ns1234"));

            FakeLink link = dialer.awaitLink();
            assertNotNull(link);
            assertEquals(2, dialer.dials.size());
            assertTrue(dialer.dials.get(0).tls().isPinned());
            assertTrue(dialer.dials.get(1).tls().isPinned());
            assertNotSame(dialer.dials.get(0).tls(), dialer.dials.get(1).tls());

            link.listener.onClosed(1000, "");
            await(done);
            assertEquals(CloseCodes.NORMAL, client.awaitClose().code());
        }

        @Test
        void secondFailureIsClassified() throws Exception {
            storedObjects.put(CERT_KEY, pem());
            dialer.failWith(BackendConnectException.FailureKind.SSL)
                    .failWith(BackendConnectException.FailureKind.REFUSED);
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();

            await(gw.start(gw.open(client, "tok", "ns1234")));

            assertEquals(new Close(CloseCodes.BACKEND_ERROR, "refused"), client.awaitClose());
            assertEquals(2, dialer.dials.size());
            assertEquals(0, counter.current());
        }

        @Test
        void noRetryWhenCertificateCannotBeRefetched() throws Exception {
            dialer.failWith(BackendConnectException.FailureKind.PORT);
            FakeClient client = new FakeClient();
            ConnectionGateway gw = prod();

            await(gw.start(gw.open(client, "tok", "ns1234")));

            assertEquals(new Close(CloseCodes.BACKEND_ERROR, "port"), client.awaitClose());
            assertEquals(1, dialer.dials.size());
            assertEquals(0, counter.current());
        }
    }

    @Test
    void denialBodyKeepsNonStringIds() throws Exception {
        ConnectionGateway gw = prod();
        RelayMessage.GatedRequest request = (RelayMessage.GatedRequest) RelayMessage.classify(
                RelayFrame.text("{\"id\":12,\"event\":\"fleet_reset_device\"}"), MAPPER);

        JsonNode body = MAPPER.readTree(gw.denial(request, null));

        assertEquals(12, body.get("id").asInt());
        assertEquals("Permission denied: 'reset_all_cameras_device' required", body.get("errors").get(0).asText());
    }
}
