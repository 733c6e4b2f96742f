package com.panelgate.gateway.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class HealthMonitorTest {

    /** Probe with fixed answers; null means unreadable. */
    static final class FixedProbe implements ResourceProbe {
        Long ulimit = 1_048_576L;
        Long fileMax = 9_223_372L;
        Long conntrack = 262_144L;
        Long memLimit = 1_000L;
        Long memUsage = 100L;
        Long fds = 50L;

        private static OptionalLong of(Long v) {
            return v == null ? OptionalLong.empty() : OptionalLong.of(v);
        }

        @Override
        public OptionalLong openFileLimit() {
            return of(ulimit);
        }

        @Override
        public OptionalLong systemFileMax() {
            return of(fileMax);
        }

        @Override
        public OptionalLong conntrackMax() {
            return of(conntrack);
        }

        @Override
        public OptionalLong memoryLimitBytes() {
            return of(memLimit);
        }

        @Override
        public OptionalLong memoryUsageBytes() {
            return of(memUsage);
        }

        @Override
        public OptionalLong openFileDescriptors() {
            return of(fds);
        }
    }

    private final FixedProbe probe = new FixedProbe();
    private final ConnectionCounter counter = new ConnectionCounter();
    private final HealthMonitor monitor = new HealthMonitor(probe, counter);

    @Nested
    class Status {

        @Test
        void healthyHostIsOk() {
            HealthReport report = monitor.report();
            assertEquals("ok", report.status());
            assertTrue(report.warnings().isEmpty());
            assertEquals(1_048_576L, report.limits().ulimitN());
        }

        @Test
        void lowUlimitWarns() {
            probe.ulimit = 1024L;
            HealthReport report = monitor.report();
            assertEquals("warning", report.status());
            assertTrue(report.warnings().get(0).message().contains("1024"));
            assertFalse(report.warnings().get(0).recommendation().isBlank());
        }

        @Test
        void lowSystemLimitsWarn() {
            probe.fileMax = 50_000L;
            probe.conntrack = 1_000L;
            assertEquals(2, monitor.report().warnings().size());
        }

        @Test
        void memoryPressureWarns() {
            probe.memUsage = 950L;
            HealthReport report = monitor.report();
            assertEquals(1, report.warnings().size());
            assertTrue(report.warnings().get(0).message().startsWith("Memory usage"));
        }

        @Test
        void descriptorsAndSessionsNearLimitWarn() {
            probe.ulimit = 100_000L;
            probe.fds = 90_000L;
            for (int i = 0; i < 80_001; i++) {
                counter.increment();
            }
            assertEquals(2, monitor.report().warnings().size());
        }

        @Test
        void unreadableValuesAreNullAndSilent() {
            probe.ulimit = null;
            probe.fileMax = null;
            probe.conntrack = null;
            probe.memLimit = null;
            probe.memUsage = null;
            probe.fds = null;

            HealthReport report = monitor.report();

            assertEquals("ok", report.status());
            assertNull(report.limits().ulimitN());
            assertNull(report.usage().currentOpenFds());
        }
    }

    @Test
    void reportSerializesWithSnakeCaseKeys() throws Exception {
        counter.increment();
        probe.memLimit = null;
        JsonNode json = new ObjectMapper().valueToTree(monitor.report());

        assertEquals("ok", json.get("status").asText());
        assertEquals(1_048_576L, json.get("limits").get("ulimit_n").asLong());
        assertTrue(json.get("limits").has("fs_file_max"));
        assertTrue(json.get("limits").has("nf_conntrack_max"));
        assertTrue(json.get("limits").get("memory_limit_bytes").isNull());
        assertEquals(50, json.get("usage").get("current_open_fds").asLong());
        assertEquals(100, json.get("usage").get("memory_usage_bytes").asLong());
        assertEquals(1, json.get("usage").get("active_websocket_connections").asLong());
        assertTrue(json.get("warnings").isArray());
    }
}
