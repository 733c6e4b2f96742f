package com.panelgate.gateway.runtime;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Snapshot of resource limits and usage served by the health endpoint.
 */
public record HealthReport(String status, Limits limits, Usage usage, List<Warning> warnings) {

    public static final String OK = "ok";
    public static final String WARNING = "warning";

    public record Limits(
            @JsonProperty("ulimit_n") Long ulimitN,
            @JsonProperty("fs_file_max") Long fsFileMax,
            @JsonProperty("nf_conntrack_max") Long nfConntrackMax,
            @JsonProperty("memory_limit_bytes") Long memoryLimitBytes) {
    }

    public record Usage(
            @JsonProperty("current_open_fds") Long currentOpenFds,
            @JsonProperty("memory_usage_bytes") Long memoryUsageBytes,
            @JsonProperty("active_websocket_connections") long activeWebsocketConnections) {
    }

    public record Warning(String message, String recommendation) {
    }
}
