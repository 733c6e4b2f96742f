package com.panelgate.gateway.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Builds {@link HealthReport}s from a {@link ResourceProbe} and the live session count.
 * Read-only; every call samples afresh.
 */
public class HealthMonitor {

    static final long MIN_ULIMIT = 65_536;
    static final long MIN_FILE_MAX = 100_000;
    static final long MIN_CONNTRACK = 65_536;
    static final double MEMORY_WARN_RATIO = 0.90;
    static final double FD_WARN_RATIO = 0.80;

    private final ResourceProbe probe;
    private final ConnectionCounter counter;

    public HealthMonitor(ResourceProbe probe, ConnectionCounter counter) {
        this.probe = probe;
        this.counter = counter;
    }

    public HealthReport report() {
        Long ulimit = boxed(probe.openFileLimit());
        Long fileMax = boxed(probe.systemFileMax());
        Long conntrack = boxed(probe.conntrackMax());
        Long memLimit = boxed(probe.memoryLimitBytes());
        Long memUsage = boxed(probe.memoryUsageBytes());
        Long openFds = boxed(probe.openFileDescriptors());
        long sessions = counter.current();

        List<HealthReport.Warning> warnings = new ArrayList<>();
        if (ulimit != null && ulimit < MIN_ULIMIT) {
            warnings.add(new HealthReport.Warning(
                    "File descriptor limit is low: " + ulimit,
                    "Raise the open files limit (ulimit -n) to at least " + MIN_ULIMIT));
        }
        if (fileMax != null && fileMax < MIN_FILE_MAX) {
            warnings.add(new HealthReport.Warning(
                    "System file-max is low: " + fileMax,
                    "Set fs.file-max to at least " + MIN_FILE_MAX));
        }
        if (conntrack != null && conntrack < MIN_CONNTRACK) {
            warnings.add(new HealthReport.Warning(
                    "Connection tracking table is small: " + conntrack,
                    "Set net.netfilter.nf_conntrack_max to at least " + MIN_CONNTRACK));
        }
        if (memLimit != null && memUsage != null && memLimit > 0
                && memUsage > memLimit * MEMORY_WARN_RATIO) {
            warnings.add(new HealthReport.Warning(
                    String.format("Memory usage at %.1f%% of limit", 100.0 * memUsage / memLimit),
                    "Increase the container memory limit or reduce concurrent sessions"));
        }
        if (ulimit != null && openFds != null && openFds > ulimit * FD_WARN_RATIO) {
            warnings.add(new HealthReport.Warning(
                    "Open file descriptors near limit: " + openFds + "/" + ulimit,
                    "Raise the open files limit or reduce concurrent sessions"));
        }
        if (ulimit != null && sessions > ulimit * FD_WARN_RATIO) {
            warnings.add(new HealthReport.Warning(
                    "Active WebSocket sessions near descriptor limit: " + sessions + "/" + ulimit,
                    "Scale out the gateway or raise the open files limit"));
        }

        return new HealthReport(
                warnings.isEmpty() ? HealthReport.OK : HealthReport.WARNING,
                new HealthReport.Limits(ulimit, fileMax, conntrack, memLimit),
                new HealthReport.Usage(openFds, memUsage, sessions),
                List.copyOf(warnings));
    }

    private static Long boxed(OptionalLong value) {
        return value.isPresent() ? value.getAsLong() : null;
    }
}
