package com.panelgate.gateway.runtime;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

/**
 * {@link ResourceProbe} that reads Linux {@code /proc} and cgroup files
 * (cgroup v2 first, v1 as fallback).
 */
@Slf4j
public class ProcResourceProbe implements ResourceProbe {

    // cgroup v1 reports "unlimited" as a huge page-aligned number
    private static final long CGROUP_V1_UNLIMITED = 1L << 60;

    private final Path root;

    public ProcResourceProbe() {
        this(Path.of("/"));
    }

    /**
     * @param root filesystem root the probe reads below, for tests
     */
    public ProcResourceProbe(Path root) {
        this.root = root;
    }

    @Override
    public OptionalLong openFileLimit() {
        List<String> lines = readLines("proc/self/limits");
        for (String line : lines) {
            if (line.startsWith("Max open files")) {
                String[] parts = line.substring("Max open files".length()).trim().split("\\s+");
                return parts.length > 0 ? parseLong(parts[0]) : OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    @Override
    public OptionalLong systemFileMax() {
        return readLong("proc/sys/fs/file-max");
    }

    @Override
    public OptionalLong conntrackMax() {
        return readLong("proc/sys/net/netfilter/nf_conntrack_max");
    }

    @Override
    public OptionalLong memoryLimitBytes() {
        OptionalLong v2 = readLong("sys/fs/cgroup/memory.max");
        if (v2.isPresent()) {
            return v2;
        }
        OptionalLong v1 = readLong("sys/fs/cgroup/memory/memory.limit_in_bytes");
        if (v1.isPresent() && v1.getAsLong() >= CGROUP_V1_UNLIMITED) {
            return OptionalLong.empty();
        }
        return v1;
    }

    @Override
    public OptionalLong memoryUsageBytes() {
        OptionalLong v2 = readLong("sys/fs/cgroup/memory.current");
        return v2.isPresent() ? v2 : readLong("sys/fs/cgroup/memory/memory.usage_in_bytes");
    }

    @Override
    public OptionalLong openFileDescriptors() {
        Path fdDir = root.resolve("proc/self/fd");
        if (!Files.isDirectory(fdDir)) {
            return OptionalLong.empty();
        }
        long count = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(fdDir)) {
            for (Path ignored : entries) {
                count++;
            }
        } catch (IOException e) {
            log.debug("cannot list {}: {}", fdDir, e.getMessage());
            return OptionalLong.empty();
        }
        return OptionalLong.of(count);
    }

    private OptionalLong readLong(String relative) {
        List<String> lines = readLines(relative);
        return lines.isEmpty() ? OptionalLong.empty() : parseLong(lines.get(0).trim());
    }

    private List<String> readLines(String relative) {
        Path file = root.resolve(relative);
        if (!Files.isReadable(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("cannot read {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    // "max" and "unlimited" mean no limit
    private static OptionalLong parseLong(String raw) {
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
