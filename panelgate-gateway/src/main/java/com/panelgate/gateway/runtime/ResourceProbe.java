package com.panelgate.gateway.runtime;

import java.util.OptionalLong;

/**
 * Reads host and process resource limits. Every method returns empty when the value
 * cannot be read on this host.
 */
public interface ResourceProbe {

    /** Soft limit on open file descriptors of this process. */
    OptionalLong openFileLimit();

    /** System-wide maximum number of open files. */
    OptionalLong systemFileMax();

    /** Connection-tracking table size. */
    OptionalLong conntrackMax();

    /** Container memory limit in bytes. Empty when unlimited. */
    OptionalLong memoryLimitBytes();

    /** Container memory usage in bytes. */
    OptionalLong memoryUsageBytes();

    /** File descriptors currently open in this process. */
    OptionalLong openFileDescriptors();
}
