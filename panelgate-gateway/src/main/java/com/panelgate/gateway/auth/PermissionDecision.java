package com.panelgate.gateway.auth;

/**
 * Outcome of a per-command capability check.
 *
 * @param granted        whether the command may be forwarded
 * @param userIdentifier identity that was checked, when known
 */
public record PermissionDecision(boolean granted, String userIdentifier) {

    private static final PermissionDecision DENIED = new PermissionDecision(false, null);
    private static final PermissionDecision BYPASSED = new PermissionDecision(true, null);

    public static PermissionDecision denied() {
        return DENIED;
    }

    public static PermissionDecision bypassed() {
        return BYPASSED;
    }

    public static PermissionDecision of(GrantRecord record) {
        return new PermissionDecision(record.granted(), record.userIdentifier());
    }
}
