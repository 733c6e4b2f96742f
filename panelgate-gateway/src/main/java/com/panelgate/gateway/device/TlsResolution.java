package com.panelgate.gateway.device;

/**
 * Result of resolving the TLS context for a device.
 *
 * @param context        context to dial with
 * @param usedCachedCert true when the context is pinned to the device certificate
 */
public record TlsResolution(DeviceTlsContext context, boolean usedCachedCert) {
}
