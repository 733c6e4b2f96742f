package com.panelgate.gateway.device;

import java.util.Locale;

/**
 * Turns the raw {@code device} query parameter into a {@link DeviceIdentity}.
 * <p>
 * Accepts bare kiosk names ({@code ns1234}), host names and URLs
 * ({@code https://NS1234.keymekiosk.com:2026/ws}). Bare names get the kiosk domain appended.
 */
public class DeviceIdentityResolver {

    private final String domainSuffix;

    public DeviceIdentityResolver(String domainSuffix) {
        String suffix = domainSuffix == null ? "" : domainSuffix.trim().toLowerCase(Locale.ROOT);
        this.domainSuffix = suffix.startsWith(".") ? suffix.substring(1) : suffix;
    }

    /**
     * @throws InvalidDeviceException when nothing usable is left after normalization
     */
    public DeviceIdentity resolve(String rawHost) {
        String host = normalizeHost(rawHost);
        if (host.isEmpty()) {
            throw new InvalidDeviceException("Invalid device");
        }
        String fqdn = host.contains(".") || domainSuffix.isEmpty() ? host : host + "." + domainSuffix;
        int dot = fqdn.indexOf('.');
        String shortName = dot < 0 ? fqdn : fqdn.substring(0, dot);
        if (shortName.isEmpty()) {
            throw new InvalidDeviceException("Invalid device");
        }
        return new DeviceIdentity(shortName, fqdn, shortName.toUpperCase(Locale.ROOT));
    }

    static String normalizeHost(String raw) {
        if (raw == null) {
            return "";
        }
        String s = raw.trim();
        int scheme = s.indexOf("://");
        if (scheme >= 0) {
            s = s.substring(scheme + 3);
        }
        // host ends at the first path, query, fragment or port separator
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '/' || c == '?' || c == '#' || c == ':') {
                s = s.substring(0, i);
                break;
            }
        }
        s = s.toLowerCase(Locale.ROOT);
        while (s.endsWith(".")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
