package com.panelgate.gateway.device;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide store of device certificates and the trust contexts built from them.
 * <p>
 * Entries never expire. They are dropped by {@link #invalidate(DeviceIdentity)} after a
 * failed dial and replaced by {@link #refetch(DeviceIdentity)}.
 */
@Slf4j
public class DeviceCertStore {

    private final ObjectStorage storage;
    private final String bucket;
    private final String keyPrefix;

    private final Map<String, String> pemByHost = new ConcurrentHashMap<>();
    private final Map<String, DeviceTlsContext> contextByHost = new ConcurrentHashMap<>();

    public DeviceCertStore(ObjectStorage storage, String bucket, String keyPrefix) {
        this.storage = storage;
        this.bucket = bucket;
        this.keyPrefix = keyPrefix;
    }

    /**
     * Return the cached pinned context, fetch and pin one, or fall back to a permissive
     * context when the certificate cannot be obtained.
     */
    public TlsResolution resolveTlsContext(DeviceIdentity identity) {
        DeviceTlsContext cached = contextByHost.get(identity.fullyQualifiedName());
        if (cached != null) {
            return new TlsResolution(cached, true);
        }
        Optional<DeviceTlsContext> fetched = fetchAndPin(identity);
        if (fetched.isPresent()) {
            return new TlsResolution(fetched.get(), true);
        }
        log.warn("no certificate for {}, connecting without certificate verification", identity);
        return new TlsResolution(DeviceTlsContext.permissive(), false);
    }

    /**
     * Drop the cached PEM and context for a device.
     */
    public void invalidate(DeviceIdentity identity) {
        pemByHost.remove(identity.fullyQualifiedName());
        contextByHost.remove(identity.fullyQualifiedName());
    }

    /**
     * Fetch the certificate again and replace the cached entries.
     *
     * @return the new pinned context, empty when the fetch or parse failed
     */
    public Optional<DeviceTlsContext> refetch(DeviceIdentity identity) {
        return fetchAndPin(identity);
    }

    /**
     * Storage key of a device certificate: {@code {prefix}/{UPPER}/{fqdn}.crt}.
     */
    public String certificateKey(DeviceIdentity identity) {
        return keyPrefix + "/" + identity.upperCaseName() + "/" + identity.fullyQualifiedName() + ".crt";
    }

    public Optional<String> cachedPem(DeviceIdentity identity) {
        return Optional.ofNullable(pemByHost.get(identity.fullyQualifiedName()));
    }

    private Optional<DeviceTlsContext> fetchAndPin(DeviceIdentity identity) {
        String key = certificateKey(identity);
        String pem;
        try {
            pem = storage.getText(bucket, key);
        } catch (IOException e) {
            log.warn("certificate fetch failed for {}: {}", identity, e.getMessage());
            return Optional.empty();
        }
        DeviceTlsContext context;
        try {
            context = DeviceTlsContext.pinned(pem);
        } catch (GeneralSecurityException e) {
            log.warn("certificate for {} is unusable: {}", identity, e.getMessage());
            return Optional.empty();
        }
        pemByHost.put(identity.fullyQualifiedName(), pem);
        contextByHost.put(identity.fullyQualifiedName(), context);
        log.debug("pinned certificate {} for {}", key, identity);
        return Optional.of(context);
    }
}
