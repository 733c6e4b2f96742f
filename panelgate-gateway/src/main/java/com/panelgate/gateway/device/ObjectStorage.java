package com.panelgate.gateway.device;

import java.io.IOException;

/**
 * Read-only access to the object store holding device certificates.
 */
public interface ObjectStorage {

    /**
     * Fetch an object as UTF-8 text.
     *
     * @throws IOException when the object is missing or the store is unreachable
     */
    String getText(String bucket, String key) throws IOException;
}
