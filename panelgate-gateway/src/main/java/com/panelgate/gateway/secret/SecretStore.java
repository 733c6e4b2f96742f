package com.panelgate.gateway.secret;

import java.io.IOException;

/**
 * Source of named secret strings.
 */
public interface SecretStore {

    /**
     * @throws IOException when the secret is missing, has no string value, or the store
     *                     is unreachable
     */
    String getSecretString(String secretId) throws IOException;
}
