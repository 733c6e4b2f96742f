package com.panelgate.gateway.secret;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

import java.io.IOException;

/**
 * {@link SecretStore} backed by AWS Secrets Manager.
 */
public class SecretsManagerSecretStore implements SecretStore {

    private final SecretsManagerClient client;

    public SecretsManagerSecretStore(SecretsManagerClient client) {
        this.client = client;
    }

    @Override
    public String getSecretString(String secretId) throws IOException {
        try {
            GetSecretValueResponse response = client.getSecretValue(
                    GetSecretValueRequest.builder().secretId(secretId).build());
            String value = response.secretString();
            if (value == null) {
                throw new IOException("secret " + secretId + " has no string value");
            }
            return value;
        } catch (SdkException e) {
            throw new IOException("secret " + secretId + ": " + e.getMessage(), e);
        }
    }
}
