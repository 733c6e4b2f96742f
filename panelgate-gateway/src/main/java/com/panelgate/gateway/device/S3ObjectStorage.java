package com.panelgate.gateway.device;

import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link ObjectStorage} backed by Amazon S3.
 */
public class S3ObjectStorage implements ObjectStorage {

    private final S3Client s3;

    public S3ObjectStorage(S3Client s3) {
        this.s3 = s3;
    }

    @Override
    public String getText(String bucket, String key) throws IOException {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            ResponseBytes<GetObjectResponse> bytes = s3.getObjectAsBytes(request);
            return bytes.asString(StandardCharsets.UTF_8);
        } catch (SdkException e) {
            throw new IOException("s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }
}
