package com.panelgate.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;

/**
 * HTTP client for the upstream authorization service.
 * <p>
 * The credential travels only in the {@code KEYME-TOKEN} header; it is never part of
 * a URL and never logged. Every call is bounded by the configured timeout.
 */
@Slf4j
public class AuthorizationClient {

    public static final String TOKEN_HEADER = "KEYME-TOKEN";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public AuthorizationClient(String baseUrl, Duration timeout, ObjectMapper objectMapper) {
        this(baseUrl, new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build(), objectMapper);
    }

    /** Constructor for testing – allows injecting a custom OkHttpClient. */
    AuthorizationClient(String baseUrl, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Ask whether the credential holds a capability.
     *
     * @throws IOException on transport failure or timeout
     * @throws IllegalArgumentException when the credential cannot be sent as a header value
     */
    public UpstreamResponse checkPermission(String credential, String capability) throws IOException {
        requireHeaderSafe(credential);
        HttpUrl url = HttpUrl.get(baseUrl + "/api/permission/check").newBuilder()
                .addQueryParameter("permission_slug", capability)
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header(TOKEN_HEADER, credential)
                .get()
                .build();
        return execute(request);
    }

    /**
     * Forward a JSON body to an authorization service endpoint and return its answer
     * verbatim (login/logout proxying).
     *
     * @param path endpoint path, e.g. {@code /api/login}
     * @throws IOException on transport failure or timeout
     */
    public UpstreamResponse post(String path, JsonNode body) throws IOException {
        Request request = new Request.Builder()
                .url(baseUrl + path)
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                .build();
        return execute(request);
    }

    /**
     * OkHttp rejects header values outside visible ASCII and tab, and its message echoes
     * the value. Check up front so the credential never lands in an exception.
     */
    static void requireHeaderSafe(String credential) {
        for (int i = 0; i < credential.length(); i++) {
            char c = credential.charAt(i);
            if (c != '\t' && (c < 0x20 || c > 0x7e)) {
                throw new IllegalArgumentException("credential contains a character not allowed in "
                        + TOKEN_HEADER + " at index " + i);
            }
        }
    }

    private UpstreamResponse execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body != null ? body.string() : "";
            return new UpstreamResponse(response.code(), parse(raw));
        }
    }

    private JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (IOException e) {
            log.debug("authorization service returned a non-JSON body: {}", e.getMessage());
            return NullNode.getInstance();
        }
    }

    /**
     * Status code and parsed JSON body of an upstream response.
     */
    public record UpstreamResponse(int status, JsonNode body) {
        public boolean isSuccessful() {
            return status >= 200 && status < 300;
        }
    }
}
