package com.panelgate.gateway.secret;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ServiceSecretProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String SECRET_ID = "/prod/key-scanner/env";

    /** Answers queued values in order; a null entry means the store is unreachable. */
    static final class QueueStore implements SecretStore {
        final Deque<Optional<String>> answers = new ArrayDeque<>();
        int calls;
        String lastId;

        QueueStore answer(String value) {
            answers.add(Optional.ofNullable(value));
            return this;
        }

        @Override
        public String getSecretString(String secretId) throws IOException {
            calls++;
            lastId = secretId;
            Optional<String> next = answers.poll();
            if (next == null || next.isEmpty()) {
                throw new IOException("AccessDenied");
            }
            return next.get();
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "plain-key | plain-key",
            "'  spaced-key  ' | spaced-key",
            "{\"WSS_API_KEY\":\"a\",\"api_key\":\"b\"} | a",
            "{\"api_key\":\"b\",\"KEY_SCANNER_API_KEY\":\"c\"} | b",
            "{\"KEY_SCANNER_API_KEY\":\"c\"} | c",
            "{\"WSS_API_KEY\":\"\",\"api_key\":\"b\"} | b",
            "{not json | {not json",
    })
    void extractsKeyFromSecretString(String raw, String expected) {
        ServiceSecretProvider provider = new ServiceSecretProvider(new QueueStore().answer(raw), SECRET_ID, MAPPER);
        assertEquals(Optional.of(expected), provider.get());
    }

    @Test
    void jsonWithoutKnownFieldIsUnavailable() {
        ServiceSecretProvider provider = new ServiceSecretProvider(
                new QueueStore().answer("{\"other\":\"x\"}"), SECRET_ID, MAPPER);
        assertTrue(provider.get().isEmpty());
        assertFalse(provider.isAvailable());
    }

    @Test
    void successIsFetchedOnce() {
        QueueStore store = new QueueStore().answer("k1").answer("k2");
        ServiceSecretProvider provider = new ServiceSecretProvider(store, SECRET_ID, MAPPER);

        assertEquals(Optional.of("k1"), provider.get());
        assertEquals(Optional.of("k1"), provider.get());
        assertEquals(1, store.calls);
        assertEquals(SECRET_ID, store.lastId);
    }

    @Test
    void failureIsNotCached() {
        QueueStore store = new QueueStore().answer(null).answer("k1");
        ServiceSecretProvider provider = new ServiceSecretProvider(store, SECRET_ID, MAPPER);

        assertTrue(provider.get().isEmpty());
        assertEquals(Optional.of("k1"), provider.get());
        assertEquals(2, store.calls);
    }
}
