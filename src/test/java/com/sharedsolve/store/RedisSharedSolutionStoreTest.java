package com.sharedsolve.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sharedsolve.extraction.ComponentResult;
import com.sharedsolve.fingerprint.TaskFingerprint;
import com.sharedsolve.fingerprint.TaskFingerprinter;
import com.sharedsolve.fingerprint.TaskInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisSharedSolutionStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TaskFingerprint fingerprint = new TaskFingerprinter()
            .fingerprint("math", List.of(TaskInput.of("What is 2+2?")));

    private StringRedisTemplate redis;
    private ValueOperations<String, String> valueOps;
    private RedisSharedSolutionStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(valueOps);
        store = new RedisSharedSolutionStore(redis, objectMapper, "solution", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testPutWritesNamespacedJsonWithTtl() throws Exception {
        boolean stored = store.put(fingerprint, new ComponentResult("done", "v2"), Duration.ofSeconds(120));

        assertTrue(stored);
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("solution:" + fingerprint.value()), json.capture(), eq(Duration.ofSeconds(120)));
        JsonNode document = objectMapper.readTree(json.getValue());
        assertEquals("done", document.get("reply").asText());
        assertEquals("v2", document.get("artifact").asText());
        assertEquals(fingerprint.value(), document.get("fingerprint").asText());
        assertEquals(NOW.toString(), document.get("storedAt").asText());
    }

    @Test
    void testPutReportsStoreFailure() {
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOps).set(anyString(), anyString(), any(Duration.class));

        assertFalse(store.put(fingerprint, new ComponentResult("done", "v2"), Duration.ofSeconds(120)));
    }

    @Test
    void testRoundTrip() {
        String json = "{\"reply\":\"done\",\"artifact\":\"v2\",\"fingerprint\":\"" + fingerprint.value()
                + "\",\"storedAt\":\"" + NOW + "\"}";
        when(valueOps.get("solution:" + fingerprint.value())).thenReturn(json);

        Optional<SharedSolutionEntry> entry = store.find(fingerprint);

        assertTrue(entry.isPresent());
        assertEquals(new ComponentResult("done", "v2"), entry.get().payload());
        assertEquals(NOW, entry.get().storedAt());
        assertEquals(Optional.of(new ComponentResult("done", "v2")), store.get(fingerprint));
    }

    @Test
    void testReadsLegacyPayload() {
        String json = "{\"immediate_response\":\"cached\",\"notebook\":\"v1\",\"stored_at\":\"2026-01-15T10:00:00.123456\"}";
        when(valueOps.get(anyString())).thenReturn(json);

        SharedSolutionEntry entry = store.find(fingerprint).orElseThrow();

        assertEquals("cached", entry.payload().reply());
        assertEquals("v1", entry.payload().artifact());
        assertEquals(Instant.parse("2026-01-15T10:00:00.123456Z"), entry.storedAt());
    }

    @Test
    void testMissingKeyIsAbsent() {
        when(valueOps.get(anyString())).thenReturn(null);
        assertTrue(store.get(fingerprint).isEmpty());
    }

    @Test
    void testUnreadablePayloadIsAbsent() {
        when(valueOps.get(anyString())).thenReturn("not json at all");
        assertTrue(store.get(fingerprint).isEmpty());
    }

    @Test
    void testReadFailureIsAbsent() {
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        assertTrue(store.get(fingerprint).isEmpty());
    }

    @Test
    void testWaitForReturnsOncePublished() {
        when(valueOps.get(anyString())).thenReturn(null, null, "{\"reply\":\"cached\",\"artifact\":\"v1\"}");

        Optional<ComponentResult> result = store.waitFor(fingerprint, Duration.ofSeconds(5), Duration.ofMillis(20));

        assertEquals(Optional.of(new ComponentResult("cached", "v1")), result);
        verify(valueOps, times(3)).get(anyString());
    }

    @Test
    void testWaitForTimesOutWithinOnePollInterval() {
        when(valueOps.get(anyString())).thenReturn(null);
        Duration timeout = Duration.ofMillis(300);
        Duration poll = Duration.ofMillis(100);

        long start = System.nanoTime();
        Optional<ComponentResult> result = store.waitFor(fingerprint, timeout, poll);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(result.isEmpty());
        assertTrue(elapsedMs >= timeout.toMillis(), "waited " + elapsedMs + " ms");
        assertTrue(elapsedMs < timeout.toMillis() + poll.toMillis(), "waited " + elapsedMs + " ms");
    }

    @Test
    void testWaitForStopsWhenInterrupted() {
        when(valueOps.get(anyString())).thenReturn(null);
        Thread.currentThread().interrupt();
        try {
            assertTrue(store.waitFor(fingerprint, Duration.ofSeconds(5), Duration.ofMillis(100)).isEmpty());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testDelete() {
        assertTrue(store.delete(fingerprint));
        verify(redis).delete("solution:" + fingerprint.value());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testAvailability() {
        when(redis.execute(any(RedisCallback.class))).thenReturn("PONG");
        assertTrue(store.isAvailable());

        when(redis.execute(any(RedisCallback.class))).thenThrow(new RedisConnectionFailureException("down"));
        assertFalse(store.isAvailable());
    }
}
