package com.sharedsolve.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sharedsolve.config.SharedSolveProperties;
import com.sharedsolve.extraction.ComponentResult;
import com.sharedsolve.fingerprint.TaskFingerprint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed {@link SharedSolutionStore}. Entries are flat JSON documents written with
 * {@code SET ... EX}, so Redis enforces the expiry.
 */
@Service
@Slf4j
public class RedisSharedSolutionStore implements SharedSolutionStore {

    static final String FIELD_REPLY = "reply";
    static final String FIELD_ARTIFACT = "artifact";
    static final String FIELD_FINGERPRINT = "fingerprint";
    static final String FIELD_STORED_AT = "storedAt";
    // Entries published by nodes running the earlier release.
    private static final String LEGACY_REPLY = "immediate_response";
    private static final String LEGACY_ARTIFACT = "notebook";
    private static final String LEGACY_STORED_AT = "stored_at";
    private static final Duration MIN_POLL_INTERVAL = Duration.ofMillis(10);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String namespace;
    private final Clock clock;

    @Autowired
    public RedisSharedSolutionStore(StringRedisTemplate redis, ObjectMapper objectMapper, SharedSolveProperties properties) {
        this(redis, objectMapper, properties.getStore().getNamespace(), Clock.systemUTC());
    }

    RedisSharedSolutionStore(StringRedisTemplate redis, ObjectMapper objectMapper, String namespace, Clock clock) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.namespace = namespace;
        this.clock = clock;
    }

    String key(TaskFingerprint fingerprint) {
        return namespace + ":" + fingerprint.value();
    }

    @Override
    public boolean put(TaskFingerprint fingerprint, ComponentResult payload, Duration ttl) {
        try {
            ObjectNode document = objectMapper.createObjectNode();
            document.put(FIELD_REPLY, payload.reply());
            document.put(FIELD_ARTIFACT, payload.artifact());
            document.put(FIELD_FINGERPRINT, fingerprint.value());
            document.put(FIELD_STORED_AT, Instant.now(clock).toString());
            redis.opsForValue().set(key(fingerprint), objectMapper.writeValueAsString(document), ttl);
            log.info("Stored solution for task {} (TTL: {}s)", fingerprint.abbreviated(), ttl.toSeconds());
            return true;
        } catch (Exception ex) {
            log.error("Failed to store solution for task {}: {}", fingerprint.abbreviated(), ex.getMessage());
            return false;
        }
    }

    @Override
    public Optional<SharedSolutionEntry> find(TaskFingerprint fingerprint) {
        String json;
        try {
            json = redis.opsForValue().get(key(fingerprint));
        } catch (Exception ex) {
            log.error("Failed to get solution for task {}: {}", fingerprint.abbreviated(), ex.getMessage());
            return Optional.empty();
        }
        if (json == null) {
            log.debug("No solution found for task {}", fingerprint.abbreviated());
            return Optional.empty();
        }
        try {
            JsonNode document = objectMapper.readTree(json);
            if (document == null || !document.isObject()) {
                log.warn("Ignoring malformed solution for task {}", fingerprint.abbreviated());
                return Optional.empty();
            }
            ComponentResult payload = new ComponentResult(
                    text(document, FIELD_REPLY, LEGACY_REPLY),
                    text(document, FIELD_ARTIFACT, LEGACY_ARTIFACT));
            log.info("Retrieved solution for task {}", fingerprint.abbreviated());
            return Optional.of(new SharedSolutionEntry(fingerprint, payload, storedAt(document)));
        } catch (Exception ex) {
            log.warn("Ignoring unreadable solution for task {}: {}", fingerprint.abbreviated(), ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<ComponentResult> waitFor(TaskFingerprint fingerprint, Duration timeout, Duration pollInterval) {
        long pollNanos = Math.max(pollInterval.toNanos(), MIN_POLL_INTERVAL.toNanos());
        long start = System.nanoTime();
        long deadline = start + Math.max(timeout.toNanos(), 0L);
        log.info("Waiting for solution: {} (timeout: {}s)", fingerprint.abbreviated(), timeout.toSeconds());
        while (true) {
            Optional<ComponentResult> solution = get(fingerprint);
            if (solution.isPresent()) {
                log.info("Solution received after {} ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
                return solution;
            }
            long now = System.nanoTime();
            if (now - deadline >= 0) {
                log.warn("Timeout waiting for solution: {} ({} ms)", fingerprint.abbreviated(),
                        TimeUnit.NANOSECONDS.toMillis(now - start));
                return Optional.empty();
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(pollNanos, deadline - now));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for solution: {}", fingerprint.abbreviated());
                return Optional.empty();
            }
        }
    }

    @Override
    public boolean delete(TaskFingerprint fingerprint) {
        try {
            redis.delete(key(fingerprint));
            log.info("Deleted solution for task {}", fingerprint.abbreviated());
            return true;
        } catch (Exception ex) {
            log.error("Failed to delete solution for task {}: {}", fingerprint.abbreviated(), ex.getMessage());
            return false;
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception ex) {
            log.debug("Shared store health check failed: {}", ex.getMessage());
            return false;
        }
    }

    @Nullable
    private static String text(JsonNode document, String field, String legacyField) {
        JsonNode node = document.hasNonNull(field) ? document.get(field) : document.get(legacyField);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    @Nullable
    private static Instant storedAt(JsonNode document) {
        String value = document.hasNonNull(FIELD_STORED_AT)
                ? document.get(FIELD_STORED_AT).asText()
                : document.path(LEGACY_STORED_AT).asText(null);
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            // Older nodes wrote naive UTC timestamps without an offset.
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException unparseable) {
                log.debug("Unrecognized storedAt value: {}", value);
                return null;
            }
        }
    }
}
