package com.sharedsolve.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Derives the {@link TaskFingerprint} that sibling nodes use to agree on "the same task".
 *
 * <p>Every string is trimmed, missing artifacts become empty strings, and the structure
 * {@code {task, inputs: [{query, artifact}]}} is written as compact JSON with sorted keys and
 * non-ASCII characters escaped before hashing with SHA-256. The result depends only on that
 * canonical content.</p>
 */
@Component
public class TaskFingerprinter {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public TaskFingerprint fingerprint(String task, List<TaskInput> inputs) {
        return new TaskFingerprint(HexFormat.of().formatHex(sha256(canonicalBytes(task, inputs))));
    }

    byte[] canonicalBytes(String task, List<TaskInput> inputs) {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");
        List<Map<String, String>> canonicalInputs = new ArrayList<>(inputs.size());
        for (TaskInput input : inputs) {
            Objects.requireNonNull(input, "input item must not be null");
            Objects.requireNonNull(input.query(), "input query is required");
            Map<String, String> item = new TreeMap<>();
            item.put("query", input.query().trim());
            item.put("artifact", trimOrEmpty(input.artifact()));
            canonicalInputs.add(item);
        }
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("task", task.trim());
        canonical.put("inputs", canonicalInputs);
        try {
            return CANONICAL_MAPPER.writeValueAsBytes(canonical);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize canonical task", ex);
        }
    }

    private static String trimOrEmpty(@Nullable String value) {
        return value == null ? "" : value.trim();
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
