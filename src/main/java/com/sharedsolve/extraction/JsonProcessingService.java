package com.sharedsolve.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
public class JsonProcessingService {

    private final ObjectMapper objectMapper;
    private final ObjectReader modelOutputReader;

    public JsonProcessingService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        // Models emit raw newlines inside string values; trailing text after the object is not JSON.
        this.modelOutputReader = objectMapper.reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .with(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS);
    }

    public Optional<JsonNode> readTree(@Nullable String candidate) {
        if (!StringUtils.hasText(candidate)) {
            return Optional.empty();
        }
        try {
            JsonNode node = modelOutputReader.readTree(candidate);
            if (node == null || node.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException ex) {
            log.debug("Candidate is not valid JSON: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    public Optional<ObjectNode> readObject(@Nullable String candidate) {
        return readTree(candidate)
                .filter(JsonNode::isObject)
                .map(ObjectNode.class::cast);
    }

    public boolean isJsonObject(@Nullable String candidate) {
        return readObject(candidate).isPresent();
    }

    public String truncate(@Nullable String value, int maxLength) {
        if (value == null) {
            return "";
        }
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return "\"serialization-failed-" + UUID.randomUUID() + "\"";
        }
    }
}
