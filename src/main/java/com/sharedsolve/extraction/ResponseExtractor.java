package com.sharedsolve.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import static com.sharedsolve.extraction.ComponentResult.NO_UPDATE;

/**
 * Turns raw generator text into a {@link ComponentResult}.
 *
 * <p>The primary pass picks a candidate from a {@code ```json} fence or the first fenced block
 * that parses, narrows it to the outermost braces when needed, and reads {@code reply} and
 * {@code artifact} from it. When that candidate does not parse, the fallback strategies are
 * tried against the whole text. If nothing parses the raw text becomes the reply and the
 * artifact is {@value ComponentResult#NO_UPDATE}. This class never throws on malformed input.</p>
 */
@Service
@Slf4j
public class ResponseExtractor {

    static final List<String> REPLY_FIELDS = List.of("reply", "immediate_response");
    static final List<String> ARTIFACT_FIELDS = List.of("artifact", "notebook");
    private static final String CONTENT_FIELD = "content";
    private static final String PART_SEPARATOR = "\n\n";

    private final JsonProcessingService jsonProcessingService;
    private final List<RecoveryStrategy> candidateStrategies;
    private final RecoveryStrategy boundaryStrategy;
    private final List<RecoveryStrategy> fallbackStrategies;

    public ResponseExtractor(JsonProcessingService jsonProcessingService) {
        this.jsonProcessingService = jsonProcessingService;
        this.candidateStrategies = List.of(
                RecoveryStrategies.labeledFence(),
                RecoveryStrategies.firstParsableFence(jsonProcessingService::isJsonObject));
        this.boundaryStrategy = RecoveryStrategies.outerBraces();
        this.fallbackStrategies = List.of(
                RecoveryStrategies.outerBraces(),
                RecoveryStrategies.lastBalancedObject(),
                RecoveryStrategies.firstBalancedObject());
    }

    public ComponentResult extract(String label, @Nullable String raw) {
        String response = raw == null ? "" : raw;
        Optional<ComponentResult> parsed = parse(label, primaryCandidate(response), response);
        if (parsed.isPresent()) {
            log.debug("[{}] Parsed structured response", label);
            return parsed.get();
        }
        log.warn("[{}] Failed to parse structured response. Snippet: {}", label,
                jsonProcessingService.truncate(response, 240));
        for (RecoveryStrategy strategy : fallbackStrategies) {
            Optional<ComponentResult> recovered = strategy.candidate(response)
                    .flatMap(candidate -> parse(label, candidate, response));
            if (recovered.isPresent()) {
                log.info("[{}] Parsed structured response using fallback {}", label, strategy.name());
                return recovered.get();
            }
            log.debug("[{}] Fallback {} found nothing usable", label, strategy.name());
        }
        log.warn("[{}] All structured parsing attempts failed. Using raw response.", label);
        return new ComponentResult(response, NO_UPDATE);
    }

    String primaryCandidate(String response) {
        String text = response.trim();
        String candidate = text;
        for (RecoveryStrategy strategy : candidateStrategies) {
            Optional<String> found = strategy.candidate(text);
            if (found.isPresent()) {
                candidate = found.get();
                break;
            }
        }
        if (!candidate.startsWith("{")) {
            candidate = boundaryStrategy.candidate(candidate).orElse(candidate);
        }
        return candidate;
    }

    private Optional<ComponentResult> parse(String label, String candidate, String response) {
        return jsonProcessingService.readObject(candidate).map(object -> toResult(label, object, response));
    }

    private ComponentResult toResult(String label, ObjectNode object, String response) {
        JsonNode replyNode = field(object, REPLY_FIELDS);
        JsonNode artifactNode = field(object, ARTIFACT_FIELDS);
        String reply = isAbsent(replyNode) ? response : text(replyNode);

        if (replyNode != null && replyNode.isTextual()) {
            Optional<ObjectNode> inner = encodedResult(replyNode.asText());
            if (inner.isPresent()) {
                log.info("[{}] Found encoded reply, extracting inner content", label);
                JsonNode innerReply = field(inner.get(), REPLY_FIELDS);
                if (!isAbsent(innerReply)) {
                    reply = text(innerReply);
                }
                JsonNode innerArtifact = field(inner.get(), ARTIFACT_FIELDS);
                if (innerArtifact != null) {
                    artifactNode = innerArtifact;
                }
            }
        }
        return new ComponentResult(reply, normalizeArtifact(artifactNode));
    }

    private Optional<ObjectNode> encodedResult(String value) {
        String trimmed = value.trim();
        if (!(trimmed.startsWith("{") && trimmed.endsWith("}"))) {
            return Optional.empty();
        }
        return jsonProcessingService.readObject(trimmed)
                .filter(inner -> field(inner, REPLY_FIELDS) != null || field(inner, ARTIFACT_FIELDS) != null);
    }

    String normalizeArtifact(@Nullable JsonNode node) {
        if (isAbsent(node)) {
            return NO_UPDATE;
        }
        if (node.isObject()) {
            JsonNode content = node.get(CONTENT_FIELD);
            if (!isAbsent(content)) {
                return content.isArray() ? joinParts(content) : text(content);
            }
            return jsonProcessingService.toJson(node);
        }
        if (node.isArray()) {
            return joinParts(node);
        }
        if (node.isTextual()) {
            return normalizeEncodedArtifact(node.asText());
        }
        return node.asText();
    }

    private String normalizeEncodedArtifact(String value) {
        String trimmed = value.trim();
        boolean looksEncoded = (trimmed.startsWith("{") || trimmed.startsWith("["))
                && (trimmed.endsWith("}") || trimmed.endsWith("]"));
        if (!looksEncoded) {
            return value;
        }
        return jsonProcessingService.readTree(trimmed)
                .filter(JsonNode::isContainerNode)
                .map(this::normalizeArtifact)
                .orElse(value);
    }

    private static String joinParts(JsonNode parts) {
        return StreamSupport.stream(parts.spliterator(), false)
                .map(ResponseExtractor::text)
                .collect(Collectors.joining(PART_SEPARATOR));
    }

    @Nullable
    private static JsonNode field(ObjectNode object, List<String> names) {
        for (String name : names) {
            if (object.has(name)) {
                return object.get(name);
            }
        }
        return null;
    }

    private static boolean isAbsent(@Nullable JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static String text(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
