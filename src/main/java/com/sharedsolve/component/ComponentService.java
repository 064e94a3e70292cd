package com.sharedsolve.component;

import com.sharedsolve.component.api.ConversationHistoryService;
import com.sharedsolve.component.api.TextGenerator;
import com.sharedsolve.component.model.ComponentTask;
import com.sharedsolve.component.model.ComponentType;
import com.sharedsolve.component.model.GenerationRequest;
import com.sharedsolve.component.model.HistoryMessage;
import com.sharedsolve.component.service.ComponentPromptService;
import com.sharedsolve.config.SharedSolveProperties;
import com.sharedsolve.coordination.CoordinationMetricsService;
import com.sharedsolve.coordination.CoordinationRouter;
import com.sharedsolve.coordination.NodeRole;
import com.sharedsolve.coordination.RoutedResult;
import com.sharedsolve.extraction.ArtifactResolver;
import com.sharedsolve.extraction.ComponentResult;
import com.sharedsolve.extraction.ResponseExtractor;
import com.sharedsolve.fingerprint.TaskFingerprint;
import com.sharedsolve.fingerprint.TaskFingerprinter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

import static com.sharedsolve.component.ComponentConstants.NO_PREVIOUS_OUTPUTS_TO_AGGREGATE;
import static com.sharedsolve.component.ComponentConstants.NO_PREVIOUS_OUTPUTS_TO_SUMMARIZE;

/**
 * Runs one component request through the coordination flow: fingerprint the task, let the
 * {@link CoordinationRouter} pick between local generation and a shared result, and for local
 * generation extract the structured result and resolve carried-forward artifacts before it is
 * returned or published.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComponentService {

    private final TaskFingerprinter fingerprinter;
    private final CoordinationRouter coordinationRouter;
    private final TextGenerator textGenerator;
    private final ResponseExtractor responseExtractor;
    private final ArtifactResolver artifactResolver;
    private final ComponentPromptService promptService;
    private final ConversationHistoryService historyService;
    private final CoordinationMetricsService metricsService;
    private final SharedSolveProperties properties;

    public RoutedResult execute(ComponentType type, ComponentTask task) {
        NodeRole role = properties.getCoordination().getRole();
        log.info("[{}] Processing task as {} node: {}", type.key(), role, task.task());
        TaskFingerprint fingerprint = fingerprinter.fingerprint(task.task(), task.inputs());
        log.info("[{}] Task fingerprint: {}", type.key(), fingerprint.abbreviated());

        if (type.requiresPreviousOutputs() && task.previousOutputs().isEmpty()) {
            String reply = type == ComponentType.SUMMARY
                    ? NO_PREVIOUS_OUTPUTS_TO_SUMMARIZE
                    : NO_PREVIOUS_OUTPUTS_TO_AGGREGATE;
            return RoutedResult.generated(ComponentResult.replyOnly(reply));
        }
        RoutedResult routed = coordinationRouter.route(role, fingerprint, () -> generateLocally(type, task));
        log.info("[{}] Completed task {} with source {}", type.key(), fingerprint.abbreviated(), routed.source());
        metricsService.logSummary();
        return routed;
    }

    ComponentResult generateLocally(ComponentType type, ComponentTask task) {
        List<HistoryMessage> history = loadHistory(type, task);
        String systemPrompt = promptService.systemPrompt(type);
        String prompt = promptService.userPrompt(type, task);
        metricsService.recordGeneration(type.key(), task.cid());
        String raw = textGenerator.generate(
                new GenerationRequest(prompt, systemPrompt, history, type.temperature(), type.structuredOutput()));

        ComponentResult result;
        if (type.structuredOutput()) {
            ComponentResult extracted = responseExtractor.extract(type.key(), raw);
            result = artifactResolver.resolve(type.key(), extracted, task.previousOutputs());
        } else {
            result = ComponentResult.replyOnly(raw);
        }
        recordExchange(type, task, result);
        return result;
    }

    private List<HistoryMessage> loadHistory(ComponentType type, ComponentTask task) {
        if (!task.useConversationHistory() || !StringUtils.hasText(task.cid())) {
            log.info("[{}] Conversation history disabled", type.key());
            return List.of();
        }
        try {
            List<HistoryMessage> history = historyService.recent(task.cid(), properties.getConversation().getHistoryCount());
            log.info("[{}] Using conversation history: {} messages", type.key(), history.size());
            return history;
        } catch (RuntimeException ex) {
            log.warn("[{}] Failed to load conversation history for {}: {}", type.key(), task.cid(), ex.getMessage());
            return List.of();
        }
    }

    private void recordExchange(ComponentType type, ComponentTask task, ComponentResult result) {
        if (!StringUtils.hasText(task.cid())) {
            return;
        }
        try {
            historyService.appendExchange(task.cid(), promptService.historyEntry(type, task), result.reply());
        } catch (RuntimeException ex) {
            log.warn("[{}] Failed to record conversation history for {}: {}", type.key(), task.cid(), ex.getMessage());
        }
    }
}
