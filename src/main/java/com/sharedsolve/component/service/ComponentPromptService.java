package com.sharedsolve.component.service;

import com.sharedsolve.component.model.ComponentTask;
import com.sharedsolve.component.model.ComponentType;
import com.sharedsolve.extraction.PriorOutput;
import com.sharedsolve.fingerprint.TaskInput;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

import static com.sharedsolve.component.ComponentConstants.*;

@Service
public class ComponentPromptService {

    public String systemPrompt(ComponentType type) {
        return switch (type) {
            case COMPLETE -> structured(COMPLETE_SYSTEM_PROMPT,
                    "Your natural language explanation of what you did or your answer",
                    "Updated artifact content OR 'no update'",
                    COMPLETE_ARTIFACT_GUIDELINES);
            case REFINE -> structured(REFINE_SYSTEM_PROMPT,
                    "Explanation of what you refined and why",
                    "The refined/improved content OR 'no update'",
                    REFINE_ARTIFACT_GUIDELINES);
            case FEEDBACK -> FEEDBACK_SYSTEM_PROMPT;
            case SUMMARY -> structured(SUMMARY_SYSTEM_PROMPT,
                    "Your summary explanation",
                    "Summarized artifact content OR 'no update'",
                    SUMMARY_ARTIFACT_GUIDELINES);
            case AGGREGATE -> structured(AGGREGATE_SYSTEM_PROMPT,
                    "Your explanation of the consensus and voting results",
                    "The aggregated/consensus artifact content OR 'no update'",
                    AGGREGATE_ARTIFACT_GUIDELINES);
        };
    }

    public String userPrompt(ComponentType type, ComponentTask task) {
        return switch (type) {
            case COMPLETE -> COMPLETE_USER_TEMPLATE.formatted(task.task(), inputText(task.inputs()),
                    previousOutputsSection(PREVIOUS_OUTPUTS_HEADER, task.previousOutputs()));
            case REFINE -> REFINE_USER_TEMPLATE.formatted(task.task(), inputText(task.inputs()),
                    previousOutputsSection(OUTPUTS_TO_REFINE_HEADER, task.previousOutputs()));
            case FEEDBACK -> FEEDBACK_USER_TEMPLATE.formatted(task.task(),
                    previousOutputsSection(OUTPUTS_TO_ANALYZE_HEADER, task.previousOutputs()));
            case SUMMARY -> SUMMARY_USER_TEMPLATE.formatted(task.task(), summaryBlocks(task.previousOutputs()));
            case AGGREGATE -> AGGREGATE_USER_TEMPLATE.formatted(task.task(), numberedOutputs(task.previousOutputs()));
        };
    }

    public String historyEntry(ComponentType type, ComponentTask task) {
        return switch (type) {
            case COMPLETE -> COMPLETE_HISTORY_ENTRY.formatted(task.task(), inputText(task.inputs()));
            case REFINE -> REFINE_HISTORY_ENTRY.formatted(task.task());
            case FEEDBACK -> FEEDBACK_HISTORY_ENTRY.formatted(task.task());
            case SUMMARY -> SUMMARY_HISTORY_ENTRY.formatted(task.task());
            case AGGREGATE -> AGGREGATE_HISTORY_ENTRY.formatted(task.task());
        };
    }

    String inputText(List<TaskInput> inputs) {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            parts.add("Query " + (i + 1) + ": " + inputs.get(i).query());
        }
        return String.join("\n\n", parts);
    }

    String previousOutputsSection(String header, List<PriorOutput> priors) {
        if (priors.isEmpty()) {
            return "";
        }
        StringBuilder section = new StringBuilder(header);
        for (PriorOutput prior : priors) {
            section.append("\n[").append(prior.sourceName()).append("] ").append(nullToEmpty(prior.task())).append(":\n");
            section.append("  Response: ").append(nullToEmpty(prior.reply())).append("\n");
            if (prior.hasArtifact()) {
                section.append("  Artifact: ").append(prior.artifact()).append("\n");
            }
        }
        return section.toString();
    }

    String summaryBlocks(List<PriorOutput> priors) {
        List<String> blocks = new ArrayList<>();
        for (PriorOutput prior : priors) {
            blocks.add(outputBlock("[" + prior.sourceName() + "] " + nullToEmpty(prior.task()) + ":\n", prior));
        }
        return String.join(OUTPUT_SEPARATOR, blocks);
    }

    String numberedOutputs(List<PriorOutput> priors) {
        List<String> blocks = new ArrayList<>();
        for (int i = 0; i < priors.size(); i++) {
            PriorOutput prior = priors.get(i);
            blocks.add(outputBlock("Output " + (i + 1) + " [" + prior.sourceName() + "]:\n", prior));
        }
        return String.join(OUTPUT_SEPARATOR, blocks);
    }

    private static String outputBlock(String heading, PriorOutput prior) {
        StringBuilder block = new StringBuilder(heading);
        block.append("Response: ").append(nullToEmpty(prior.reply())).append("\n");
        if (prior.hasArtifact()) {
            block.append("Artifact: ").append(prior.artifact()).append("\n");
        }
        return block.toString();
    }

    private static String structured(String role, String replyHint, String artifactHint, String guidelines) {
        return role + "\n" + STRUCTURED_OUTPUT_CONTRACT.formatted(replyHint, artifactHint)
                + "\n" + guidelines + STRUCTURED_OUTPUT_CLOSING;
    }

    private static String nullToEmpty(String value) {
        return StringUtils.hasLength(value) ? value : "";
    }
}
