package com.sharedsolve.component;

public final class ComponentConstants {

    private ComponentConstants() {
        // Private constructor to prevent instantiation
    }

    public static final String NO_PREVIOUS_OUTPUTS_TO_SUMMARIZE = "No previous outputs to summarize.";
    public static final String NO_PREVIOUS_OUTPUTS_TO_AGGREGATE = "No previous outputs to aggregate.";

    // Shared output contract for components that return a reply plus an artifact
    public static final String STRUCTURED_OUTPUT_CONTRACT = """

            CRITICAL: You MUST respond with ONLY valid JSON. No markdown code blocks, no explanations outside JSON, no extra text.

            Required JSON format:
            {
              "reply": "%s",
              "artifact": "%s"
            }
            """;

    public static final String STRUCTURED_OUTPUT_CLOSING = "\nYour response must be ONLY the JSON object, nothing else.";

    // System prompts
    public static final String COMPLETE_SYSTEM_PROMPT = "You are an intelligent AI assistant that helps users complete tasks.";
    public static final String COMPLETE_ARTIFACT_GUIDELINES = """
            Guidelines for the artifact field:
            - If the task is conversational only: Return "no update"
            - If there's ONE artifact and no changes are needed: Return "no update"
            - If there's ONE artifact and changes are needed: Return the updated version
            - If there are MULTIPLE artifacts: You MUST create new content (combine/choose/merge) - NEVER "no update"
            - If creating a new artifact: Return the full content
            """;

    public static final String REFINE_SYSTEM_PROMPT = "You are an AI assistant that refines and improves outputs.";
    public static final String REFINE_ARTIFACT_GUIDELINES = """
            Guidelines for the artifact field:
            - If providing feedback only: Set artifact to "no update"
            - If there's ONE artifact and no improvements are needed: Set to "no update"
            - If there's ONE artifact and improvements are needed: Write the improved version
            - If there are MULTIPLE artifacts: You MUST create new content (refine one, combine, or merge) - NEVER "no update"
            """;

    public static final String FEEDBACK_SYSTEM_PROMPT = "You are an AI assistant that provides constructive feedback.";

    public static final String SUMMARY_SYSTEM_PROMPT = "You are an AI assistant that creates concise, comprehensive summaries.";
    public static final String SUMMARY_ARTIFACT_GUIDELINES = """
            Guidelines for the artifact field:
            - If there's NO artifact content in the inputs: Return "no update"
            - If there's ONE artifact to summarize: Return the summarized version
            - If there are MULTIPLE artifacts: Create a combined summary
            """;

    public static final String AGGREGATE_SYSTEM_PROMPT = "You are an AI assistant that aggregates multiple outputs using majority voting.";
    public static final String AGGREGATE_ARTIFACT_GUIDELINES = """
            Guidelines for the artifact field:
            - If there's NO artifact content in the inputs: Return "no update"
            - If there's ONE artifact: Return it as-is (or "no update" if no changes)
            - If there are MULTIPLE artifacts: Create an aggregated version using majority voting
            - Use majority voting: Choose the most common content or merge agreements
            """;

    // User templates
    public static final String COMPLETE_USER_TEMPLATE = """
            Task: %s

            Input:
            %s
            %s

            Complete this task and respond in JSON format.""";

    public static final String REFINE_USER_TEMPLATE = """
            Task: %s

            Original Input:
            %s
            %s

            Refine and improve the outputs. Respond in JSON format.""";

    public static final String FEEDBACK_USER_TEMPLATE = """
            Task: %s
            %s

            Analyze the outputs and provide structured feedback:

            For each output, identify:
            1. Strengths (what works well)
            2. Weaknesses (what could be improved)
            3. Specific suggestions for improvement

            Format your feedback clearly with sections.""";

    public static final String SUMMARY_USER_TEMPLATE = """
            Task: %s

            Content to summarize:
            %s

            Create a comprehensive summary that:
            1. Captures the main points and key insights
            2. Maintains important details
            3. Removes redundancy
            4. Organizes information logically

            Respond in JSON format.""";

    public static final String AGGREGATE_USER_TEMPLATE = """
            Task: %s

            Multiple outputs to aggregate:
            %s

            Analyze these outputs and determine the consensus answer by:
            1. Identifying common themes and agreements
            2. Noting where outputs differ
            3. Using majority voting logic to determine the most supported answer
            4. Highlighting any important minority opinions

            Respond in JSON format.""";

    // Section headers for previous outputs
    public static final String PREVIOUS_OUTPUTS_HEADER = "\n\nPrevious component outputs:\n";
    public static final String OUTPUTS_TO_REFINE_HEADER = "\n\nPrevious outputs to refine:\n";
    public static final String OUTPUTS_TO_ANALYZE_HEADER = "\n\nOutputs to analyze:\n";
    public static final String OUTPUT_SEPARATOR = "\n\n---\n\n";

    // Conversation history entries
    public static final String COMPLETE_HISTORY_ENTRY = "Task: %s\n%s";
    public static final String REFINE_HISTORY_ENTRY = "Refine task: %s";
    public static final String FEEDBACK_HISTORY_ENTRY = "Feedback request: %s";
    public static final String SUMMARY_HISTORY_ENTRY = "Summarize: %s";
    public static final String AGGREGATE_HISTORY_ENTRY = "Aggregate: %s";
}
