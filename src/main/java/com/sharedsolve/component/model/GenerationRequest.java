package com.sharedsolve.component.model;

import java.util.List;

public record GenerationRequest(
        String prompt,
        String systemPrompt,
        List<HistoryMessage> history,
        double temperature,
        boolean jsonOutput
) {

    public GenerationRequest {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
