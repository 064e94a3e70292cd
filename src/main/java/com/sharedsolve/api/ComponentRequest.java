package com.sharedsolve.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.sharedsolve.component.model.ComponentTask;
import com.sharedsolve.extraction.PriorOutput;
import com.sharedsolve.fingerprint.TaskInput;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ComponentRequest(
        String cid,
        String task,
        @NotEmpty List<@Valid @NotNull InputItem> input,
        @JsonAlias("previous_outputs") List<@Valid @NotNull PreviousOutput> previousOutputs,
        @JsonAlias("use_conversation_history") Boolean useConversationHistory
) {

    public record InputItem(
            @NotNull @JsonAlias("user_query") String query,
            @JsonAlias("notebook") String artifact
    ) {
    }

    public record PreviousOutput(
            String component,
            String task,
            @NotNull OutputBody output
    ) {
    }

    public record OutputBody(
            @JsonAlias("immediate_response") String reply,
            @JsonAlias("notebook") String artifact
    ) {
    }

    public ComponentTask toTask() {
        List<TaskInput> inputs = input == null ? List.of() : input.stream()
                .map(item -> new TaskInput(item.query(), item.artifact()))
                .toList();
        List<PriorOutput> priors = previousOutputs == null ? List.of() : previousOutputs.stream()
                .map(prev -> new PriorOutput(prev.component(), prev.task(), prev.output().reply(), prev.output().artifact()))
                .toList();
        return new ComponentTask(cid, task, inputs, priors, useConversationHistory == null || useConversationHistory);
    }
}
