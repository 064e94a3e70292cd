package com.sharedsolve.component.model;

import com.sharedsolve.extraction.PriorOutput;
import com.sharedsolve.fingerprint.TaskInput;
import org.springframework.lang.Nullable;

import java.util.List;

public record ComponentTask(
        @Nullable String cid,
        String task,
        List<TaskInput> inputs,
        List<PriorOutput> previousOutputs,
        boolean useConversationHistory
) {

    public ComponentTask {
        task = task == null ? "" : task;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        previousOutputs = previousOutputs == null ? List.of() : List.copyOf(previousOutputs);
    }
}
