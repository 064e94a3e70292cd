package com.sharedsolve.api;

import com.sharedsolve.component.model.ComponentType;
import com.sharedsolve.coordination.ResultSource;
import com.sharedsolve.coordination.RoutedResult;

public record ComponentResponse(
        String cid,
        String task,
        String component,
        Output output,
        ResultSource source,
        long waitedMs
) {

    public record Output(String reply, String artifact) {
    }

    public static ComponentResponse from(ComponentRequest request, ComponentType type, RoutedResult routed) {
        return new ComponentResponse(request.cid(), request.task(), type.key(),
                new Output(routed.result().reply(), routed.result().artifact()),
                routed.source(), routed.waited().toMillis());
    }
}
