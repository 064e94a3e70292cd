package com.sharedsolve.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Gives "no update" its carry-forward meaning: a result that left the artifact untouched
 * inherits the first real artifact found among the prior outputs, in chain order.
 */
@Component
@Slf4j
public class ArtifactResolver {

    public ComponentResult resolve(String label, ComponentResult result, @Nullable List<PriorOutput> priorOutputs) {
        if (!result.isNoUpdate() || priorOutputs == null || priorOutputs.isEmpty()) {
            return result;
        }
        for (PriorOutput prior : priorOutputs) {
            if (prior != null && prior.hasArtifact()) {
                log.info("[{}] Resolved 'no update' to prior artifact from [{}]", label, prior.sourceName());
                return result.withArtifact(prior.artifact());
            }
        }
        log.info("[{}] No prior artifact found to resolve - keeping 'no update'", label);
        return result;
    }
}
