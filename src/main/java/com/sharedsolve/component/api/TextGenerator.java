package com.sharedsolve.component.api;

import com.sharedsolve.component.model.GenerationRequest;

/**
 * Opaque text-generation call: prompt, history and options in, raw text out.
 */
public interface TextGenerator {

    /**
     * Generates raw model text for the request.
     *
     * @param request The prompt, system prompt, prior conversation and sampling temperature.
     * @return The raw model output, possibly empty, never {@code null}.
     * @throws GenerationException when the provider call fails.
     */
    String generate(GenerationRequest request);
}
