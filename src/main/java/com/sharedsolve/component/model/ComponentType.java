package com.sharedsolve.component.model;

import java.util.Locale;

public enum ComponentType {
    COMPLETE("complete", 0.7, true, false),
    REFINE("refine", 0.7, true, false),
    FEEDBACK("feedback", 0.7, false, false),
    SUMMARY("summary", 0.5, true, true),
    AGGREGATE("aggregate", 0.3, true, true);

    private final String key;
    private final double temperature;
    private final boolean structuredOutput;
    private final boolean requiresPreviousOutputs;

    ComponentType(String key, double temperature, boolean structuredOutput, boolean requiresPreviousOutputs) {
        this.key = key;
        this.temperature = temperature;
        this.structuredOutput = structuredOutput;
        this.requiresPreviousOutputs = requiresPreviousOutputs;
    }

    public String key() {
        return key;
    }

    public double temperature() {
        return temperature;
    }

    /**
     * Whether the generator is asked for a {@code {reply, artifact}} object. Other components
     * answer in prose and never touch the artifact.
     */
    public boolean structuredOutput() {
        return structuredOutput;
    }

    public boolean requiresPreviousOutputs() {
        return requiresPreviousOutputs;
    }

    public static ComponentType fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (ComponentType type : values()) {
                if (type.key.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown component: " + key);
    }
}
