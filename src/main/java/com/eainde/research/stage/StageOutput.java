package com.eainde.research.stage;

import java.util.Map;

/**
 * Typed result of one stage call. Every output knows how to validate itself
 * and which state slots it writes.
 */
public sealed interface StageOutput
        permits DiscoveryOutput, ResearchFindings, ContextOutput, ValidationOutput, SynthesisOutput {

    /**
     * @throws IllegalArgumentException when a required field is missing or out of range
     */
    void validate();

    Map<String, Object> toStateUpdate(StageName stage);

    static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    static void requireScore(Double score, String field) {
        require(score != null, field + " is required");
        require(score >= 0.0 && score <= 10.0, field + " must be within 0-10, was " + score);
    }
}
