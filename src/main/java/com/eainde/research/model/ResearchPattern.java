package com.eainde.research.model;

import java.time.Instant;
import java.util.Map;

/**
 * A named research approach with running feedback statistics.
 */
public record ResearchPattern(
        Long id,
        String name,
        String description,
        double successRate,
        double avgRating,
        int usageCount,
        Instant lastUsed,
        float[] embedding,
        Map<String, Object> metadata
) {
    public ResearchPattern {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ResearchPattern named(String name, String description) {
        return new ResearchPattern(null, name, description, 0.0, 0.0, 0, null, null, Map.of());
    }

    /**
     * Folds one more rating into the counters.
     */
    public ResearchPattern withRating(int starRating, Instant usedAt) {
        int usage = usageCount + 1;
        double avg = (avgRating * usageCount + starRating) / usage;
        double successes = successRate * usageCount + (starRating >= 4 ? 1 : 0);
        return new ResearchPattern(id, name, description, successes / usage, avg, usage, usedAt, embedding, metadata);
    }
}
