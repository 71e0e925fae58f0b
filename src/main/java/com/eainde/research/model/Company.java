package com.eainde.research.model;

import java.time.Instant;
import java.util.Map;

public record Company(
        String symbol,
        String name,
        String sector,
        String industry,
        Double marketCap,
        Instant lastUpdated,
        Map<String, Object> fundamentals,
        float[] embedding
) {
    public Company {
        fundamentals = fundamentals == null ? Map.of() : Map.copyOf(fundamentals);
    }

    public String embeddingText() {
        return String.join(" ",
                name == null ? symbol : name,
                sector == null ? "" : sector,
                industry == null ? "" : industry).trim();
    }
}
