package com.eainde.research.model;

import lombok.Builder;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;

@Builder
public record Feedback(
        Long id,
        Long insightId,
        Instant createdAt,
        int starRating,
        Set<String> tags,
        String comment,
        boolean invested,
        Double outcomeReturn,
        LocalDate outcomeDate
) {
    public Feedback {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    /**
     * A rating of four or five stars counts as a success for pattern statistics
     * and as the positive class for reward training.
     */
    public boolean isPositive() {
        return starRating >= 4;
    }
}
