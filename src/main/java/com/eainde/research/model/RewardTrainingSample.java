package com.eainde.research.model;

import java.time.Instant;

public record RewardTrainingSample(
        Long id,
        Instant createdAt,
        Long insightId,
        InsightFeatures features,
        int humanRating,
        boolean usedInTraining
) {
    public static RewardTrainingSample pending(Long insightId, InsightFeatures features, int humanRating) {
        return new RewardTrainingSample(null, Instant.now(), insightId, features, humanRating, false);
    }
}
