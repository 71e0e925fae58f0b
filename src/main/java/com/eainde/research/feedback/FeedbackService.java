package com.eainde.research.feedback;

import com.eainde.research.exception.EntityNotFoundException;
import com.eainde.research.memory.MemoryStore;
import com.eainde.research.model.Feedback;
import com.eainde.research.model.Insight;
import com.eainde.research.model.ResearchPattern;
import com.eainde.research.model.RewardTrainingSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Writes human ratings back into memory: the feedback row itself, a reward
 * training sample for the gate, and updated counters of every research
 * pattern the insight was built with.
 */
@Log4j2
@Service
@RequiredArgsConstructor
public class FeedbackService {

    private final MemoryStore memoryStore;
    private final Clock clock;

    @Transactional
    public Feedback record(long insightId, FeedbackRequest request) {
        validate(request);
        Insight insight = memoryStore.findInsight(insightId)
                .orElseThrow(() -> new EntityNotFoundException("Insight", insightId));

        Instant now = clock.instant();
        Feedback stored = memoryStore.insertFeedback(Feedback.builder()
                .insightId(insightId)
                .createdAt(now)
                .starRating(request.starRating())
                .tags(request.tags())
                .comment(request.comment())
                .invested(Boolean.TRUE.equals(request.invested()))
                .outcomeReturn(request.outcomeReturn())
                .outcomeDate(request.outcomeDate())
                .build());

        memoryStore.insertRewardSample(
                RewardTrainingSample.pending(insightId, insight.features(), request.starRating()));

        List<String> patterns = insight.researchPatterns();
        for (String name : patterns) {
            ResearchPattern current = memoryStore.findPattern(name)
                    .orElseGet(() -> ResearchPattern.named(name, null));
            memoryStore.savePattern(current.withRating(request.starRating(), now));
        }

        log.info("Feedback {} stored for insight {} rating={} patterns={}",
                stored.id(), insightId, stored.starRating(), patterns);
        return stored;
    }

    private static void validate(FeedbackRequest request) {
        if (request == null || request.starRating() == null) {
            throw new IllegalArgumentException("star_rating is required");
        }
        if (request.starRating() < 1 || request.starRating() > 5) {
            throw new IllegalArgumentException("star_rating must be between 1 and 5, was " + request.starRating());
        }
    }
}
