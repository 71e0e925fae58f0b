package com.eainde.research.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Set;

/**
 * A human rating of one insight, as submitted over REST.
 */
public record FeedbackRequest(
        @JsonProperty("star_rating") Integer starRating,
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("comment") String comment,
        @JsonProperty("invested") Boolean invested,
        @JsonProperty("outcome_return") Double outcomeReturn,
        @JsonProperty("outcome_date") LocalDate outcomeDate
) {
}
