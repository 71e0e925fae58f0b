package com.eainde.research.controller;

import com.eainde.research.model.Evidence;
import com.eainde.research.model.Insight;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Insight as returned over REST; the embedding stays server-side.
 */
public record InsightView(
        @JsonProperty("id") Long id,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("signal_id") Long signalId,
        @JsonProperty("signal_type") String signalType,
        @JsonProperty("subject") String subject,
        @JsonProperty("company_name") String companyName,
        @JsonProperty("headline") String headline,
        @JsonProperty("analysis") String analysis,
        @JsonProperty("evidence") List<Evidence> evidence,
        @JsonProperty("interestingness_score") double interestingnessScore,
        @JsonProperty("shown_to_user") boolean shownToUser,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static InsightView of(Insight insight) {
        return new InsightView(insight.id(), insight.createdAt(), insight.signalId(), insight.signalType(),
                insight.subject(), insight.companyName(), insight.headline(), insight.analysis(),
                insight.evidence(), insight.interestingnessScore(), insight.shownToUser(), insight.metadata());
    }
}
