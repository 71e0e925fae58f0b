package com.eainde.research.stage;

import com.eainde.research.model.Evidence;
import com.eainde.research.state.ResearchState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The final insight as proposed by the synthesis stage, before the persistence gate.
 */
public record SynthesisOutput(
        @JsonProperty("headline") String headline,
        @JsonProperty("analysis") String analysis,
        @JsonProperty("evidence") List<Evidence> evidence,
        @JsonProperty("interestingness_score") Double interestingnessScore,
        @JsonProperty("metadata") Map<String, Object> metadata
) implements StageOutput {

    public SynthesisOutput {
        metadata = metadata == null ? Map.of() : metadata;
    }

    @Override
    public void validate() {
        StageOutput.require(headline != null && !headline.isBlank(), "headline is required");
        StageOutput.require(analysis != null && !analysis.isBlank(), "analysis is required");
        StageOutput.require(evidence != null, "evidence is required");
        for (Evidence e : evidence) {
            StageOutput.require(e != null && e.fact() != null && !e.fact().isBlank(), "evidence fact is required");
        }
        StageOutput.requireScore(interestingnessScore, "interestingness_score");
    }

    @Override
    public Map<String, Object> toStateUpdate(StageName stage) {
        return Map.of(ResearchState.FINAL_INSIGHT, toMap());
    }

    /**
     * JSON-native form kept in the research state.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("headline", headline);
        map.put("analysis", analysis);
        map.put("evidence", evidence.stream().map(SynthesisOutput::evidenceMap).toList());
        map.put("interestingness_score", interestingnessScore);
        map.put("metadata", metadata);
        return map;
    }

    private static Map<String, Object> evidenceMap(Evidence e) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("fact", e.fact());
        if (e.source() != null) {
            map.put("source", e.source());
        }
        return map;
    }
}
