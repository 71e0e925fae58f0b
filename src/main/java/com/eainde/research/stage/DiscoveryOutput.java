package com.eainde.research.stage;

import com.eainde.research.state.ResearchState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record DiscoveryOutput(
        @JsonProperty("interesting") Boolean interesting,
        @JsonProperty("reason") String reason,
        @JsonProperty("initial_score") Double initialScore
) implements StageOutput {

    @Override
    public void validate() {
        StageOutput.require(interesting != null, "interesting is required");
        StageOutput.require(reason != null && !reason.isBlank(), "reason is required");
        StageOutput.requireScore(initialScore, "initial_score");
    }

    @Override
    public Map<String, Object> toStateUpdate(StageName stage) {
        return Map.of(
                ResearchState.IS_INTERESTING, interesting,
                ResearchState.INITIAL_ASSESSMENT, reason,
                ResearchState.INITIAL_SCORE, initialScore);
    }
}
