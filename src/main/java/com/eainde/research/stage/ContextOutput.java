package com.eainde.research.stage;

import com.eainde.research.state.ResearchState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ContextOutput(
        @JsonProperty("industry_context") String industryContext,
        @JsonProperty("peer_comparison") String peerComparison,
        @JsonProperty("macro_factors") String macroFactors
) implements StageOutput {

    @Override
    public void validate() {
        StageOutput.require(industryContext != null && !industryContext.isBlank(), "industry_context is required");
        StageOutput.require(peerComparison != null && !peerComparison.isBlank(), "peer_comparison is required");
    }

    @Override
    public Map<String, Object> toStateUpdate(StageName stage) {
        return Map.of(
                ResearchState.INDUSTRY_CONTEXT, industryContext,
                ResearchState.PEER_COMPARISON, peerComparison,
                ResearchState.MACRO_FACTORS, macroFactors == null ? "" : macroFactors);
    }
}
