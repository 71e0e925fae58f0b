package com.eainde.research.stage;

import com.eainde.research.state.ResearchState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ValidationOutput(
        @JsonProperty("verified") Boolean verified,
        @JsonProperty("notes") String notes
) implements StageOutput {

    @Override
    public void validate() {
        StageOutput.require(verified != null, "verified is required");
        StageOutput.require(notes != null, "notes is required");
    }

    @Override
    public Map<String, Object> toStateUpdate(StageName stage) {
        return Map.of(
                ResearchState.VERIFIED, verified,
                ResearchState.VALIDATION_NOTES, notes);
    }
}
