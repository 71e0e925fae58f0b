package com.eainde.research.stage;

import com.eainde.research.state.ResearchState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Free-text findings of one deep-research level.
 */
public record ResearchFindings(@JsonProperty("findings") String findings) implements StageOutput {

    @Override
    public void validate() {
        StageOutput.require(findings != null && !findings.isBlank(), "findings is required");
    }

    @Override
    public Map<String, Object> toStateUpdate(StageName stage) {
        return Map.of(slotFor(stage), findings);
    }

    static String slotFor(StageName stage) {
        switch (stage) {
            case LEVEL1:
                return ResearchState.LEVEL1_CONTEXT;
            case LEVEL2:
                return ResearchState.LEVEL2_HISTORICAL;
            case LEVEL3:
                return ResearchState.LEVEL3_FUNDAMENTALS;
            case LEVEL4:
                return ResearchState.LEVEL4_SYNTHESIS;
            default:
                throw new IllegalArgumentException("Stage " + stage.key() + " does not produce research findings");
        }
    }
}
