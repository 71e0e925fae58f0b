package com.eainde.research.stage;

import com.eainde.research.state.ResearchState;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * The stages of a research run, in declared order.
 */
public enum StageName {

    DISCOVERY("discovery", DiscoveryOutput.class, List.of("signal"),
            List.of(ResearchState.IS_INTERESTING, ResearchState.INITIAL_ASSESSMENT, ResearchState.INITIAL_SCORE)),
    LEVEL1("level1", ResearchFindings.class, List.of("signal"),
            List.of(ResearchState.LEVEL1_CONTEXT)),
    LEVEL2("level2", ResearchFindings.class, List.of("signal", "prior_insights"),
            List.of(ResearchState.LEVEL2_HISTORICAL)),
    LEVEL3("level3", ResearchFindings.class, List.of("signal"),
            List.of(ResearchState.LEVEL3_FUNDAMENTALS)),
    LEVEL4("level4", ResearchFindings.class,
            List.of("signal", "level1_context", "level2_historical", "level3_fundamentals"),
            List.of(ResearchState.LEVEL4_SYNTHESIS)),
    CONTEXT("context", ContextOutput.class, List.of("signal", "level1_context"),
            List.of(ResearchState.INDUSTRY_CONTEXT, ResearchState.PEER_COMPARISON, ResearchState.MACRO_FACTORS)),
    VALIDATION("validation", ValidationOutput.class, List.of("signal", "level4_synthesis"),
            List.of(ResearchState.VERIFIED, ResearchState.VALIDATION_NOTES)),
    SYNTHESIS("synthesis", SynthesisOutput.class,
            List.of("signal", "initial_assessment", "level4_synthesis", "validation_notes"),
            List.of(ResearchState.FINAL_INSIGHT));

    private final String key;
    private final Class<? extends StageOutput> outputType;
    private final List<String> requiredInputs;
    private final List<String> writes;

    StageName(String key, Class<? extends StageOutput> outputType, List<String> requiredInputs, List<String> writes) {
        this.key = key;
        this.outputType = outputType;
        this.requiredInputs = requiredInputs;
        this.writes = writes;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public Class<? extends StageOutput> outputType() {
        return outputType;
    }

    public List<String> requiredInputs() {
        return requiredInputs;
    }

    /**
     * State slots the stage owns. A stage update never touches any other key.
     */
    public List<String> writes() {
        return writes;
    }

    public static StageName fromKey(String key) {
        return Arrays.stream(values())
                .filter(s -> s.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + key));
    }
}
