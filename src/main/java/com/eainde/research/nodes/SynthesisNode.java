package com.eainde.research.nodes;

import com.eainde.research.execution.StageExecutor;
import com.eainde.research.stage.StageName;
import com.eainde.research.state.ResearchState;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Condenses everything gathered so far into the final insight proposal.
 */
@Component
public class SynthesisNode extends StageNode {

    private static final List<String> CONTEXT_KEYS = List.of(
            ResearchState.INITIAL_ASSESSMENT,
            ResearchState.LEVEL4_SYNTHESIS,
            ResearchState.INDUSTRY_CONTEXT,
            ResearchState.PEER_COMPARISON,
            ResearchState.MACRO_FACTORS,
            ResearchState.VALIDATION_NOTES,
            ResearchState.VERIFIED);

    public SynthesisNode(StageExecutor stageExecutor) {
        super(StageName.SYNTHESIS, stageExecutor);
    }

    @Override
    protected Map<String, Object> buildInput(ResearchState state) {
        Map<String, Object> input = new HashMap<>();
        input.put(ResearchState.SIGNAL, state.getSignal());
        CONTEXT_KEYS.forEach(key -> putIfPresent(input, state, key));
        return input;
    }
}
