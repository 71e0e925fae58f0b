package com.eainde.research.nodes;

import com.eainde.research.execution.StageExecutor;
import com.eainde.research.stage.StageName;
import com.eainde.research.state.ResearchState;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Industry, peer and macro context around the researched company.
 */
@Component
public class ContextNode extends StageNode {

    public ContextNode(StageExecutor stageExecutor) {
        super(StageName.CONTEXT, stageExecutor);
    }

    @Override
    protected Map<String, Object> buildInput(ResearchState state) {
        Map<String, Object> input = new HashMap<>();
        input.put(ResearchState.SIGNAL, state.getSignal());
        putIfPresent(input, state, ResearchState.LEVEL1_CONTEXT);
        putIfPresent(input, state, ResearchState.LEVEL3_FUNDAMENTALS);
        return input;
    }
}
