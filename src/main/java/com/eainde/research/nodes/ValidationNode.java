package com.eainde.research.nodes;

import com.eainde.research.execution.StageExecutor;
import com.eainde.research.stage.StageName;
import com.eainde.research.state.ResearchState;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
public class ValidationNode extends StageNode {

    public ValidationNode(StageExecutor stageExecutor) {
        super(StageName.VALIDATION, stageExecutor);
    }

    @Override
    protected Map<String, Object> buildInput(ResearchState state) {
        Map<String, Object> input = new HashMap<>();
        input.put(ResearchState.SIGNAL, state.getSignal());
        putIfPresent(input, state, ResearchState.LEVEL4_SYNTHESIS);
        putIfPresent(input, state, ResearchState.INITIAL_ASSESSMENT);
        putIfPresent(input, state, ResearchState.INDUSTRY_CONTEXT);
        return input;
    }
}
