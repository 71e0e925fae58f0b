package com.eainde.research.nodes;

import com.eainde.research.execution.StageExecutor;
import com.eainde.research.stage.StageName;
import com.eainde.research.state.ResearchState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Cheap first pass: is this signal worth deep research at all?
 */
@Component
public class DiscoveryNode extends StageNode {

    public DiscoveryNode(StageExecutor stageExecutor) {
        super(StageName.DISCOVERY, stageExecutor);
    }

    @Override
    protected Map<String, Object> buildInput(ResearchState state) {
        return Map.of(ResearchState.SIGNAL, state.getSignal());
    }
}
