package com.eainde.research.nodes;

import com.eainde.research.execution.StageExecutor;
import com.eainde.research.stage.StageName;
import com.eainde.research.state.ResearchState;

import java.util.Map;
import java.util.function.Function;

/**
 * One deep-research level. Levels differ only in the context they are given,
 * supplied by {@link ResearchInputs}. Levels 1-3 run as fan-out members.
 */
public class ResearchLevelNode extends StageNode {

    private final Function<ResearchState, Map<String, Object>> inputs;

    public ResearchLevelNode(StageName level, StageExecutor stageExecutor,
                             Function<ResearchState, Map<String, Object>> inputs) {
        this(level, stageExecutor, inputs, false);
    }

    public ResearchLevelNode(StageName level, StageExecutor stageExecutor,
                             Function<ResearchState, Map<String, Object>> inputs, boolean fanOutMember) {
        super(level, stageExecutor, fanOutMember);
        this.inputs = inputs;
    }

    @Override
    protected Map<String, Object> buildInput(ResearchState state) {
        return inputs.apply(state);
    }
}
