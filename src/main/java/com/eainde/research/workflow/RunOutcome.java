package com.eainde.research.workflow;

import com.eainde.research.execution.StageError;
import com.eainde.research.state.ResearchState;
import com.eainde.research.state.RunStatus;

import java.util.List;

public record RunOutcome(
        String runId,
        long signalId,
        RunStatus status,
        List<String> researchPath,
        Long insightId,
        StageError failure,
        ResearchState state
) {
}
