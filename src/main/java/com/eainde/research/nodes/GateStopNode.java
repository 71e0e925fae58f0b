package com.eainde.research.nodes;

import com.eainde.research.state.ResearchState;
import com.eainde.research.state.RunStatus;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Where the discovery gate sends signals not worth deep research.
 */
@Log4j2
@Component
public class GateStopNode implements AsyncNodeAction<ResearchState> {

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state) {
        log.info("Run {} stopped by gate after {}", state.getRunId(), state.getResearchPath());
        return CompletableFuture.completedFuture(Map.of(ResearchState.STATUS, RunStatus.STOPPED_BY_GATE.name()));
    }
}
