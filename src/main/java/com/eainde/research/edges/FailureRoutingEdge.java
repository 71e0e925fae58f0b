package com.eainde.research.edges;

import com.eainde.research.state.ResearchState;
import com.eainde.research.state.RunStatus;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Routes after a stage: {@code failed} once the run is marked failed,
 * otherwise {@code continue}.
 */
@Component
public class FailureRoutingEdge implements AsyncEdgeAction<ResearchState> {

    public static final String CONTINUE = "continue";
    public static final String FAILED = "failed";

    @Override
    public CompletableFuture<String> apply(ResearchState state) {
        return CompletableFuture.completedFuture(route(state));
    }

    static String route(ResearchState state) {
        return state.getStatus() == RunStatus.FAILED ? FAILED : CONTINUE;
    }
}
