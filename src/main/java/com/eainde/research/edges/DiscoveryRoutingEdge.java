package com.eainde.research.edges;

import com.eainde.research.gate.QualityGate;
import com.eainde.research.state.ResearchState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Routes after discovery: {@code continue} into deep research, {@code stop},
 * or {@code failed} when the discovery stage itself failed.
 */
@Component
public class DiscoveryRoutingEdge implements AsyncEdgeAction<ResearchState> {

    private final QualityGate qualityGate;

    public DiscoveryRoutingEdge(QualityGate qualityGate) {
        this.qualityGate = qualityGate;
    }

    @Override
    public CompletableFuture<String> apply(ResearchState state) {
        // Must return a CompletableFuture for AsyncEdgeAction
        if (FailureRoutingEdge.FAILED.equals(FailureRoutingEdge.route(state))) {
            return CompletableFuture.completedFuture(FailureRoutingEdge.FAILED);
        }
        return CompletableFuture.completedFuture(qualityGate.discoveryRoute(state));
    }
}
