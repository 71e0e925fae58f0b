package com.eainde.research.workflow;

import com.eainde.research.state.ResearchState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.action.AsyncNodeActionWithConfig;
import org.bsc.langgraph4j.action.InterruptableAction;
import org.bsc.langgraph4j.action.InterruptionMetadata;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A pipeline node behind the run's halt check. The graph asks
 * {@link #interrupt} before the node starts, so a cancelled or out-of-budget
 * run stops right after the checkpoint of the previous node.
 */
@Log4j2
public final class GuardedNode implements AsyncNodeActionWithConfig<ResearchState>, InterruptableAction<ResearchState> {

    private final String nodeId;
    private final AsyncNodeAction<ResearchState> delegate;
    private final RunGuards runGuards;

    public GuardedNode(String nodeId, AsyncNodeAction<ResearchState> delegate, RunGuards runGuards) {
        this.nodeId = nodeId;
        this.delegate = delegate;
        this.runGuards = runGuards;
    }

    AsyncNodeAction<ResearchState> delegate() {
        return delegate;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state, RunnableConfig config) {
        MDC.put("stage", nodeId);
        try {
            log.info("Run {} executing {}", state.getRunId(), nodeId);
            return delegate.apply(state);
        } finally {
            MDC.remove("stage");
        }
    }

    @Override
    public Optional<InterruptionMetadata<ResearchState>> interrupt(String nodeId, ResearchState state) {
        return runGuards.check(state.getRunId()).map(halt -> {
            log.info("Run {} halted before {}: {}", state.getRunId(), nodeId, halt);
            return InterruptionMetadata.builder(nodeId, state).build();
        });
    }
}
