package com.eainde.research.nodes;

import com.eainde.research.execution.FailureKind;
import com.eainde.research.execution.StageError;
import com.eainde.research.execution.StageExecutor;
import com.eainde.research.execution.StageRequest;
import com.eainde.research.execution.StageResult;
import com.eainde.research.stage.StageName;
import com.eainde.research.state.ResearchState;
import com.eainde.research.state.RunStatus;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A graph node backed by one stage call. Builds the stage input from the
 * state, runs it through the {@link StageExecutor} and returns the state
 * update.
 * <p>
 * A stage failure is returned as data: the update carries the
 * {@link StageError} under {@code failure} and the routing edges take the
 * run to its end. Only the slots listed in {@link StageName#writes()} are
 * kept from a stage output.
 * </p>
 * A fan-out member neither extends the research path nor marks the run
 * failed; the join does both once every member is back.
 */
@Log4j2
public abstract class StageNode implements AsyncNodeAction<ResearchState> {

    protected final StageName stage;
    protected final StageExecutor stageExecutor;
    private final boolean fanOutMember;

    protected StageNode(StageName stage, StageExecutor stageExecutor) {
        this(stage, stageExecutor, false);
    }

    protected StageNode(StageName stage, StageExecutor stageExecutor, boolean fanOutMember) {
        this.stage = stage;
        this.stageExecutor = stageExecutor;
        this.fanOutMember = fanOutMember;
    }

    public StageName stage() {
        return stage;
    }

    public boolean isFanOutMember() {
        return fanOutMember;
    }

    protected abstract Map<String, Object> buildInput(ResearchState state);

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state) {
        StageResult result;
        try {
            result = stageExecutor.execute(new StageRequest(stage, buildInput(state)));
        } catch (RuntimeException e) {
            log.error("Stage {} could not be executed", stage.key(), e);
            return CompletableFuture.completedFuture(failed(new StageError(stage.key(), FailureKind.PERMANENT,
                    e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage()), 0)));
        }
        if (!result.isSuccess()) {
            return CompletableFuture.completedFuture(failed(result.error()));
        }

        Map<String, Object> update = new HashMap<>();
        result.output().toStateUpdate(stage).forEach((key, value) -> {
            if (value != null && stage.writes().contains(key)) {
                update.put(key, value);
            }
        });
        if (!fanOutMember) {
            update.put(ResearchState.RESEARCH_PATH, stage.key());
            update.put(ResearchState.STAGE_POINTER, stage.key());
        }
        return CompletableFuture.completedFuture(update);
    }

    private Map<String, Object> failed(StageError error) {
        Map<String, Object> update = new HashMap<>();
        update.put(ResearchState.FAILURE, error.toMap());
        if (!fanOutMember) {
            update.put(ResearchState.STATUS, RunStatus.FAILED.name());
        }
        return update;
    }

    protected static void putIfPresent(Map<String, Object> input, ResearchState state, String key) {
        state.value(key).ifPresent(value -> input.put(key, value));
    }
}
