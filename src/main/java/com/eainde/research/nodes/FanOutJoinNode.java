package com.eainde.research.nodes;

import com.eainde.research.execution.FailureKind;
import com.eainde.research.execution.StageError;
import com.eainde.research.stage.StageName;
import com.eainde.research.state.ResearchState;
import com.eainde.research.state.RunStatus;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Closes a fan-out. The members that finished are appended to the research
 * path in declared order.
 * <p>
 * When a member failed, only the members declared before it are kept: the
 * outputs of the failed member and of every later one are removed, and the
 * run is marked failed. Pruning, path and status land in one update, so they
 * are written by a single checkpoint.
 * </p>
 */
@Log4j2
public class FanOutJoinNode implements AsyncNodeAction<ResearchState> {

    private final List<StageName> members;

    public FanOutJoinNode(List<StageName> members) {
        this.members = List.copyOf(members);
    }

    public List<StageName> members() {
        return members;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state) {
        String failedStage = state.getFailure().map(failure -> String.valueOf(failure.get("stage"))).orElse(null);

        Map<String, Object> update = new HashMap<>();
        List<String> kept = new ArrayList<>();
        boolean cut = false;
        for (StageName member : members) {
            if (!cut && member.key().equals(failedStage)) {
                cut = true;
            } else if (!cut && !producedOutput(member, state)) {
                update.put(ResearchState.FAILURE, new StageError(member.key(), FailureKind.PERMANENT,
                        "Fan-out member returned no output", 0).toMap());
                cut = true;
            }
            if (cut) {
                member.writes().forEach(key -> update.put(key, AgentState.MARK_FOR_REMOVAL));
            } else {
                kept.add(member.key());
            }
        }

        if (!kept.isEmpty()) {
            update.put(ResearchState.RESEARCH_PATH, kept);
            update.put(ResearchState.STAGE_POINTER, kept.get(kept.size() - 1));
        }
        if (cut) {
            update.put(ResearchState.STATUS, RunStatus.FAILED.name());
            log.warn("Run {} fan-out failed, keeping {}", state.getRunId(), kept);
        } else {
            log.info("Run {} fan-out joined {}", state.getRunId(), kept);
        }
        return CompletableFuture.completedFuture(update);
    }

    private static boolean producedOutput(StageName member, ResearchState state) {
        return member.writes().stream().allMatch(key -> state.value(key).isPresent());
    }
}
