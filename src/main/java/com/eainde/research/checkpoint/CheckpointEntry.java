package com.eainde.research.checkpoint;

import com.eainde.research.state.RunStatus;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of a run's append-only checkpoint log: the graph checkpoint
 * (id, node, next node, state) plus the columns the API reads without
 * decoding the state.
 */
public record CheckpointEntry(
        String runId,
        int sequence,
        String checkpointId,
        String nodeId,
        String nextNodeId,
        RunStatus status,
        String stagePointer,
        Map<String, Object> state,
        Instant createdAt
) {

    public CheckpointEntry withState(Map<String, Object> state) {
        return new CheckpointEntry(runId, sequence, checkpointId, nodeId, nextNodeId, status, stagePointer,
                state, createdAt);
    }
}
