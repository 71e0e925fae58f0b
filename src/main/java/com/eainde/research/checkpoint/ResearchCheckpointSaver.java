package com.eainde.research.checkpoint;

import com.eainde.research.exception.PersistenceException;
import com.eainde.research.state.ResearchState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checkpoint saver of the research graph. The graph thread id is the run id,
 * and every {@link #put} appends a new entry to the run's log with the next
 * sequence number, so the log is never rewritten.
 * <p>
 * States are copied through their JSON form on the way in and on the way out:
 * what is read back is exactly what a database would return, and callers can
 * never mutate the log.
 * </p>
 */
public abstract class ResearchCheckpointSaver implements BaseCheckpointSaver {

    private static final TypeReference<Map<String, Object>> STATE = new TypeReference<>() {
    };

    protected final ObjectMapper objectMapper;
    protected final Clock clock;

    protected ResearchCheckpointSaver(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws PersistenceException when the entry cannot be written, including
     *         a duplicate sequence for the run
     */
    protected abstract void append(CheckpointEntry entry);

    /**
     * Deletes the run's log and returns what it held, oldest first.
     */
    protected abstract List<CheckpointEntry> remove(String runId);

    public abstract Optional<CheckpointEntry> latest(String runId);

    /**
     * All entries of the run, oldest first.
     */
    public abstract List<CheckpointEntry> history(String runId);

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        List<CheckpointEntry> entries = new ArrayList<>(history(runId(config)));
        Collections.reverse(entries);
        return entries.stream().map(this::toCheckpoint).toList();
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        String runId = runId(config);
        Optional<String> checkpointId = config.checkPointId();
        if (checkpointId.isEmpty()) {
            return latest(runId).map(this::toCheckpoint);
        }
        List<CheckpointEntry> entries = history(runId);
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (checkpointId.get().equals(entries.get(i).checkpointId())) {
                return Optional.of(toCheckpoint(entries.get(i)));
            }
        }
        return Optional.empty();
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) {
        String runId = runId(config);
        Map<String, Object> state = copy(checkpoint.getState());
        ResearchState researchState = new ResearchState(state);
        int sequence = latest(runId).map(entry -> entry.sequence() + 1).orElse(0);

        append(new CheckpointEntry(
                runId,
                sequence,
                checkpoint.getId(),
                checkpoint.getNodeId(),
                checkpoint.getNextNodeId(),
                researchState.getStatus(),
                researchState.getStagePointer().orElse(null),
                state,
                clock.instant()));

        return RunnableConfig.builder(config)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) {
        String runId = runId(config);
        List<Checkpoint> released = remove(runId).stream().map(this::toCheckpoint).toList();
        return new Tag(runId, released);
    }

    protected Checkpoint toCheckpoint(CheckpointEntry entry) {
        return Checkpoint.builder()
                .id(entry.checkpointId())
                .nodeId(entry.nodeId())
                .nextNodeId(entry.nextNodeId())
                .state(copy(entry.state()))
                .build();
    }

    protected Map<String, Object> copy(Map<String, Object> state) {
        return deserialize(serialize(state));
    }

    protected String serialize(Map<String, Object> state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize research state", e);
        }
    }

    protected Map<String, Object> deserialize(String json) {
        try {
            return objectMapper.readValue(json, STATE);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize research state", e);
        }
    }

    private static String runId(RunnableConfig config) {
        return config.threadId().orElseThrow(() -> new IllegalArgumentException("Run ID is required"));
    }
}
