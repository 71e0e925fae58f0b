package com.eainde.research.checkpoint;

import com.eainde.research.exception.PersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoint log kept on the heap. Lost on restart; meant for local runs and tests.
 */
@Component
@ConditionalOnProperty(name = "research.pipeline.checkpoint-store", havingValue = "memory")
public class InMemoryCheckpointSaver extends ResearchCheckpointSaver {

    // each run maps to an immutable list that is replaced on append
    private final Map<String, List<CheckpointEntry>> storage = new ConcurrentHashMap<>();

    public InMemoryCheckpointSaver(ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
    }

    @Override
    protected void append(CheckpointEntry entry) {
        storage.compute(entry.runId(), (runId, entries) -> {
            int expected = entries == null || entries.isEmpty() ? 0 : entries.get(entries.size() - 1).sequence() + 1;
            if (entry.sequence() != expected) {
                throw new PersistenceException("Checkpoint sequence " + entry.sequence()
                        + " out of order for run " + runId + ", expected " + expected);
            }
            List<CheckpointEntry> next = entries == null ? new ArrayList<>() : new ArrayList<>(entries);
            next.add(entry);
            return List.copyOf(next);
        });
    }

    @Override
    protected List<CheckpointEntry> remove(String runId) {
        List<CheckpointEntry> removed = storage.remove(runId);
        return removed == null ? List.of() : removed;
    }

    @Override
    public Optional<CheckpointEntry> latest(String runId) {
        List<CheckpointEntry> entries = storage.getOrDefault(runId, List.of());
        return entries.isEmpty()
                ? Optional.empty()
                : Optional.of(detached(entries.get(entries.size() - 1)));
    }

    @Override
    public List<CheckpointEntry> history(String runId) {
        return storage.getOrDefault(runId, List.of()).stream().map(this::detached).toList();
    }

    private CheckpointEntry detached(CheckpointEntry entry) {
        return entry.withState(copy(entry.state()));
    }
}
