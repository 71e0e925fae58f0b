package com.eainde.research.checkpoint;

import com.eainde.research.exception.PersistenceException;
import com.eainde.research.state.ResearchState;
import com.eainde.research.state.RunStatus;
import com.eainde.research.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCheckpointSaverTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
    private final InMemoryCheckpointSaver saver = new InMemoryCheckpointSaver(new ObjectMapper(), clock);

    private static RunnableConfig config(String runId) {
        return RunnableConfig.builder().threadId(runId).build();
    }

    private static Checkpoint checkpoint(String id, String nodeId, String nextNodeId, String pointer) {
        Map<String, Object> state = new HashMap<>();
        state.put(ResearchState.RUN_ID, "signal-1");
        state.put(ResearchState.SIGNAL_ID, 1L);
        state.put(ResearchState.STATUS, RunStatus.RUNNING.name());
        state.put(ResearchState.RESEARCH_PATH, pointer == null ? List.of() : List.of(pointer));
        if (pointer != null) {
            state.put(ResearchState.STAGE_POINTER, pointer);
        }
        return Checkpoint.builder().id(id).nodeId(nodeId).nextNodeId(nextNodeId).state(state).build();
    }

    // =========================================================================
    // Graph saver contract
    // =========================================================================

    @Nested
    @DisplayName("saver contract")
    class Contract {

        @Test
        @DisplayName("put appends with the next sequence and returns the checkpoint id")
        void put_appendsInSequence() {
            RunnableConfig first = saver.put(config("signal-1"), checkpoint("cp-0", "__START__", "discovery", null));
            clock.advance(Duration.ofSeconds(5));
            saver.put(config("signal-1"), checkpoint("cp-1", "discovery", "deep_research", "discovery"));

            assertThat(first.checkPointId()).contains("cp-0");
            List<CheckpointEntry> history = saver.history("signal-1");
            assertThat(history).extracting(CheckpointEntry::sequence).containsExactly(0, 1);
            CheckpointEntry latest = saver.latest("signal-1").orElseThrow();
            assertThat(latest.checkpointId()).isEqualTo("cp-1");
            assertThat(latest.nodeId()).isEqualTo("discovery");
            assertThat(latest.nextNodeId()).isEqualTo("deep_research");
            assertThat(latest.stagePointer()).isEqualTo("discovery");
            assertThat(latest.status()).isEqualTo(RunStatus.RUNNING);
            assertThat(latest.createdAt()).isEqualTo(Instant.parse("2026-03-02T09:00:05Z"));
        }

        @Test
        @DisplayName("get returns the latest checkpoint, or the one named in the config")
        void get_latestOrById() {
            saver.put(config("signal-1"), checkpoint("cp-0", "__START__", "discovery", null));
            saver.put(config("signal-1"), checkpoint("cp-1", "discovery", "deep_research", "discovery"));

            assertThat(saver.get(config("signal-1"))).get().extracting(Checkpoint::getId).isEqualTo("cp-1");
            RunnableConfig byId = RunnableConfig.builder(config("signal-1")).checkPointId("cp-0").build();
            assertThat(saver.get(byId)).get().extracting(Checkpoint::getNextNodeId).isEqualTo("discovery");
            RunnableConfig unknown = RunnableConfig.builder(config("signal-1")).checkPointId("cp-9").build();
            assertThat(saver.get(unknown)).isEmpty();
        }

        @Test
        @DisplayName("list returns the newest checkpoint first")
        void list_newestFirst() {
            saver.put(config("signal-1"), checkpoint("cp-0", "__START__", "discovery", null));
            saver.put(config("signal-1"), checkpoint("cp-1", "discovery", "deep_research", "discovery"));
            saver.put(config("signal-2"), checkpoint("cp-x", "__START__", "discovery", null));

            assertThat(saver.list(config("signal-1"))).extracting(Checkpoint::getId).containsExactly("cp-1", "cp-0");
        }

        @Test
        @DisplayName("release drops the run's log and hands it back")
        void release_dropsLog() {
            saver.put(config("signal-1"), checkpoint("cp-0", "__START__", "discovery", null));
            saver.put(config("signal-1"), checkpoint("cp-1", "discovery", "deep_research", "discovery"));

            BaseCheckpointSaver.Tag tag = saver.release(config("signal-1"));

            assertThat(tag.threadId()).isEqualTo("signal-1");
            assertThat(tag.checkpoints()).extracting(Checkpoint::getId).containsExactly("cp-0", "cp-1");
            assertThat(saver.latest("signal-1")).isEmpty();
        }

        @Test
        @DisplayName("config without a run id is rejected")
        void missingRunId() {
            assertThatThrownBy(() -> saver.get(RunnableConfig.builder().build()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // =========================================================================
    // Log integrity
    // =========================================================================

    @Nested
    @DisplayName("log integrity")
    class Integrity {

        @Test
        @DisplayName("unknown run has no checkpoints")
        void unknownRun() {
            assertThat(saver.latest("nope")).isEmpty();
            assertThat(saver.history("nope")).isEmpty();
            assertThat(saver.get(config("nope"))).isEmpty();
        }

        @Test
        @DisplayName("out of order or repeated sequence is rejected")
        void outOfOrder() {
            CheckpointEntry first = new CheckpointEntry("signal-1", 0, "cp-0", "__START__", "discovery",
                    RunStatus.RUNNING, null, Map.of(), Instant.EPOCH);
            saver.append(first);

            assertThatThrownBy(() -> saver.append(first)).isInstanceOf(PersistenceException.class);
            assertThatThrownBy(() -> saver.append(new CheckpointEntry("signal-1", 2, "cp-2", "discovery", null,
                    RunStatus.RUNNING, "discovery", Map.of(), Instant.EPOCH)))
                    .isInstanceOf(PersistenceException.class);
            assertThat(saver.history("signal-1")).hasSize(1);
        }

        @Test
        @DisplayName("stored state cannot be changed through what was read")
        void statesAreDetached() {
            saver.put(config("signal-1"), checkpoint("cp-0", "__START__", "discovery", null));

            Map<String, Object> read = saver.latest("signal-1").orElseThrow().state();
            read.put(ResearchState.STAGE_POINTER, "level4");
            @SuppressWarnings("unchecked")
            List<Object> path = (List<Object>) saver.get(config("signal-1")).orElseThrow()
                    .getState().get(ResearchState.RESEARCH_PATH);
            path.add("discovery");

            CheckpointEntry stored = saver.latest("signal-1").orElseThrow();
            assertThat(stored.state()).doesNotContainKey(ResearchState.STAGE_POINTER);
            assertThat(stored.state().get(ResearchState.RESEARCH_PATH)).isEqualTo(List.of());
        }

        @Test
        @DisplayName("history is an immutable snapshot")
        void historyIsSnapshot() {
            saver.put(config("signal-1"), checkpoint("cp-0", "__START__", "discovery", null));
            List<CheckpointEntry> history = saver.history("signal-1");

            saver.put(config("signal-1"), checkpoint("cp-1", "discovery", "deep_research", "discovery"));

            assertThat(history).hasSize(1);
            assertThatThrownBy(() -> history.add(history.get(0)))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
