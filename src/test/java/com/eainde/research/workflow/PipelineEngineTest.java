package com.eainde.research.workflow;

import com.eainde.research.checkpoint.CheckpointEntry;
import com.eainde.research.checkpoint.InMemoryCheckpointSaver;
import com.eainde.research.exception.EntityNotFoundException;
import com.eainde.research.exception.PermanentStageException;
import com.eainde.research.exception.PersistenceException;
import com.eainde.research.exception.TransientStageException;
import com.eainde.research.execution.FailureKind;
import com.eainde.research.gate.RewardModel;
import com.eainde.research.model.Insight;
import com.eainde.research.model.InsightFeatures;
import com.eainde.research.model.Signal;
import com.eainde.research.stage.StageName;
import com.eainde.research.state.ResearchState;
import com.eainde.research.state.RunStatus;
import com.eainde.research.support.PipelineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

class PipelineEngineTest {

    private static final List<String> FULL_PATH = List.of(
            "discovery", "level1", "level2", "level3", "level4", "context", "validation", "synthesis");

    private PipelineFixture fixture;
    private PipelineEngine engine;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        engine = fixture.engine;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    // =========================================================================
    // Discovery gate
    // =========================================================================

    @Nested
    @DisplayName("discovery gate")
    class DiscoveryGate {

        @Test
        @DisplayName("uninteresting signal stops after discovery without deep research")
        void uninterestingSignal_stopsAfterDiscovery() {
            fixture.stages.on(StageName.DISCOVERY, r ->
                    "{\"interesting\": false, \"reason\": \"Routine filing\", \"initial_score\": 2.0}");
            Signal signal = fixture.newSignal("insider_buy", "ACME");

            RunOutcome outcome = engine.run(signal);

            assertThat(outcome.status()).isEqualTo(RunStatus.STOPPED_BY_GATE);
            assertThat(outcome.researchPath()).containsExactly("discovery");
            assertThat(outcome.insightId()).isNull();
            assertThat(fixture.stages.calls(StageName.LEVEL1)).isZero();
            assertThat(fixture.stages.calls(StageName.SYNTHESIS)).isZero();
            assertThat(fixture.insightCount()).isZero();
            assertThat(fixture.memoryStore.findSignal(signal.id()).orElseThrow().processed()).isTrue();
        }

        @Test
        @DisplayName("malformed discovery output fails the run permanently after one attempt")
        void malformedDiscovery_failsPermanently() {
            fixture.stages.on(StageName.DISCOVERY, r -> "I think this is interesting!");
            Signal signal = fixture.newSignal("insider_buy", "ACME");

            RunOutcome outcome = engine.run(signal);

            assertThat(outcome.status()).isEqualTo(RunStatus.FAILED);
            assertThat(outcome.researchPath()).isEmpty();
            assertThat(outcome.failure().stage()).isEqualTo("discovery");
            assertThat(outcome.failure().kind()).isEqualTo(FailureKind.PERMANENT);
            assertThat(outcome.failure().attempts()).isEqualTo(1);
            assertThat(fixture.stages.calls(StageName.DISCOVERY)).isEqualTo(1);
        }
    }

    // =========================================================================
    // Full runs and the persistence gate
    // =========================================================================

    @Nested
    @DisplayName("complete runs")
    class CompleteRuns {

        @Test
        @DisplayName("interesting signal runs every stage and stores one insight")
        void happyPath_storesInsight() {
            Signal signal = fixture.newSignal("promoter_buy", "ACME");

            RunOutcome outcome = engine.run(signal);

            assertThat(outcome.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(outcome.researchPath()).containsExactlyElementsOf(FULL_PATH);
            assertThat(outcome.insightId()).isNotNull();
            assertThat(outcome.runId()).isEqualTo("signal-" + signal.id());

            Insight insight = fixture.memoryStore.findInsight(outcome.insightId()).orElseThrow();
            assertThat(insight.signalId()).isEqualTo(signal.id());
            assertThat(insight.subject()).isEqualTo("ACME");
            assertThat(insight.interestingnessScore()).isEqualTo(8.2);
            assertThat(insight.evidence()).hasSize(2);
            assertThat(insight.embedding()).hasSize(PipelineFixture.DIMENSION);
            assertThat(insight.researchPatterns()).containsExactly("signal:promoter_buy", "promoter_conviction");
            assertThat(insight.metadata()).containsEntry(Insight.META_QUALITY_SCORE, 8.2);

            Signal processed = fixture.memoryStore.findSignal(signal.id()).orElseThrow();
            assertThat(processed.processed()).isTrue();
            assertThat(processed.resultedInInsight()).isTrue();
            assertThat(processed.insightId()).isEqualTo(outcome.insightId());
        }

        @Test
        @DisplayName("each stage is called exactly once")
        void happyPath_callsEachStageOnce() {
            engine.run(fixture.newSignal("promoter_buy", "ACME"));

            for (StageName stage : StageName.values()) {
                assertThat(fixture.stages.calls(stage)).as(stage.key()).isEqualTo(1);
            }
        }

        @Test
        @DisplayName("score below threshold is stopped by the persistence gate")
        void lowScore_stoppedByGate() {
            fixture.stages.synthesisScore(6.5);
            Signal signal = fixture.newSignal("promoter_buy", "ACME");

            RunOutcome outcome = engine.run(signal);

            assertThat(outcome.status()).isEqualTo(RunStatus.STOPPED_BY_GATE);
            assertThat(outcome.researchPath()).containsExactlyElementsOf(FULL_PATH);
            assertThat(outcome.insightId()).isNull();
            assertThat(outcome.state().getDouble(ResearchState.QUALITY_SCORE)).contains(6.5);
            assertThat(fixture.insightCount()).isZero();
            assertThat(fixture.memoryStore.findSignal(signal.id()).orElseThrow().processed()).isTrue();
        }

        @Test
        @DisplayName("score equal to the threshold passes")
        void thresholdTie_passes() {
            fixture.stages.synthesisScore(7.0);

            RunOutcome outcome = engine.run(fixture.newSignal("promoter_buy", "ACME"));

            assertThat(outcome.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(fixture.insightCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("parallel deep research produces the same state as running the levels in sequence")
        void parallelEqualsSequential() throws Exception {
            RunOutcome parallel = engine.run(fixture.newSignal("promoter_buy", "ACME"));
            RunOutcome sequential = fixture.engineFor(fixture.sequentialPipeline(), fixture.checkpoints)
                    .run(fixture.newSignal("promoter_buy", "ACME"));

            assertThat(sequential.status()).isEqualTo(parallel.status());
            assertThat(sequential.researchPath()).isEqualTo(parallel.researchPath());
            for (String key : List.of(ResearchState.LEVEL1_CONTEXT, ResearchState.LEVEL2_HISTORICAL,
                    ResearchState.LEVEL3_FUNDAMENTALS, ResearchState.LEVEL4_SYNTHESIS,
                    ResearchState.VALIDATION_NOTES, ResearchState.FINAL_INSIGHT)) {
                assertThat(sequential.state().value(key)).as(key).isEqualTo(parallel.state().value(key));
            }
        }
    }

    // =========================================================================
    // Failures
    // =========================================================================

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("failing level2 keeps level1 and records the failure")
        void level2Failure_keepsDeclaredPrefix() {
            fixture.stages.alwaysFail(StageName.LEVEL2, () -> new PermanentStageException("schema mismatch"));
            Signal signal = fixture.newSignal("promoter_buy", "ACME");

            RunOutcome outcome = engine.run(signal);

            assertThat(outcome.status()).isEqualTo(RunStatus.FAILED);
            assertThat(outcome.researchPath()).containsExactly("discovery", "level1");
            assertThat(outcome.failure().stage()).isEqualTo("level2");
            assertThat(outcome.failure().kind()).isEqualTo(FailureKind.PERMANENT);
            assertThat(outcome.state().value(ResearchState.LEVEL1_CONTEXT)).isPresent();
            assertThat(outcome.state().value(ResearchState.LEVEL3_FUNDAMENTALS)).isEmpty();
            assertThat(fixture.stages.calls(StageName.LEVEL4)).isZero();
            assertThat(fixture.insightCount()).isZero();
            assertThat(fixture.memoryStore.findSignal(signal.id()).orElseThrow().processed()).isTrue();
        }

        @Test
        @DisplayName("level2 timing out on every attempt keeps level1 and fails after the attempt limit")
        void level2TransientOnEveryAttempt_failsAfterRetries() {
            fixture.stages.alwaysFail(StageName.LEVEL2, () -> new TransientStageException("stage call timed out"));
            Signal signal = fixture.newSignal("promoter_buy", "ACME");

            RunOutcome outcome = engine.run(signal);

            assertThat(outcome.status()).isEqualTo(RunStatus.FAILED);
            assertThat(outcome.researchPath()).containsExactly("discovery", "level1");
            assertThat(outcome.failure().stage()).isEqualTo("level2");
            assertThat(outcome.failure().kind()).isEqualTo(FailureKind.TRANSIENT);
            assertThat(outcome.failure().attempts()).isEqualTo(3);
            assertThat(fixture.stages.calls(StageName.LEVEL2)).isEqualTo(3);
            assertThat(fixture.stages.calls(StageName.LEVEL4)).isZero();
            assertThat(outcome.insightId()).isNull();
            assertThat(fixture.insightCount()).isZero();
            assertThat(fixture.memoryStore.findSignal(signal.id()).orElseThrow().processed()).isTrue();
        }

        @Test
        @DisplayName("transient failures are retried within the attempt limit")
        void transientFailure_retried() {
            fixture.stages.failFirst(StageName.CONTEXT, 2, () -> new TransientStageException("429 rate limited"));

            RunOutcome outcome = engine.run(fixture.newSignal("promoter_buy", "ACME"));

            assertThat(outcome.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(fixture.stages.calls(StageName.CONTEXT)).isEqualTo(3);
        }

        @Test
        @DisplayName("transient failures beyond the attempt limit fail the run")
        void transientFailure_exhausted() {
            fixture.stages.failFirst(StageName.CONTEXT, 3, () -> new TransientStageException("503"));

            RunOutcome outcome = engine.run(fixture.newSignal("promoter_buy", "ACME"));

            assertThat(outcome.status()).isEqualTo(RunStatus.FAILED);
            assertThat(outcome.failure().stage()).isEqualTo("context");
            assertThat(outcome.failure().kind()).isEqualTo(FailureKind.TRANSIENT);
            assertThat(outcome.failure().attempts()).isEqualTo(3);
            assertThat(outcome.researchPath()).containsExactly("discovery", "level1", "level2", "level3", "level4");
        }

        @Test
        @DisplayName("insight write failure fails the run with a persistence error")
        void insightWriteFailure_failsWithPersistence() {
            doThrow(new PersistenceException("connection reset"))
                    .when(fixture.memoryStore).insertInsight(any());

            RunOutcome outcome = engine.run(fixture.newSignal("promoter_buy", "ACME"));

            assertThat(outcome.status()).isEqualTo(RunStatus.FAILED);
            assertThat(outcome.failure().kind()).isEqualTo(FailureKind.PERSISTENCE);
            assertThat(outcome.failure().stage()).isEqualTo(InsightPersister.STEP);
            assertThat(outcome.researchPath()).containsExactlyElementsOf(FULL_PATH);
        }

        @Test
        @DisplayName("run budget exceeded fails with RUN_TIMEOUT")
        void budgetExceeded_failsWithRunTimeout() {
            fixture.properties.getPipeline().setRunBudget(Duration.ofMinutes(1));
            fixture.stages.on(StageName.DISCOVERY, r -> {
                fixture.clock.advance(Duration.ofMinutes(2));
                return "{\"interesting\": true, \"reason\": \"slow\", \"initial_score\": 8}";
            });

            RunOutcome outcome = engine.run(fixture.newSignal("promoter_buy", "ACME"));

            assertThat(outcome.status()).isEqualTo(RunStatus.FAILED);
            assertThat(outcome.failure().kind()).isEqualTo(FailureKind.RUN_TIMEOUT);
            assertThat(outcome.researchPath()).containsExactly("discovery");
            assertThat(fixture.stages.calls(StageName.LEVEL1)).isZero();
        }

        @Test
        @DisplayName("run budget counts the time spent before a resume")
        void budgetSpansResume_failsWithRunTimeout() {
            fixture.properties.getPipeline().setRunBudget(Duration.ofMinutes(15));
            RunCancellation cancellation = new RunCancellation();
            fixture.stages.on(StageName.LEVEL4, r -> {
                fixture.clock.advance(Duration.ofMinutes(10));
                cancellation.cancel();
                return "{\"findings\": \"level4 findings\"}";
            });
            Signal signal = fixture.newSignal("promoter_buy", "ACME");

            RunOutcome interrupted = engine.run(signal, cancellation);
            assertThat(interrupted.status()).isEqualTo(RunStatus.RUNNING);

            fixture.clock.advance(Duration.ofMinutes(10));
            RunOutcome resumed = engine.resume(interrupted.runId());

            assertThat(resumed.status()).isEqualTo(RunStatus.FAILED);
            assertThat(resumed.failure().kind()).isEqualTo(FailureKind.RUN_TIMEOUT);
            assertThat(resumed.failure().stage()).isEqualTo("level4");
            assertThat(resumed.researchPath()).containsExactly("discovery", "level1", "level2", "level3", "level4");
            assertThat(fixture.stages.calls(StageName.CONTEXT)).isZero();
            assertThat(fixture.memoryStore.findSignal(signal.id()).orElseThrow().processed()).isTrue();
            assertThat(fixture.checkpoints.latest(interrupted.runId()).orElseThrow().status())
                    .isEqualTo(RunStatus.FAILED);
        }
    }

    // =========================================================================
    // Checkpoints, resume and redelivery
    // =========================================================================

    @Nested
    @DisplayName("checkpoints and resume")
    class CheckpointsAndResume {

        @Test
        @DisplayName("checkpoint sequence is monotonic and every path extends the previous one")
        void checkpoints_areMonotonicPrefixes() {
            RunOutcome outcome = engine.run(fixture.newSignal("promoter_buy", "ACME"));

            List<CheckpointEntry> history = fixture.checkpoints.history(outcome.runId());
            assertThat(history).extracting(CheckpointEntry::nodeId).containsExactly(
                    START, "discovery", ResearchPipelineGraph.DEEP_RESEARCH,
                    "__PARALLEL__(" + ResearchPipelineGraph.DEEP_RESEARCH + ")", ResearchPipelineGraph.RESEARCH_JOIN,
                    "level4", "context", "validation", "synthesis", InsightPersister.STEP);
            assertThat(history.get(0).state().get(ResearchState.RESEARCH_PATH)).isEqualTo(List.of());
            for (int i = 1; i < history.size(); i++) {
                CheckpointEntry previous = history.get(i - 1);
                CheckpointEntry current = history.get(i);
                assertThat(current.sequence()).isEqualTo(previous.sequence() + 1);
                List<String> previousPath = new ResearchState(previous.state()).getResearchPath();
                List<String> currentPath = new ResearchState(current.state()).getResearchPath();
                assertThat(currentPath.subList(0, previousPath.size())).isEqualTo(previousPath);
            }
            assertThat(history.get(history.size() - 1).status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(history.subList(0, history.size() - 1))
                    .allSatisfy(c -> assertThat(c.status()).isEqualTo(RunStatus.RUNNING));
        }

        @Test
        @DisplayName("failed fan-out member is pruned and marked failed in one checkpoint")
        void fanOutFailure_singleTerminalCheckpoint() {
            fixture.stages.alwaysFail(StageName.LEVEL2, () -> new PermanentStageException("schema mismatch"));

            RunOutcome outcome = engine.run(fixture.newSignal("promoter_buy", "ACME"));

            List<CheckpointEntry> history = fixture.checkpoints.history(outcome.runId());
            CheckpointEntry last = history.get(history.size() - 1);
            assertThat(last.nodeId()).isEqualTo(ResearchPipelineGraph.RESEARCH_JOIN);
            assertThat(last.status()).isEqualTo(RunStatus.FAILED);
            assertThat(last.stagePointer()).isEqualTo("level1");
            assertThat(new ResearchState(last.state()).getResearchPath()).containsExactly("discovery", "level1");
            assertThat(last.state()).doesNotContainKey(ResearchState.LEVEL3_FUNDAMENTALS);
            assertThat(history.subList(0, history.size() - 1))
                    .allSatisfy(c -> assertThat(c.status()).isEqualTo(RunStatus.RUNNING));
        }

        @Test
        @DisplayName("lost join checkpoint after a failed member records that failure on redelivery")
        void lostJoinCheckpoint_redeliveryRecordsMemberFailure() {
            fixture.stages.alwaysFail(StageName.LEVEL2, () -> new PermanentStageException("schema mismatch"));
            InMemoryCheckpointSaver saver = fixture.saverFailingOnceAt(ResearchPipelineGraph.RESEARCH_JOIN);
            PipelineEngine flaky = fixture.engineFor(saver);
            Signal signal = fixture.newSignal("promoter_buy", "ACME");

            assertThatThrownBy(() -> flaky.run(signal)).isInstanceOf(PersistenceException.class);
            assertThat(fixture.memoryStore.findSignal(signal.id()).orElseThrow().processed()).isFalse();

            RunOutcome redelivered = flaky.run(signal);

            assertThat(redelivered.status()).isEqualTo(RunStatus.FAILED);
            assertThat(redelivered.failure().stage()).isEqualTo("level2");
            assertThat(redelivered.researchPath()).containsExactly("discovery", "level1");
            assertThat(redelivered.state().value(ResearchState.LEVEL3_FUNDAMENTALS)).isEmpty();
            assertThat(fixture.stages.calls(StageName.LEVEL4)).isZero();
            assertThat(fixture.memoryStore.findSignal(signal.id()).orElseThrow().processed()).isTrue();
        }

        @Test
        @DisplayName("lost final checkpoint keeps the stored insight even after the gate turns stricter")
        void lostFinalCheckpoint_keepsStoredInsight() {
            PipelineEngine flaky = fixture.engineFor(fixture.saverFailingOnceAt(InsightPersister.STEP));
            Signal signal = fixture.newSignal("promoter_buy", "ACME");

            assertThatThrownBy(() -> flaky.run(signal)).isInstanceOf(PersistenceException.class);
            assertThat(fixture.insightCount()).isEqualTo(1);
            assertThat(fixture.memoryStore.findSignal(signal.id()).orElseThrow().processed()).isFalse();

            fixture.gate.swapModel(new RewardModel() {
                @Override
                public double score(InsightFeatures features) {
                    return 3.0;
                }

                @Override
                public String name() {
                    return "strict";
                }
            });
            RunOutcome redelivered = flaky.run(signal);

            assertThat(redelivered.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(redelivered.insightId()).isNotNull();
            assertThat(fixture.insightCount()).isEqualTo(1);
            assertThat(fixture.stages.calls(StageName.SYNTHESIS)).isEqualTo(1);
            Signal processed = fixture.memoryStore.findSignal(signal.id()).orElseThrow();
            assertThat(processed.processed()).isTrue();
            assertThat(processed.resultedInInsight()).isTrue();
            assertThat(processed.insightId()).isEqualTo(redelivered.insightId());
        }

        @Test
        @DisplayName("cancelled run resumes from its pointer without re-running finished stages")
        void cancelledRun_resumesFromPointer() {
            RunCancellation cancellation = new RunCancellation();
            fixture.stages.on(StageName.LEVEL4, r -> {
                cancellation.cancel();
                return "{\"findings\": \"level4 findings\"}";
            });
            Signal signal = fixture.newSignal("promoter_buy", "ACME");

            RunOutcome interrupted = engine.run(signal, cancellation);

            assertThat(interrupted.status()).isEqualTo(RunStatus.RUNNING);
            assertThat(interrupted.state().getStagePointer()).contains("level4");
            assertThat(fixture.stages.calls(StageName.CONTEXT)).isZero();
            assertThat(fixture.memoryStore.findSignal(signal.id()).orElseThrow().processed()).isFalse();

            RunOutcome resumed = engine.resume(interrupted.runId());

            assertThat(resumed.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(resumed.researchPath()).containsExactlyElementsOf(FULL_PATH);
            assertThat(fixture.stages.calls(StageName.DISCOVERY)).isEqualTo(1);
            assertThat(fixture.stages.calls(StageName.LEVEL1)).isEqualTo(1);
            assertThat(fixture.stages.calls(StageName.LEVEL4)).isEqualTo(1);
            assertThat(fixture.stages.calls(StageName.CONTEXT)).isEqualTo(1);
            assertThat(fixture.stages.calls(StageName.SYNTHESIS)).isEqualTo(1);
        }

        @Test
        @DisplayName("resuming a completed run is a no-op")
        void resumeCompleted_isNoOp() {
            RunOutcome first = engine.run(fixture.newSignal("promoter_buy", "ACME"));
            int calls = fixture.stages.totalCalls();
            int checkpoints = fixture.checkpoints.history(first.runId()).size();

            RunOutcome again = engine.resume(first.runId());

            assertThat(again.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(again.insightId()).isEqualTo(first.insightId());
            assertThat(fixture.stages.totalCalls()).isEqualTo(calls);
            assertThat(fixture.checkpoints.history(first.runId())).hasSize(checkpoints);
        }

        @Test
        @DisplayName("resuming an unknown run is rejected")
        void resumeUnknown_throws() {
            assertThatThrownBy(() -> engine.resume("signal-999"))
                    .isInstanceOf(EntityNotFoundException.class);
        }

        @Test
        @DisplayName("redelivered signal does not run again")
        void redelivery_isNoOp() {
            Signal signal = fixture.newSignal("promoter_buy", "ACME");
            RunOutcome first = engine.run(signal);
            int calls = fixture.stages.totalCalls();

            RunOutcome second = engine.run(signal);

            assertThat(second.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(second.insightId()).isEqualTo(first.insightId());
            assertThat(fixture.stages.totalCalls()).isEqualTo(calls);
            assertThat(fixture.insightCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("rerun after lost checkpoints hits the cache and reuses the stored insight")
        void lostCheckpoints_reuseInsight() {
            Signal signal = fixture.newSignal("promoter_buy", "ACME");
            RunOutcome first = engine.run(signal);

            RunOutcome rerun = fixture.engineFor(new InMemoryCheckpointSaver(fixture.objectMapper, fixture.clock))
                    .run(signal);

            assertThat(rerun.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(rerun.insightId()).isEqualTo(first.insightId());
            assertThat(fixture.stages.calls(StageName.DISCOVERY)).isEqualTo(1);
            assertThat(fixture.stages.calls(StageName.LEVEL1)).isEqualTo(1);
            assertThat(fixture.stages.calls(StageName.SYNTHESIS)).isEqualTo(1);
            assertThat(fixture.insightCount()).isEqualTo(1);
        }
    }
}
