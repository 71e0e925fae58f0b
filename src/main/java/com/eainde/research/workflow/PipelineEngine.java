package com.eainde.research.workflow;

import com.eainde.research.checkpoint.CheckpointEntry;
import com.eainde.research.checkpoint.ResearchCheckpointSaver;
import com.eainde.research.config.ResearchProperties;
import com.eainde.research.exception.EntityNotFoundException;
import com.eainde.research.exception.PersistenceException;
import com.eainde.research.execution.FailureKind;
import com.eainde.research.execution.StageError;
import com.eainde.research.memory.MemoryStore;
import com.eainde.research.model.Signal;
import com.eainde.research.state.ResearchState;
import com.eainde.research.state.RunStatus;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphInput;
import org.bsc.langgraph4j.NodeOutput;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.state.AgentState;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Drives one signal through the compiled research graph.
 * <p>
 * The graph checkpoints after every node through the
 * {@link ResearchCheckpointSaver}, with the run id as its thread id. A run
 * with a checkpoint is always resumed from it, never started again.
 * </p>
 *
 * <h3>Terminal handling</h3>
 * <ul>
 * <li>Discovery gate says stop, or the persistence gate rejects: {@code STOPPED_BY_GATE}.</li>
 * <li>A stage fails, the insight cannot be written, or the run budget runs out:
 * {@code FAILED} with the reason recorded under {@code failure}.</li>
 * <li>Insight stored: {@code COMPLETED}.</li>
 * </ul>
 * In every case the signal is marked processed after the terminal checkpoint.
 * A checkpoint that cannot be written aborts the drive with a
 * {@link PersistenceException} and leaves the signal for redelivery.
 */
@Log4j2
@Service
public class PipelineEngine {

    static final String PIPELINE = "pipeline";

    private final CompiledGraph<ResearchState> graph;
    private final ResearchCheckpointSaver checkpointSaver;
    private final RunGuards runGuards;
    private final MemoryStore memoryStore;
    private final ExecutorService fanOutExecutor;
    private final ResearchProperties properties;
    private final Clock clock;

    public PipelineEngine(CompiledGraph<ResearchState> graph,
                          ResearchCheckpointSaver checkpointSaver,
                          RunGuards runGuards,
                          MemoryStore memoryStore,
                          @Qualifier("fanOutExecutor") ExecutorService fanOutExecutor,
                          ResearchProperties properties,
                          Clock clock) {
        this.graph = graph;
        this.checkpointSaver = checkpointSaver;
        this.runGuards = runGuards;
        this.memoryStore = memoryStore;
        this.fanOutExecutor = fanOutExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public static String runIdFor(long signalId) {
        return "signal-" + signalId;
    }

    public RunOutcome run(Signal signal) {
        return run(signal, RunCancellation.none());
    }

    /**
     * Starts a run for the signal, or continues it when a checkpoint already
     * exists (redelivery after a crash or a duplicate submission).
     */
    public RunOutcome run(Signal signal, RunCancellation cancellation) {
        String runId = runIdFor(signal.id());
        Optional<CheckpointEntry> latest = checkpointSaver.latest(runId);
        if (latest.isPresent()) {
            log.info("Run {} already has checkpoint {}, continuing", runId, latest.get().sequence());
            return drive(runId, GraphInput.resume(), new ResearchState(latest.get().state()), cancellation);
        }

        Map<String, Object> inputs = ResearchState.initialData(runId, signal.id(), signal.toSnapshot(), clock.instant());
        return drive(runId, GraphInput.args(inputs), new ResearchState(inputs), cancellation);
    }

    public RunOutcome resume(String runId) {
        return resume(runId, RunCancellation.none());
    }

    public RunOutcome resume(String runId, RunCancellation cancellation) {
        CheckpointEntry latest = checkpointSaver.latest(runId)
                .orElseThrow(() -> new EntityNotFoundException("Run", runId));
        return drive(runId, GraphInput.resume(), new ResearchState(latest.state()), cancellation);
    }

    private RunOutcome drive(String runId, GraphInput input, ResearchState start, RunCancellation cancellation) {
        MDC.put("runId", runId);
        try {
            if (start.getStatus().isTerminal()) {
                log.info("Run {} already {}, nothing to do", runId, start.getStatus());
                return finish(start);
            }

            RunnableConfig config = RunnableConfig.builder()
                    .threadId(runId)
                    .addParallelNodeExecutor(ResearchPipelineGraph.DEEP_RESEARCH, fanOutExecutor)
                    .build();
            RunGuards.Guard guard = runGuards.register(runId, cancellation, deadline(start));
            ResearchState state = start;
            try {
                for (NodeOutput<ResearchState> output : graph.stream(input, config)) {
                    state = output.state();
                    log.debug("Run {} checkpointed {} pointer={}", runId, output.node(),
                            state.getStagePointer().orElse("-"));
                }
            } catch (RuntimeException e) {
                Optional<PersistenceException> lostWrite = persistenceFailure(e);
                if (lostWrite.isPresent()) {
                    log.error("Run {} could not write its checkpoint, leaving it for redelivery", runId, e);
                    throw lostWrite.get();
                }
                log.error("Run {} aborted by an unexpected error", runId, e);
                return fail(config, state, new StageError(state.getStagePointer().orElse(PIPELINE),
                        FailureKind.PERMANENT, describe(rootCause(e)), 0));
            } finally {
                runGuards.release(runId);
            }

            if (state.getStatus().isTerminal()) {
                return finish(state);
            }
            Optional<RunGuards.Halt> halt = guard.halted();
            if (halt.isPresent() && halt.get() == RunGuards.Halt.CANCELLED) {
                log.info("Run {} cancelled at pointer={}", runId, state.getStagePointer().orElse("-"));
                return outcome(state);
            }
            if (halt.isPresent()) {
                Duration budget = properties.getPipeline().getRunBudget();
                Duration elapsed = state.getStartedAt()
                        .map(startedAt -> Duration.between(startedAt, clock.instant()))
                        .orElse(Duration.ZERO);
                return fail(config, state, new StageError(state.getStagePointer().orElse(PIPELINE),
                        FailureKind.RUN_TIMEOUT, "Run budget of " + budget + " exceeded after " + elapsed, 0));
            }
            return fail(config, state, new StageError(state.getStagePointer().orElse(PIPELINE),
                    FailureKind.PERMANENT, "Graph ended without a terminal status", 0));
        } finally {
            MDC.remove("runId");
        }
    }

    /**
     * The budget covers the whole run, counted from the start instant written
     * into its first checkpoint, so resuming does not restart it.
     */
    private Instant deadline(ResearchState state) {
        Duration budget = properties.getPipeline().getRunBudget();
        if (budget == null) {
            return null;
        }
        return state.getStartedAt().orElseGet(clock::instant).plus(budget);
    }

    /**
     * Writes the failure on top of the run's latest checkpoint, keeping its
     * next node.
     */
    private RunOutcome fail(RunnableConfig config, ResearchState state, StageError error) {
        log.warn("Run {} failed at {} kind={} message={}", state.getRunId(), error.stage(), error.kind(),
                error.message());
        Map<String, Object> update = new HashMap<>();
        update.put(ResearchState.FAILURE, error.toMap());
        update.put(ResearchState.STATUS, RunStatus.FAILED.name());
        try {
            graph.updateState(config, update);
        } catch (Exception e) {
            throw new PersistenceException("Failed to record the failure of run " + state.getRunId(), e);
        }
        return finish(new ResearchState(AgentState.updateState(state.data(), update, ResearchState.SCHEMA)));
    }

    private RunOutcome finish(ResearchState state) {
        memoryStore.markProcessed(state.getSignalId(), state.getInsightId().orElse(null));
        log.info("Run {} finished status={} path={}", state.getRunId(), state.getStatus(), state.getResearchPath());
        return outcome(state);
    }

    private RunOutcome outcome(ResearchState state) {
        StageError failure = state.getFailure().map(StageError::fromMap).orElse(null);
        return new RunOutcome(state.getRunId(), state.getSignalId(), state.getStatus(), state.getResearchPath(),
                state.getInsightId().orElse(null), failure, state);
    }

    private static Optional<PersistenceException> persistenceFailure(Throwable failure) {
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof PersistenceException persistence) {
                return Optional.of(persistence);
            }
        }
        return Optional.empty();
    }

    private static Throwable rootCause(Throwable failure) {
        Throwable cause = failure;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describe(Throwable t) {
        return t.getClass().getSimpleName() + (t.getMessage() == null ? "" : ": " + t.getMessage());
    }
}
