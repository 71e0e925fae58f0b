package com.eainde.research.state;

import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The record carried through a research run. Values are JSON-native
 * (strings, numbers, booleans, lists and maps) so a snapshot can be written to
 * a checkpoint and reloaded without loss.
 */
public class ResearchState extends AgentState {

    public static final String RUN_ID = "run_id";
    public static final String SIGNAL = "signal";
    public static final String SIGNAL_ID = "signal_id";
    public static final String RESEARCH_PATH = "research_path";
    public static final String STAGE_POINTER = "stage_pointer";
    public static final String STATUS = "status";
    public static final String STARTED_AT = "started_at";

    public static final String INITIAL_ASSESSMENT = "initial_assessment";
    public static final String INITIAL_SCORE = "initial_score";
    public static final String IS_INTERESTING = "is_interesting";
    public static final String LEVEL1_CONTEXT = "level1_context";
    public static final String LEVEL2_HISTORICAL = "level2_historical";
    public static final String LEVEL3_FUNDAMENTALS = "level3_fundamentals";
    public static final String LEVEL4_SYNTHESIS = "level4_synthesis";
    public static final String INDUSTRY_CONTEXT = "industry_context";
    public static final String PEER_COMPARISON = "peer_comparison";
    public static final String MACRO_FACTORS = "macro_factors";
    public static final String VERIFIED = "verified";
    public static final String VALIDATION_NOTES = "validation_notes";
    public static final String FINAL_INSIGHT = "final_insight";
    public static final String QUALITY_SCORE = "quality_score";
    public static final String INSIGHT_ID = "insight_id";
    public static final String FAILURE = "failure";

    /**
     * Channels of the graph state. The research path only grows; the first
     * failure recorded in a step wins over later ones.
     */
    public static final Map<String, Channel<?>> SCHEMA = Map.of(
            RESEARCH_PATH, Channels.appender(ArrayList::new),
            FAILURE, Channels.base((Reducer<Object>) (current, update) -> current != null ? current : update)
    );

    public ResearchState(Map<String, Object> initData) {
        super(initData);
    }

    public static ResearchState initial(String runId, long signalId, Map<String, Object> signalSnapshot) {
        return new ResearchState(initialData(runId, signalId, signalSnapshot, null));
    }

    /**
     * Graph input of a fresh run.
     */
    public static Map<String, Object> initialData(String runId, long signalId, Map<String, Object> signalSnapshot,
                                                  Instant startedAt) {
        Map<String, Object> data = new HashMap<>();
        data.put(RUN_ID, runId);
        data.put(SIGNAL_ID, signalId);
        data.put(SIGNAL, new HashMap<>(signalSnapshot));
        data.put(RESEARCH_PATH, new ArrayList<String>());
        data.put(STATUS, RunStatus.RUNNING.name());
        if (startedAt != null) {
            data.put(STARTED_AT, startedAt.toString());
        }
        return data;
    }

    public String getRunId() { return (String) this.data().get(RUN_ID); }

    public long getSignalId() { return ((Number) this.data().get(SIGNAL_ID)).longValue(); }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSignal() {
        return (Map<String, Object>) this.data().getOrDefault(SIGNAL, Map.of());
    }

    @SuppressWarnings("unchecked")
    public List<String> getResearchPath() {
        return (List<String>) this.data().getOrDefault(RESEARCH_PATH, List.of());
    }

    public Optional<Instant> getStartedAt() {
        Object startedAt = this.data().get(STARTED_AT);
        return Optional.ofNullable(startedAt).map(value -> Instant.parse(value.toString()));
    }

    public Optional<String> getStagePointer() {
        return Optional.ofNullable((String) this.data().get(STAGE_POINTER));
    }

    public RunStatus getStatus() {
        Object status = this.data().get(STATUS);
        return status == null ? RunStatus.RUNNING : RunStatus.valueOf(status.toString());
    }

    public boolean isInteresting() {
        return Boolean.TRUE.equals(this.data().get(IS_INTERESTING));
    }

    public Optional<String> getString(String key) {
        Object value = this.data().get(key);
        return Optional.ofNullable(value).map(Object::toString);
    }

    public Optional<Double> getDouble(String key) {
        Object value = this.data().get(key);
        return value instanceof Number number ? Optional.of(number.doubleValue()) : Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> getFinalInsight() {
        return Optional.ofNullable((Map<String, Object>) this.data().get(FINAL_INSIGHT));
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> getFailure() {
        return Optional.ofNullable((Map<String, Object>) this.data().get(FAILURE));
    }

    public Optional<Long> getInsightId() {
        Object id = this.data().get(INSIGHT_ID);
        return id instanceof Number number ? Optional.of(number.longValue()) : Optional.empty();
    }

    /**
     * Copy of the underlying map, safe to mutate and hand to a new state.
     */
    public Map<String, Object> snapshot() {
        return new HashMap<>(this.data());
    }
}
