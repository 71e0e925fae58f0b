package com.eainde.research.workflow;

import com.eainde.research.embedding.EmbeddingService;
import com.eainde.research.execution.FailureKind;
import com.eainde.research.execution.StageError;
import com.eainde.research.gate.GateDecision;
import com.eainde.research.gate.QualityGate;
import com.eainde.research.memory.MemoryStore;
import com.eainde.research.model.Evidence;
import com.eainde.research.model.Insight;
import com.eainde.research.model.InsightFeatures;
import com.eainde.research.model.Signal;
import com.eainde.research.state.ResearchState;
import com.eainde.research.state.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The last node of the pipeline: scores the synthesized insight with the
 * persistence gate and, when it passes, stores it exactly once per signal.
 * <p>
 * The run ends {@code COMPLETED} with the insight id, {@code STOPPED_BY_GATE}
 * when the score is below the threshold, or {@code FAILED} with a
 * {@code PERSISTENCE} error when the insight cannot be written.
 * </p>
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class InsightPersister implements AsyncNodeAction<ResearchState> {

    public static final String STEP = "persist";

    private final QualityGate qualityGate;
    private final MemoryStore memoryStore;
    private final EmbeddingService embeddingService;

    public record Result(GateDecision decision, Insight insight) {

        public boolean persisted() {
            return insight != null;
        }
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state) {
        Map<String, Object> update = new HashMap<>();
        Result result;
        try {
            result = persist(state);
        } catch (RuntimeException e) {
            log.error("Run {} could not persist its insight", state.getRunId(), e);
            String message = e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
            update.put(ResearchState.FAILURE, new StageError(STEP, FailureKind.PERSISTENCE, message, 1).toMap());
            update.put(ResearchState.STATUS, RunStatus.FAILED.name());
            return CompletableFuture.completedFuture(update);
        }

        update.put(ResearchState.QUALITY_SCORE, result.decision().score());
        if (result.persisted()) {
            update.put(ResearchState.INSIGHT_ID, result.insight().id());
            update.put(ResearchState.STATUS, RunStatus.COMPLETED.name());
        } else {
            update.put(ResearchState.STATUS, RunStatus.STOPPED_BY_GATE.name());
        }
        return CompletableFuture.completedFuture(update);
    }

    public Result persist(ResearchState state) {
        // a redelivered run may find the insight it already wrote; it is not scored again
        Optional<Insight> existing = memoryStore.findInsightBySignalId(state.getSignalId());
        if (existing.isPresent()) {
            log.info("Insight {} already stored for signal {}", existing.get().id(), state.getSignalId());
            return new Result(qualityGate.recorded(existing.get()), existing.get());
        }

        Map<String, Object> proposal = state.getFinalInsight()
                .orElseThrow(() -> new IllegalStateException("Run reached persist without a final insight"));

        Insight candidate = assemble(state, proposal);
        InsightFeatures features = candidate.features();
        GateDecision decision = qualityGate.evaluatePersistence(features);
        if (!decision.pass()) {
            return new Result(decision, null);
        }

        Map<String, Object> metadata = new HashMap<>(candidate.metadata());
        metadata.put(Insight.META_QUALITY_SCORE, decision.score());
        Insight toStore = candidate.toBuilder()
                .metadata(metadata)
                .embedding(embeddingService.tryEmbed(candidate.embeddingText()).orElse(null))
                .build();
        Insight stored = memoryStore.insertInsight(toStore);
        log.info("Stored insight {} for signal {} score={}", stored.id(), state.getSignalId(), decision.score());
        return new Result(decision, stored);
    }

    @SuppressWarnings("unchecked")
    static Insight assemble(ResearchState state, Map<String, Object> proposal) {
        Map<String, Object> signal = state.getSignal();
        String signalType = String.valueOf(signal.getOrDefault("signal_type", ""));

        List<Evidence> evidence = new ArrayList<>();
        Object rawEvidence = proposal.get("evidence");
        if (rawEvidence instanceof List<?> items) {
            for (Object item : items) {
                if (item instanceof Map<?, ?> map) {
                    Object source = map.get("source");
                    evidence.add(new Evidence(String.valueOf(map.get("fact")), source == null ? null : source.toString()));
                }
            }
        }

        Map<String, Object> metadata = new HashMap<>();
        Object proposed = proposal.get("metadata");
        if (proposed instanceof Map<?, ?> map) {
            ((Map<String, Object>) map).forEach((key, value) -> {
                if (value != null) {
                    metadata.put(key, value);
                }
            });
        }
        Object priority = signal.get("priority");
        metadata.put(Insight.META_SIGNAL_PRIORITY,
                priority instanceof Number number ? number.doubleValue() : Signal.DEFAULT_PRIORITY);
        metadata.put(Insight.META_RESEARCH_PATTERNS, researchPatterns(signalType, metadata.get(Insight.META_RESEARCH_PATTERNS)));
        metadata.put("research_path", state.getResearchPath());

        Object score = proposal.get("interestingness_score");
        return Insight.builder()
                .signalId(state.getSignalId())
                .signalType(signalType)
                .subject(signal.get("subject") == null ? null : signal.get("subject").toString())
                .companyName(signal.get("company") == null ? null : signal.get("company").toString())
                .headline(String.valueOf(proposal.get("headline")))
                .analysis(String.valueOf(proposal.get("analysis")))
                .evidence(evidence)
                .interestingnessScore(score instanceof Number number ? number.doubleValue() : 0.0)
                .metadata(metadata)
                .build();
    }

    /**
     * Every insight counts towards the pattern of its signal type, plus any
     * patterns the synthesis stage named.
     */
    static List<String> researchPatterns(String signalType, Object proposed) {
        Set<String> names = new LinkedHashSet<>();
        names.add("signal:" + signalType);
        if (proposed instanceof List<?> list) {
            list.forEach(name -> names.add(String.valueOf(name)));
        }
        return List.copyOf(names);
    }
}
