package com.eainde.research.nodes;

import com.eainde.research.config.ResearchProperties;
import com.eainde.research.embedding.EmbeddingService;
import com.eainde.research.memory.MemoryStore;
import com.eainde.research.model.Company;
import com.eainde.research.model.Insight;
import com.eainde.research.model.SimilarityMatch;
import com.eainde.research.state.ResearchState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles the stage input of each deep-research level, pulling company
 * facts and prior insights out of memory.
 */
@Component
@RequiredArgsConstructor
public class ResearchInputs {

    private final MemoryStore memoryStore;
    private final EmbeddingService embeddingService;
    private final ResearchProperties properties;

    /** Level 1: company basics and the immediate context of the signal. */
    public Map<String, Object> level1(ResearchState state) {
        Map<String, Object> input = new HashMap<>();
        input.put(ResearchState.SIGNAL, state.getSignal());
        input.put("company", companyFacts(state));
        return input;
    }

    /** Level 2: what happened the last times this company or a similar one showed up. */
    public Map<String, Object> level2(ResearchState state) {
        Map<String, Object> input = new HashMap<>();
        input.put(ResearchState.SIGNAL, state.getSignal());

        ResearchProperties.Memory memory = properties.getMemory();
        List<Map<String, Object>> prior = subject(state)
                .map(s -> memoryStore.findInsightsBySubject(s, memory.getPriorInsightsLimit()))
                .orElse(List.of())
                .stream()
                .map(ResearchInputs::summary)
                .toList();
        input.put("prior_insights", prior);

        List<Map<String, Object>> similar = embeddingService.tryEmbed(signalText(state))
                .map(vector -> memoryStore.findSimilarInsights(
                        vector, memory.getSimilarInsightsK(), memory.getMinSimilarity()))
                .orElse(List.of())
                .stream()
                .map(ResearchInputs::similarSummary)
                .toList();
        input.put("similar_insights", similar);
        return input;
    }

    /** Level 3: fundamentals. */
    public Map<String, Object> level3(ResearchState state) {
        Map<String, Object> input = new HashMap<>();
        input.put(ResearchState.SIGNAL, state.getSignal());
        input.put("company", companyFacts(state));
        return input;
    }

    /** Level 4: synthesis of the three levels before it. */
    public Map<String, Object> level4(ResearchState state) {
        Map<String, Object> input = new HashMap<>();
        input.put(ResearchState.SIGNAL, state.getSignal());
        StageNode.putIfPresent(input, state, ResearchState.LEVEL1_CONTEXT);
        StageNode.putIfPresent(input, state, ResearchState.LEVEL2_HISTORICAL);
        StageNode.putIfPresent(input, state, ResearchState.LEVEL3_FUNDAMENTALS);
        return input;
    }

    private Map<String, Object> companyFacts(ResearchState state) {
        return subject(state)
                .flatMap(memoryStore::findCompany)
                .map(ResearchInputs::companyMap)
                .orElse(Map.of());
    }

    private static Optional<String> subject(ResearchState state) {
        return Optional.ofNullable(state.getSignal().get("subject")).map(Object::toString);
    }

    private static String signalText(ResearchState state) {
        Map<String, Object> signal = state.getSignal();
        return signal.getOrDefault("signal_type", "") + " " + signal.getOrDefault("company", "")
                + " " + signal.getOrDefault("data", "");
    }

    private static Map<String, Object> companyMap(Company company) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("symbol", company.symbol());
        map.put("name", company.name() == null ? "" : company.name());
        map.put("sector", company.sector() == null ? "" : company.sector());
        map.put("industry", company.industry() == null ? "" : company.industry());
        if (company.marketCap() != null) {
            map.put("market_cap", company.marketCap());
        }
        map.put("fundamentals", company.fundamentals());
        return map;
    }

    private static Map<String, Object> summary(Insight insight) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", insight.id());
        map.put("signal_type", insight.signalType());
        map.put("headline", insight.headline());
        map.put("interestingness_score", insight.interestingnessScore());
        map.put("created_at", insight.createdAt() == null ? "" : insight.createdAt().toString());
        return map;
    }

    private static Map<String, Object> similarSummary(SimilarityMatch<Insight> match) {
        Map<String, Object> map = summary(match.item());
        map.put("similarity", Math.round(match.similarity() * 1000) / 1000.0);
        return map;
    }
}
