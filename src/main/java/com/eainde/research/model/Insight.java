package com.eainde.research.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A persisted research result. Exists only for a signal whose persistence
 * score met the gate threshold; at most one per signal. Immutable apart from
 * {@code shownToUser}.
 */
@Builder(toBuilder = true)
public record Insight(
        Long id,
        Instant createdAt,
        Long signalId,
        String signalType,
        String subject,
        String companyName,
        String headline,
        List<Evidence> evidence,
        String analysis,
        double interestingnessScore,
        boolean shownToUser,
        float[] embedding,
        Map<String, Object> metadata
) {
    public static final String META_QUALITY_SCORE = "quality_score";
    public static final String META_RESEARCH_PATTERNS = "research_patterns";
    public static final String META_SIGNAL_PRIORITY = "signal_priority";

    public Insight {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Names of the research patterns that contributed to this insight.
     */
    public List<String> researchPatterns() {
        Object patterns = metadata.get(META_RESEARCH_PATTERNS);
        if (patterns instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    public double signalPriority() {
        Object priority = metadata.get(META_SIGNAL_PRIORITY);
        return priority instanceof Number number ? number.doubleValue() : Signal.DEFAULT_PRIORITY;
    }

    /**
     * Text fed to the embedding model: headline, analysis and evidence facts.
     */
    public String embeddingText() {
        StringBuilder text = new StringBuilder();
        text.append(headline == null ? "" : headline).append(' ');
        text.append(analysis == null ? "" : analysis);
        for (Evidence e : evidence) {
            text.append(' ').append(e.fact());
        }
        return text.toString().trim();
    }

    public InsightFeatures features() {
        return InsightFeatures.of(signalType, analysis, evidence.size(), interestingnessScore, signalPriority());
    }
}
