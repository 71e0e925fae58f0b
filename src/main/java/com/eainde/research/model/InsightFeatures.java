package com.eainde.research.model;

import java.util.List;
import java.util.Locale;

/**
 * Feature vector scored by the reward model.
 */
public record InsightFeatures(
        double initialScore,
        double promoterActivity,
        double fundamentalConfluence,
        double historicalPrecedent,
        double signalPriority,
        double evidenceCount,
        double analysisLength
) {
    public static final int SIZE = 7;

    private static final List<String> HISTORICAL_MARKERS =
            List.of("past", "historical", "previously", "track record");

    public static InsightFeatures of(String signalType, String analysis, int evidenceCount,
                                     double interestingnessScore, double signalPriority) {
        String type = signalType == null ? "" : signalType.toLowerCase(Locale.ROOT);
        String text = analysis == null ? "" : analysis.toLowerCase(Locale.ROOT);

        boolean confluence = text.contains("fundamental") && text.contains("signal");
        boolean historical = HISTORICAL_MARKERS.stream().anyMatch(text::contains);

        return new InsightFeatures(
                interestingnessScore,
                type.contains("promoter") ? 1.0 : 0.0,
                confluence ? 1.0 : 0.0,
                historical ? 1.0 : 0.0,
                signalPriority,
                evidenceCount,
                (analysis == null ? 0 : analysis.length()) / 1000.0);
    }

    public double[] toArray() {
        return new double[]{
                initialScore, promoterActivity, fundamentalConfluence, historicalPrecedent,
                signalPriority, evidenceCount, analysisLength
        };
    }
}
