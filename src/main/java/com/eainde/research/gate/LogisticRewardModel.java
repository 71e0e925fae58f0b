package com.eainde.research.gate;

import com.eainde.research.model.InsightFeatures;

/**
 * Logistic regression over standardized {@link InsightFeatures}. The score is
 * the probability of a four or five star rating, scaled to 0-10.
 */
public class LogisticRewardModel implements RewardModel {

    private final double[] weights;
    private final double bias;
    private final double[] means;
    private final double[] scales;
    private final int trainingSize;

    public LogisticRewardModel(double[] weights, double bias, double[] means, double[] scales, int trainingSize) {
        if (weights.length != InsightFeatures.SIZE || means.length != InsightFeatures.SIZE
                || scales.length != InsightFeatures.SIZE) {
            throw new IllegalArgumentException("Expected " + InsightFeatures.SIZE + " coefficients");
        }
        this.weights = weights.clone();
        this.bias = bias;
        this.means = means.clone();
        this.scales = scales.clone();
        this.trainingSize = trainingSize;
    }

    @Override
    public double score(InsightFeatures features) {
        return 10.0 * probability(features.toArray());
    }

    double probability(double[] x) {
        double z = bias;
        for (int i = 0; i < weights.length; i++) {
            z += weights[i] * ((x[i] - means[i]) / scales[i]);
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    @Override
    public String name() {
        return "logistic(n=" + trainingSize + ")";
    }
}
