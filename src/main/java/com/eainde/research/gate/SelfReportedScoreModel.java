package com.eainde.research.gate;

import com.eainde.research.model.InsightFeatures;

/**
 * Used until enough feedback exists to train: trusts the interestingness score
 * reported by the synthesis stage.
 */
public class SelfReportedScoreModel implements RewardModel {

    @Override
    public double score(InsightFeatures features) {
        return Math.max(0.0, Math.min(10.0, features.initialScore()));
    }

    @Override
    public String name() {
        return "self-reported";
    }
}
