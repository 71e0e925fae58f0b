package com.eainde.research.gate;

import com.eainde.research.model.InsightFeatures;

/**
 * Scores a candidate insight on a 0-10 scale.
 */
public interface RewardModel {

    double score(InsightFeatures features);

    String name();
}
