package com.eainde.research.execution;

import com.eainde.research.stage.StageName;

import java.util.Map;

/**
 * Input of one stage call. The input map must be JSON-native; it is
 * fingerprinted for the cache.
 */
public record StageRequest(StageName stage, Map<String, Object> input) {

    public StageRequest {
        input = input == null ? Map.of() : input;
    }
}
