package com.eainde.research.execution;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Why a stage (or a run) failed. Stored in the research state under {@code failure}.
 */
public record StageError(String stage, FailureKind kind, String message, int attempts) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("stage", stage);
        map.put("kind", kind.name());
        map.put("message", message == null ? "" : message);
        map.put("attempts", attempts);
        return map;
    }

    public static StageError fromMap(Map<String, Object> map) {
        Object attempts = map.get("attempts");
        return new StageError(
                String.valueOf(map.get("stage")),
                FailureKind.valueOf(String.valueOf(map.get("kind"))),
                String.valueOf(map.get("message")),
                attempts instanceof Number number ? number.intValue() : 0);
    }
}
