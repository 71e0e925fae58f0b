package com.eainde.research.execution;

import com.eainde.research.stage.StageName;
import com.eainde.research.stage.StageOutput;

/**
 * Outcome of {@link StageExecutor#execute(StageRequest)}: either a typed output
 * or a {@link StageError}, never both.
 */
public record StageResult(StageName stage, StageOutput output, StageError error, boolean fromCache, int attempts) {

    public static StageResult success(StageName stage, StageOutput output, boolean fromCache, int attempts) {
        return new StageResult(stage, output, null, fromCache, attempts);
    }

    public static StageResult failure(StageError error) {
        return new StageResult(StageName.fromKey(error.stage()), null, error, false, error.attempts());
    }

    public boolean isSuccess() {
        return error == null;
    }

    public <T extends StageOutput> T output(Class<T> type) {
        if (!isSuccess()) {
            throw new IllegalStateException("Stage " + stage.key() + " failed: " + error.message());
        }
        return type.cast(output);
    }
}
