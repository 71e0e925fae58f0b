package com.eainde.research.exception;

/**
 * A stage call failed for a reason that may clear on retry: timeout, rate limit,
 * network trouble. Retried inside the stage executor, never by the engine.
 */
public class TransientStageException extends ResearchException {

    public TransientStageException(String message) {
        super(message);
    }

    public TransientStageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-STAGE-TRANSIENT";
    }
}
