package com.eainde.research.exception;

/**
 * A stage call failed in a way retrying cannot fix: malformed input, rejected
 * credentials, output that does not match the stage schema.
 */
public class PermanentStageException extends ResearchException {

    public PermanentStageException(String message) {
        super(message);
    }

    public PermanentStageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-STAGE-PERMANENT";
    }
}
