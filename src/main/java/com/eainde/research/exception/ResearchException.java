package com.eainde.research.exception;

import lombok.Getter;

/**
 * Base exception for the research pipeline. Carries a stable error code so
 * failures can be recorded in checkpoints and returned over REST.
 */
@Getter
public abstract class ResearchException extends RuntimeException {

    private final String errorCode;

    protected ResearchException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected ResearchException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
