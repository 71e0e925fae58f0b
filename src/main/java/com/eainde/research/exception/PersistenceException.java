package com.eainde.research.exception;

/**
 * A durable write to the memory store failed. Always fatal to the pipeline run
 * that issued it.
 */
public class PersistenceException extends ResearchException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-DB-WRITE";
    }
}
