package com.eainde.research.exception;

/**
 * The cache backend could not be reached. Callers treat this as a miss.
 */
public class CacheUnavailableException extends ResearchException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-CACHE-DOWN";
    }
}
