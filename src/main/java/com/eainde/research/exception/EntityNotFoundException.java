package com.eainde.research.exception;

public class EntityNotFoundException extends ResearchException {

    public EntityNotFoundException(String entityType, Object identifier) {
        super(String.format("%s with identifier %s not found", entityType, identifier));
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-DB-NOT-FOUND";
    }
}
