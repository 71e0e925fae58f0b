package com.eainde.research.state;

public enum RunStatus {
    RUNNING,
    STOPPED_BY_GATE,
    FAILED,
    COMPLETED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
