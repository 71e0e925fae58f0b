package com.eainde.research.execution;

public enum FailureKind {
    /** May clear on retry. */
    TRANSIENT,
    /** Retrying cannot fix it. */
    PERMANENT,
    /** A durable write failed. */
    PERSISTENCE,
    /** The run exceeded its overall time budget. */
    RUN_TIMEOUT
}
