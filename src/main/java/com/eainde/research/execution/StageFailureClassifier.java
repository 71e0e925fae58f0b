package com.eainde.research.execution;

import com.eainde.research.exception.PermanentStageException;
import com.eainde.research.exception.TransientStageException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a stage failure is worth retrying.
 */
@Component
public class StageFailureClassifier {

    public FailureKind classify(Throwable failure) {
        Throwable t = unwrap(failure);

        if (t instanceof TransientStageException
                || t instanceof RetriableException
                || t instanceof TimeoutException
                || t instanceof IOException
                || t instanceof UncheckedIOException) {
            return FailureKind.TRANSIENT;
        }
        if (t instanceof PermanentStageException
                || t instanceof NonRetriableException
                || t instanceof IllegalArgumentException) {
            return FailureKind.PERMANENT;
        }
        // langchain4j wraps transport errors; look one level down before giving up
        if (t.getCause() != null && t.getCause() != t) {
            FailureKind cause = classifyDirect(unwrap(t.getCause()));
            if (cause != null) {
                return cause;
            }
        }
        return FailureKind.PERMANENT;
    }

    private FailureKind classifyDirect(Throwable t) {
        if (t instanceof RetriableException || t instanceof TimeoutException
                || t instanceof IOException || t instanceof UncheckedIOException) {
            return FailureKind.TRANSIENT;
        }
        if (t instanceof NonRetriableException) {
            return FailureKind.PERMANENT;
        }
        return null;
    }

    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
