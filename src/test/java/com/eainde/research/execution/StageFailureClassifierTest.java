package com.eainde.research.execution;

import com.eainde.research.exception.PermanentStageException;
import com.eainde.research.exception.TransientStageException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class StageFailureClassifierTest {

    private final StageFailureClassifier classifier = new StageFailureClassifier();

    @Test
    @DisplayName("timeouts, IO and retriable model errors are transient")
    void transientFailures() {
        assertThat(classifier.classify(new TransientStageException("429"))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify(new RetriableException("overloaded"))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify(new TimeoutException())).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify(new SocketTimeoutException())).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify(new UncheckedIOException(new IOException("reset"))))
                .isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    @DisplayName("validation and non-retriable model errors are permanent")
    void permanentFailures() {
        assertThat(classifier.classify(new PermanentStageException("bad json"))).isEqualTo(FailureKind.PERMANENT);
        assertThat(classifier.classify(new NonRetriableException("401"))).isEqualTo(FailureKind.PERMANENT);
        assertThat(classifier.classify(new IllegalArgumentException("bad"))).isEqualTo(FailureKind.PERMANENT);
    }

    @Test
    @DisplayName("wrapper exceptions are unwrapped before classifying")
    void unwrapsWrappers() {
        assertThat(classifier.classify(new ExecutionException(new IOException("reset"))))
                .isEqualTo(FailureKind.TRANSIENT);
        assertThat(classifier.classify(new CompletionException(new NonRetriableException("403"))))
                .isEqualTo(FailureKind.PERMANENT);
    }

    @Test
    @DisplayName("a transport cause one level down decides the kind")
    void looksOneCauseDown() {
        assertThat(classifier.classify(new RuntimeException("http client", new IOException("eof"))))
                .isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    @DisplayName("unknown errors are permanent")
    void unknownIsPermanent() {
        assertThat(classifier.classify(new IllegalStateException("boom"))).isEqualTo(FailureKind.PERMANENT);
        assertThat(classifier.classify(new NullPointerException())).isEqualTo(FailureKind.PERMANENT);
    }
}
