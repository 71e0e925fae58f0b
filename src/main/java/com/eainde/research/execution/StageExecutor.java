package com.eainde.research.execution;

import com.eainde.research.cache.CacheKeys;
import com.eainde.research.cache.CacheStore;
import com.eainde.research.config.ResearchProperties;
import com.eainde.research.exception.CacheUnavailableException;
import com.eainde.research.exception.PermanentStageException;
import com.eainde.research.exception.TransientStageException;
import com.eainde.research.stage.StageName;
import com.eainde.research.stage.StageOutput;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes one opaque stage call with caching, a bounded timeout, retry of
 * transient failures and strict decoding of the result.
 * <p>
 * The executor never sees or touches the research state; it is a pure
 * {@code request -> result} step, which is what lets the engine retry, resume
 * and fan out without coordinating with it.
 * </p>
 */
@Log4j2
@Component
public class StageExecutor {

    private final StageFunction stageFunction;
    private final CacheStore cache;
    private final StageOutputDecoder decoder;
    private final StageFailureClassifier classifier;
    private final ExecutorService callExecutor;
    private final ResearchProperties properties;

    public StageExecutor(StageFunction stageFunction,
                         CacheStore cache,
                         StageOutputDecoder decoder,
                         StageFailureClassifier classifier,
                         @Qualifier("stageCallExecutor") ExecutorService callExecutor,
                         ResearchProperties properties) {
        this.stageFunction = stageFunction;
        this.cache = cache;
        this.decoder = decoder;
        this.classifier = classifier;
        this.callExecutor = callExecutor;
        this.properties = properties;
    }

    public StageResult execute(StageRequest request) {
        StageName stage = request.stage();

        List<String> missing = stage.requiredInputs().stream()
                .filter(key -> !request.input().containsKey(key))
                .toList();
        if (!missing.isEmpty()) {
            return fail(stage, FailureKind.PERMANENT, "Missing required input " + missing, 0);
        }

        String key;
        try {
            key = CacheKeys.fingerprint(stage.key(), request.input());
        } catch (IllegalArgumentException e) {
            return fail(stage, FailureKind.PERMANENT, e.getMessage(), 0);
        }

        Optional<StageOutput> cached = readCache(stage, key);
        if (cached.isPresent()) {
            log.debug("[Stage] {} served from cache key={}", stage.key(), key);
            return StageResult.success(stage, cached.get(), true, 0);
        }

        ResearchProperties.Pipeline pipeline = properties.getPipeline();
        int maxAttempts = Math.max(1, pipeline.getMaxAttempts());

        for (int attempt = 1; ; attempt++) {
            try {
                String raw = callWithTimeout(request, pipeline.getStageTimeout());
                StageOutput output = decoder.decode(stage, raw);
                writeCache(stage, key, output);
                log.info("[Stage] {} succeeded attempt={}", stage.key(), attempt);
                return StageResult.success(stage, output, false, attempt);
            } catch (Exception e) {
                FailureKind kind = classifier.classify(e);
                String message = describe(e);
                if (kind != FailureKind.TRANSIENT || attempt >= maxAttempts) {
                    log.warn("[Stage] {} failed kind={} attempts={} error={}", stage.key(), kind, attempt, message);
                    return fail(stage, kind, message, attempt);
                }
                Duration delay = backoff(attempt, pipeline.getInitialBackoff(), pipeline.getMaxBackoff());
                log.warn("[Stage] {} transient failure attempt={} retryIn={}ms error={}",
                        stage.key(), attempt, delay.toMillis(), message);
                if (!sleep(delay)) {
                    return fail(stage, FailureKind.TRANSIENT, "Interrupted while backing off: " + message, attempt);
                }
            }
        }
    }

    private String callWithTimeout(StageRequest request, Duration timeout) throws Exception {
        Future<String> future = callExecutor.submit(() -> stageFunction.apply(request));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientStageException(
                    "Stage " + request.stage().key() + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TransientStageException("Interrupted waiting for stage " + request.stage().key(), e);
        }
    }

    private Optional<StageOutput> readCache(StageName stage, String key) {
        Optional<String> hit;
        try {
            hit = cache.get(key);
        } catch (CacheUnavailableException e) {
            log.warn("[Cache] unavailable, treating {} as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
        if (hit.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(decoder.decode(stage, hit.get()));
        } catch (PermanentStageException e) {
            log.warn("[Cache] dropping undecodable entry {}: {}", key, e.getMessage());
            try {
                cache.invalidate(key);
            } catch (CacheUnavailableException unavailable) {
                log.debug("[Cache] invalidate skipped, backend unavailable");
            }
            return Optional.empty();
        }
    }

    private void writeCache(StageName stage, String key, StageOutput output) {
        try {
            cache.put(key, decoder.encode(output), properties.getCache().ttlFor(stage));
        } catch (CacheUnavailableException e) {
            log.warn("[Cache] unavailable, result of {} not cached: {}", stage.key(), e.getMessage());
        }
    }

    private static StageResult fail(StageName stage, FailureKind kind, String message, int attempts) {
        return StageResult.failure(new StageError(stage.key(), kind, message, attempts));
    }

    static Duration backoff(int attempt, Duration initial, Duration max) {
        long initialMs = initial == null ? 0 : initial.toMillis();
        long maxMs = max == null ? Long.MAX_VALUE : max.toMillis();
        long delay = initialMs << Math.min(attempt - 1, 30);
        return Duration.ofMillis(Math.min(Math.max(delay, 0), maxMs));
    }

    private static boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(Throwable t) {
        Throwable root = StageFailureClassifier.unwrap(t);
        String message = root.getMessage();
        return root.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
