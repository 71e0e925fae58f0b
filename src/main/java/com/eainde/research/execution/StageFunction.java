package com.eainde.research.execution;

/**
 * An opaque stage: takes a request, returns the raw model output. The default
 * implementation calls an LLM; tests plug in scripted functions.
 */
@FunctionalInterface
public interface StageFunction {

    String apply(StageRequest request) throws Exception;
}
