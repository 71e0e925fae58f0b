package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One supporting fact of an insight, with an optional source reference.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Evidence(String fact, String source) {

    public static Evidence of(String fact) {
        return new Evidence(fact, null);
    }
}
