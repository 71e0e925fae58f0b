package com.eainde.research.model;

public record SimilarityMatch<T>(T item, double similarity) {
}
