package com.eainde.research.memory;

import com.eainde.research.model.SimilarityMatch;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Brute-force cosine top-k over vectors stored as JSON.
 */
@Log4j2
public final class SimilaritySearch {

    private SimilaritySearch() {
    }

    public static void checkDimension(float[] vector, int dimension) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalArgumentException("Expected a vector of dimension " + dimension
                    + " but got " + (vector == null ? "null" : vector.length));
        }
    }

    public static <T> List<SimilarityMatch<T>> topK(List<T> candidates,
                                                     Function<T, float[]> vectorOf,
                                                     float[] query,
                                                     int k,
                                                     double minSimilarity) {
        if (k <= 0) {
            return List.of();
        }
        Embedding queryEmbedding = Embedding.from(query);
        List<SimilarityMatch<T>> matches = new ArrayList<>();
        for (T candidate : candidates) {
            float[] vector = vectorOf.apply(candidate);
            if (vector == null) {
                continue;
            }
            if (vector.length != query.length) {
                log.warn("Skipping stored vector of dimension {} (query has {})", vector.length, query.length);
                continue;
            }
            double similarity = CosineSimilarity.between(queryEmbedding, Embedding.from(vector));
            if (similarity >= minSimilarity) {
                matches.add(new SimilarityMatch<>(candidate, similarity));
            }
        }
        matches.sort(Comparator.comparingDouble((SimilarityMatch<T> m) -> m.similarity()).reversed());
        return matches.size() > k ? List.copyOf(matches.subList(0, k)) : List.copyOf(matches);
    }
}
