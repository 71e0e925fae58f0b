package com.eainde.research.embedding;

import com.eainde.research.config.ResearchProperties;
import com.eainde.research.memory.SimilaritySearch;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns text into fixed-dimension vectors for the memory store.
 */
@Log4j2
@Service
@RequiredArgsConstructor
public class EmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final ResearchProperties properties;

    public float[] embed(String text) {
        Embedding embedding = embeddingModel.embed(text == null ? "" : text).content();
        float[] vector = embedding.vector();
        SimilaritySearch.checkDimension(vector, properties.getEmbedding().getDimension());
        return vector;
    }

    /**
     * Embedding is an enrichment; when the model is unreachable callers carry on without it.
     */
    public Optional<float[]> tryEmbed(String text) {
        try {
            return Optional.of(embed(text));
        } catch (RuntimeException e) {
            log.warn("Embedding failed, continuing without vector: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
