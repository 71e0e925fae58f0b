package com.eainde.research.execution;

import com.eainde.research.exception.PermanentStageException;
import com.eainde.research.stage.StageName;
import com.eainde.research.stage.StageOutput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

/**
 * Strict decoding of raw stage output into the stage's typed record.
 * Anything that does not parse or does not validate is a permanent failure.
 */
@Component
public class StageOutputDecoder {

    private final ObjectMapper mapper;

    public StageOutputDecoder() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public StageOutput decode(StageName stage, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new PermanentStageException("Stage " + stage.key() + " returned an empty response");
        }
        StageOutput output;
        try {
            output = mapper.readValue(stripFences(raw), stage.outputType());
        } catch (JsonProcessingException e) {
            throw new PermanentStageException(
                    "Stage " + stage.key() + " returned malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (output == null) {
            throw new PermanentStageException("Stage " + stage.key() + " returned null");
        }
        try {
            output.validate();
        } catch (IllegalArgumentException e) {
            throw new PermanentStageException("Stage " + stage.key() + " output rejected: " + e.getMessage(), e);
        }
        return output;
    }

    /**
     * Canonical JSON of a decoded output, as stored in the cache.
     */
    public String encode(StageOutput output) {
        try {
            return mapper.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stage output", e);
        }
    }

    // Models like to wrap JSON in markdown fences even in JSON mode.
    static String stripFences(String raw) {
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        return text.trim();
    }
}
