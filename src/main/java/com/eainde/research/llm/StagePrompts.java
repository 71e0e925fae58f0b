package com.eainde.research.llm;

import com.eainde.research.stage.StageName;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * System and user prompt templates per stage, loaded from
 * {@code prompts/<stage>.system.txt} and {@code prompts/<stage>.user.txt}.
 */
@Log4j2
@Component
public class StagePrompts {

    public record StagePrompt(String system, String userTemplate) {
    }

    private final Map<StageName, StagePrompt> prompts = new EnumMap<>(StageName.class);

    public StagePrompts() {
        for (StageName stage : StageName.values()) {
            prompts.put(stage, new StagePrompt(
                    load("prompts/" + stage.key() + ".system.txt"),
                    load("prompts/" + stage.key() + ".user.txt")));
        }
        log.info("Loaded prompts for {} stages", prompts.size());
    }

    public StagePrompt forStage(StageName stage) {
        return prompts.get(stage);
    }

    private static String load(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        try {
            return resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Missing prompt resource " + path, e);
        }
    }
}
