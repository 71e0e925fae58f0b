package com.eainde.research.llm;

import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.DefaultChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import org.springframework.stereotype.Component;

@Component
public class ChatParameterMapper {

    public ChatRequestParameters toRequestParameters(StagePromptConfig config, String defaultModel) {
        DefaultChatRequestParameters.Builder<?> builder = ChatRequestParameters.builder();

        if (config == null) {
            return builder.modelName(defaultModel).build();
        }

        builder.modelName(config.getModelName() != null ? config.getModelName() : defaultModel);
        if (config.getMaxOutputTokens() != null) {
            builder.maxOutputTokens(config.getMaxOutputTokens());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        if (config.getTopP() != null) {
            builder.topP(config.getTopP());
        }

        // JSON mode; the decoder still validates the shape
        if (config.isJsonMode()) {
            builder.responseFormat(ResponseFormat.builder()
                    .type(ResponseFormatType.JSON)
                    .build());
        }

        return builder.build();
    }
}
