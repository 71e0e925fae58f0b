package com.eainde.research.llm;

import com.eainde.research.config.ResearchProperties;
import com.eainde.research.exception.TransientStageException;
import com.eainde.research.execution.StageFunction;
import com.eainde.research.execution.StageRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.input.PromptTemplate;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Default {@link StageFunction}: renders the stage prompt with the request
 * input as JSON and asks the chat model for a JSON answer.
 */
@Log4j2
@Component
public class LlmStageFunction implements StageFunction {

    private final ChatModel chatModel;
    private final StagePrompts stagePrompts;
    private final ChatParameterMapper parameterMapper;
    private final ResearchProperties properties;
    private final ObjectMapper promptMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public LlmStageFunction(ChatModel chatModel,
                            StagePrompts stagePrompts,
                            ChatParameterMapper parameterMapper,
                            ResearchProperties properties) {
        this.chatModel = chatModel;
        this.stagePrompts = stagePrompts;
        this.parameterMapper = parameterMapper;
        this.properties = properties;
    }

    @Override
    public String apply(StageRequest request) throws JsonProcessingException {
        StagePrompts.StagePrompt prompt = stagePrompts.forStage(request.stage());
        String userText = PromptTemplate.from(prompt.userTemplate())
                .apply(Map.of("input", promptMapper.writeValueAsString(request.input())))
                .text();

        ResearchProperties.Llm llm = properties.getLlm();
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(SystemMessage.from(prompt.system()), UserMessage.from(userText))
                .parameters(parameterMapper.toRequestParameters(llm.forStage(request.stage()), llm.getDefaultModel()))
                .build();

        log.debug("[LLM] stage={} promptChars={}", request.stage().key(), userText.length());
        ChatResponse response = chatModel.chat(chatRequest);
        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new TransientStageException("Empty response from model for stage " + request.stage().key());
        }
        return response.aiMessage().text();
    }
}
