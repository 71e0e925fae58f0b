package com.eainde.research.llm;

/**
 * Chat parameters for one stage. Null means "use the model default".
 */
public interface StagePromptConfig {
    String getModelName();
    Double getTemperature();
    Double getTopP();
    Integer getMaxOutputTokens();
    boolean isJsonMode(); // Used to trigger JSON mode
}
