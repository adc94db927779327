package com.eainde.productresearch.tools;

import dev.langchain4j.model.chat.request.json.JsonSchema;

/**
 * Chat completion used for relevance filtering, fallback validation and the structured all-fields search.
 */
public interface LanguageModelClient {

    String complete(String systemPrompt, String userPrompt);

    /**
     * Asks for an answer that conforms to {@code schema} and binds it to {@code type}.
     *
     * @throws ToolException when the call fails or the answer does not bind
     */
    <T> T completeStructured(String systemPrompt, String userPrompt, JsonSchema schema, Class<T> type);
}
