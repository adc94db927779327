package com.eainde.productresearch.tools.model;

import com.eainde.productresearch.parsing.JsonResponseParser;
import com.eainde.productresearch.tools.ConnectionDroppedException;
import com.eainde.productresearch.tools.LanguageModelClient;
import com.eainde.productresearch.tools.ToolErrors;
import com.eainde.productresearch.tools.ToolException;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

/**
 * {@link LanguageModelClient} over a langchain4j {@link ChatModel}. Structured calls send the
 * schema as a JSON response format and bind the answer with the tolerant parser.
 */
@Log4j2
public class ChatModelLanguageModelClient implements LanguageModelClient {

    private final ChatModel chatModel;
    private final JsonResponseParser parser;

    public ChatModelLanguageModelClient(ChatModel chatModel, JsonResponseParser parser) {
        this.chatModel = chatModel;
        this.parser = parser;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt))
                .build();
        return send(request);
    }

    @Override
    public <T> T completeStructured(String systemPrompt, String userPrompt, JsonSchema schema, Class<T> type) {
        ChatRequestParameters parameters = ChatRequestParameters.builder()
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(schema)
                        .build())
                .build();
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt))
                .parameters(parameters)
                .build();

        String text = send(request);
        return parser.parse(text, type)
                .orElseThrow(() -> new ToolException("Model answer does not match " + schema.name()));
    }

    private String send(ChatRequest request) {
        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            if (ToolErrors.isConnectionDropped(e)) {
                throw new ConnectionDroppedException("Model connection dropped", e);
            }
            throw new ToolException("Model call failed: " + ToolErrors.describe(e), e);
        }
        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new ToolException("Model returned no text");
        }
        return response.aiMessage().text();
    }
}
