package com.example.curator.rag.provider;

import com.example.curator.rag.model.AiProvider;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import java.util.Objects;

/**
 * Gemini gets a single prompt: the instruction followed by the query.
 */
public class GeminiTextCompleter implements TextCompleter {

    private final ChatModel chatModel;

    public GeminiTextCompleter(ChatModel chatModel) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    }

    @Override
    public AiProvider provider() {
        return AiProvider.GEMINI;
    }

    @Override
    public String complete(String systemInstruction, String userMessage) {
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(UserMessage.from(buildPrompt(systemInstruction, userMessage))))
                .build();
        ChatResponse response = chatModel.chat(request);
        if (response == null || response.aiMessage() == null) {
            return "";
        }
        return Objects.requireNonNullElse(response.aiMessage().text(), "");
    }

    static String buildPrompt(String systemInstruction, String userMessage) {
        return systemInstruction.strip() + "\n\nQuery: " + userMessage;
    }
}
