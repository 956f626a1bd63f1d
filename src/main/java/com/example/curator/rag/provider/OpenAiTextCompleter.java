package com.example.curator.rag.provider;

import com.example.curator.rag.model.AiProvider;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import java.util.Objects;

/**
 * Chat completion with a separate system message and user message.
 */
public class OpenAiTextCompleter implements TextCompleter {

    private final ChatModel chatModel;

    public OpenAiTextCompleter(ChatModel chatModel) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    }

    @Override
    public AiProvider provider() {
        return AiProvider.OPENAI;
    }

    @Override
    public String complete(String systemInstruction, String userMessage) {
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(SystemMessage.from(systemInstruction), UserMessage.from(userMessage)))
                .build();
        ChatResponse response = chatModel.chat(request);
        if (response == null || response.aiMessage() == null) {
            return "";
        }
        return Objects.requireNonNullElse(response.aiMessage().text(), "");
    }
}
