package com.example.curator.rag.config;

import com.example.curator.rag.model.AiProvider;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * Binds properties:
 *
 * curator.ai.default-provider=gemini
 * curator.ai.openai.api-key=...
 * curator.ai.openai.chat-model=gpt-4o-mini
 * curator.ai.gemini.embedding-model=text-embedding-004
 *
 * API keys are secrets: never log them.
 */
@Data
@ConfigurationProperties(prefix = "curator.ai")
public class AiProviderProperties {

    /**
     * Provider used when the settings store has no usable ai_provider entry.
     */
    private AiProvider defaultProvider = AiProvider.GEMINI;

    private ProviderSettings openai = ProviderSettings.of("gpt-4o-mini", "text-embedding-3-small", 1536);

    private ProviderSettings gemini = ProviderSettings.of("gemini-1.5-flash", "text-embedding-004", 768);

    @Data
    public static class ProviderSettings {

        private String apiKey;

        /**
         * Optional endpoint override, e.g. an OpenAI-compatible gateway.
         */
        private String baseUrl;

        private String chatModel;

        private String embeddingModel;

        /**
         * Vector length the match_documents rows were populated with for this provider.
         * 0 disables the check.
         */
        private int embeddingDimension;

        private Duration timeout = Duration.ofSeconds(60);

        /**
         * Retries performed by the client itself. Query stages never retry on their own.
         */
        private int maxRetries = 0;

        static ProviderSettings of(String chatModel, String embeddingModel, int embeddingDimension) {
            ProviderSettings settings = new ProviderSettings();
            settings.setChatModel(chatModel);
            settings.setEmbeddingModel(embeddingModel);
            settings.setEmbeddingDimension(embeddingDimension);
            return settings;
        }

        public boolean isConfigured() {
            return StringUtils.hasText(apiKey);
        }
    }
}
