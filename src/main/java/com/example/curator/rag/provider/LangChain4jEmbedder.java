package com.example.curator.rag.provider;

import com.example.curator.rag.model.AiProvider;
import com.example.curator.rag.model.QueryEmbedding;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.Objects;

/**
 * Embeds text with the provider's embedding model. No retries and no caching: a failed call
 * fails the query.
 */
public class LangChain4jEmbedder implements Embedder {

    private final AiProvider provider;
    private final EmbeddingModel embeddingModel;
    private final int expectedDimension;

    /**
     * @param expectedDimension vector length the backend holds for this provider, 0 to skip the check
     */
    public LangChain4jEmbedder(AiProvider provider, EmbeddingModel embeddingModel, int expectedDimension) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel");
        this.expectedDimension = expectedDimension;
    }

    @Override
    public AiProvider provider() {
        return provider;
    }

    @Override
    public QueryEmbedding embed(String text) {
        Response<Embedding> response = embeddingModel.embed(text);
        float[] vector = response == null || response.content() == null
                ? new float[0]
                : response.content().vector();

        if (vector.length == 0 || (expectedDimension > 0 && vector.length != expectedDimension)) {
            throw new EmbeddingDimensionMismatchException(provider, expectedDimension, vector.length);
        }
        return new QueryEmbedding(provider, vector);
    }
}
