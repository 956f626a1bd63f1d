package com.example.curator.rag.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.curator.rag.model.AiProvider;
import com.example.curator.rag.model.QueryEmbedding;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;

class LangChain4jEmbedderTest {

  private final EmbeddingModel model = mock(EmbeddingModel.class);

  @Test
  void returnsVectorTaggedWithProvider() {
    when(model.embed("rural clinic")).thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));

    QueryEmbedding embedding = new LangChain4jEmbedder(AiProvider.GEMINI, model, 3).embed("rural clinic");

    assertThat(embedding.provider()).isEqualTo(AiProvider.GEMINI);
    assertThat(embedding.vector()).containsExactly(0.1f, 0.2f, 0.3f);
  }

  @Test
  void rejectsVectorOfUnexpectedLength() {
    when(model.embed("q")).thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f})));

    assertThatThrownBy(() -> new LangChain4jEmbedder(AiProvider.OPENAI, model, 1536).embed("q"))
        .isInstanceOf(EmbeddingDimensionMismatchException.class)
        .satisfies(e -> {
          EmbeddingDimensionMismatchException mismatch = (EmbeddingDimensionMismatchException) e;
          assertThat(mismatch.getExpected()).isEqualTo(1536);
          assertThat(mismatch.getActual()).isEqualTo(2);
          assertThat(mismatch.getProvider()).isEqualTo(AiProvider.OPENAI);
        });
  }

  @Test
  void zeroExpectedDimensionSkipsLengthCheck() {
    when(model.embed("q")).thenReturn(Response.from(Embedding.from(new float[] {0.5f, 0.5f})));

    assertThat(new LangChain4jEmbedder(AiProvider.OPENAI, model, 0).embed("q").vector()).hasSize(2);
  }

  @Test
  void emptyVectorIsAlwaysRejected() {
    when(model.embed("q")).thenReturn(Response.from(Embedding.from(new float[0])));

    assertThatThrownBy(() -> new LangChain4jEmbedder(AiProvider.GEMINI, model, 0).embed("q"))
        .isInstanceOf(EmbeddingDimensionMismatchException.class);
  }

  @Test
  void providerFailurePropagates() {
    when(model.embed("q")).thenThrow(new IllegalStateException("401 Unauthorized"));

    assertThatThrownBy(() -> new LangChain4jEmbedder(AiProvider.GEMINI, model, 768).embed("q"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("401 Unauthorized");
  }
}
