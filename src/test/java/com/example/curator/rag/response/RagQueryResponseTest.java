package com.example.curator.rag.response;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.curator.rag.model.AiProvider;
import com.example.curator.rag.model.RagResult;
import com.example.curator.rag.model.RetrievedChunk;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RagQueryResponseTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private final RagResult result = RagResult.builder()
      .chunks(List.of(RetrievedChunk.builder()
          .id("1")
          .docType("grants")
          .content("USDA Distance Learning and Telemedicine grant")
          .metadata(Map.of("source", "usda.pdf"))
          .similarity(0.9)
          .build()))
      .relevantKbs(List.of("grants"))
      .totalResults(1)
      .failedKbs(List.of())
      .provider(AiProvider.GEMINI)
      .build();

  @Test
  void metadataLeftOutIsAbsentFromJson() throws Exception {
    String json = objectMapper.writeValueAsString(RagQueryResponse.from(result.withoutMetadata()));

    assertThat(json).doesNotContain("\"metadata\"");
    assertThat(json).contains("\"content\":\"USDA Distance Learning and Telemedicine grant\"");
    assertThat(json).contains("\"relevantKBs\":[\"grants\"]");
    assertThat(json).doesNotContain("\"errors\"");
  }

  @Test
  void metadataIsSerializedByDefault() throws Exception {
    String json = objectMapper.writeValueAsString(RagQueryResponse.from(result));

    assertThat(json).contains("\"metadata\":{\"source\":\"usda.pdf\"}");
    assertThat(json).contains("\"provider\":\"gemini\"");
  }
}
