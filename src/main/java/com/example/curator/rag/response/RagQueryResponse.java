package com.example.curator.rag.response;

import com.example.curator.rag.model.RagResult;
import com.example.curator.rag.model.RetrievedChunk;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RagQueryResponse {
  private List<RetrievedChunk> chunks;

  @JsonProperty("relevantKBs")
  private List<String> relevantKbs;

  private Integer totalResults;

  @JsonProperty("failedKBs")
  private List<String> failedKbs;

  private String provider;

  private List<String> errors;

  public static RagQueryResponse from(RagResult result) {
    return RagQueryResponse.builder()
        .chunks(result.getChunks())
        .relevantKbs(result.getRelevantKbs())
        .totalResults(result.getTotalResults())
        .failedKbs(result.getFailedKbs())
        .provider(result.getProvider() == null ? null : result.getProvider().value())
        .build();
  }

  public static RagQueryResponse error(String message) {
    return RagQueryResponse.builder().errors(List.of(message)).build();
  }
}
