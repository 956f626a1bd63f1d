package com.example.curator.rag.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RagResult {
  /**
   * Similarity-descending, at most maxChunks entries.
   */
  List<RetrievedChunk> chunks;
  /**
   * Every knowledge base the query was fanned out to, failed ones included.
   */
  List<String> relevantKbs;
  /**
   * Number of chunks before truncation.
   */
  int totalResults;
  List<String> failedKbs;
  AiProvider provider;

  public RagResult withoutMetadata() {
    return toBuilder()
        .chunks(chunks.stream().map(c -> c.toBuilder().metadata(null).build()).toList())
        .build();
  }
}
