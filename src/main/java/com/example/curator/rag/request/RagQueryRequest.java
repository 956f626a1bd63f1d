package com.example.curator.rag.request;

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
public class RagQueryRequest {
  private String query;
  private Integer maxChunks;
  private Boolean includeMetadata;
}
