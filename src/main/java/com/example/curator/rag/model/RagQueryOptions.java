package com.example.curator.rag.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RagQueryOptions {
  /**
   * Result budget; null or non-positive means the configured default.
   */
  Integer maxChunks;
  /**
   * Whether chunk metadata is returned; null means true.
   */
  Boolean includeMetadata;

  public static RagQueryOptions defaults() {
    return RagQueryOptions.builder().build();
  }

  public boolean metadataIncluded() {
    return includeMetadata == null || includeMetadata;
  }
}
