package com.example.curator.rag.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One passage returned by match_documents.
 */
@Value
@Builder(toBuilder = true)
public class RetrievedChunk {
  String id;
  String docType;
  String content;
  /**
   * Absent from the JSON when the caller asked for no metadata.
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  Map<String, Object> metadata;
  /**
   * Higher is more relevant.
   */
  double similarity;
}
