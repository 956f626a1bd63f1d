package com.example.curator.rag.validation;

/**
 * Carries the raw query through the validators. Validators may replace the processed query.
 */
public class ValidationContext {

  private final String rawQuery;
  private String processedQuery;

  public ValidationContext(String rawQuery) {
    this.rawQuery = rawQuery;
    this.processedQuery = rawQuery;
  }

  public String getRawQuery() {
    return rawQuery;
  }

  public String getProcessedQuery() {
    return processedQuery;
  }

  public void setProcessedQuery(String processedQuery) {
    this.processedQuery = processedQuery;
  }
}
