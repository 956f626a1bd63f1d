package com.example.curator.rag.validation;

/** A check applied to the user query before retrieval starts. Executed in {@code @Order} order. */
public interface Validator {

  /** Applies the check, throwing {@link ValidationException} to reject the query. */
  void validate(ValidationContext context);
}
