package com.example.curator.rag.validation;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Rejects null or blank queries and strips surrounding whitespace. */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class NotBlankQueryValidator implements Validator {

  @Override
  public void validate(ValidationContext context) {
    String raw = context.getRawQuery();
    if (raw == null || raw.isBlank()) {
      throw new ValidationException("Query must not be blank.");
    }
    context.setProcessedQuery(raw.strip());
  }
}
