package com.example.curator.rag.validation;

import com.example.curator.rag.config.RagProperties;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Rejects queries longer than the configured character limit. */
@Component
@Order(10)
public class MaxQueryLengthValidator implements Validator {

  private final int maxChars;

  @Autowired
  public MaxQueryLengthValidator(RagProperties properties) {
    this(properties.getMaxQueryChars());
  }

  public MaxQueryLengthValidator(int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    this.maxChars = maxChars;
  }

  @Override
  public void validate(ValidationContext context) {
    String processed = Objects.requireNonNullElse(context.getProcessedQuery(), "");
    if (processed.length() > maxChars) {
      throw new ValidationException(
          String.format("Query must not exceed %d characters (got %d).", maxChars, processed.length()));
    }
  }
}
