package com.example.curator.rag.validation;

import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Runs every registered {@link Validator} against an incoming query, in the order Spring
 * injected them.
 */
@Service
public class ValidationService {

  private final List<Validator> validators;

  public ValidationService(List<Validator> validators) {
    this.validators = validators == null
        ? List.of()
        : validators.stream().filter(Objects::nonNull).toList();
  }

  /** Returns the query to retrieve with, or throws {@link ValidationException}. */
  public String validate(String rawQuery) {
    ValidationContext context = new ValidationContext(rawQuery);
    for (Validator validator : validators) {
      validator.validate(context);
    }
    return context.getProcessedQuery();
  }
}
