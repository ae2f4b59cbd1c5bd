package com.example.fieldkb.router.validation;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Service;

/** Runs every registered {@link Validator} in stage order. */
@Service
public class ValidationService {

  private final List<Validator> orderedValidators;

  public ValidationService(List<Validator> validators) {
    List<Validator> safe = validators == null ? List.of() : validators;
    this.orderedValidators = safe.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(Validator::stage))
        .toList();
  }

  public ValidationContext validate(String text) {
    ValidationContext context = new ValidationContext(text);
    for (Validator validator : orderedValidators) {
      validator.validate(context);
    }
    return context;
  }
}
