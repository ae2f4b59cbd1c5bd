package com.example.fieldkb.router.validation;

import org.springframework.stereotype.Component;

/** Rejects a request whose text is missing or blank. */
@Component
public class NotBlankTextValidator implements Validator {

  static final String MESSAGE = "Request text must not be blank.";

  @Override
  public ValidationStage stage() {
    return ValidationStage.STRUCTURE;
  }

  @Override
  public void validate(ValidationContext context) {
    String raw = context.getRawText();
    if (raw == null || raw.isBlank()) {
      throw new ValidationException(MESSAGE);
    }
    context.setProcessedText(raw.strip());
  }
}
