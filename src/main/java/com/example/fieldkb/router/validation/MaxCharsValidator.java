package com.example.fieldkb.router.validation;

import com.example.fieldkb.router.config.RouterProperties;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Truncates overlong request text and tells the caller it did so. */
@Component
public class MaxCharsValidator implements Validator {

  private final int maxChars;

  @Autowired
  public MaxCharsValidator(RouterProperties properties) {
    this(properties.getValidation().getMaxChars());
  }

  public MaxCharsValidator(int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    this.maxChars = maxChars;
  }

  @Override
  public ValidationStage stage() {
    return ValidationStage.NORMALIZATION;
  }

  @Override
  public void validate(ValidationContext context) {
    String processed = Objects.requireNonNullElse(context.getProcessedText(), "");
    if (processed.length() <= maxChars) {
      return;
    }
    context.setProcessedText(processed.substring(0, maxChars));
    context.addNotice(String.format("Request text truncated to %d characters.", maxChars));
  }
}
