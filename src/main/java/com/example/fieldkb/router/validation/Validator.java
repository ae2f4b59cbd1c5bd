package com.example.fieldkb.router.validation;

/** A single check applied to an incoming routing request before any component runs. */
public interface Validator {

  ValidationStage stage();

  /** Applies the check and optionally rewrites the text carried by the context. */
  void validate(ValidationContext context);
}
