package com.example.fieldkb.router.validation;

/** Order in which validators run. */
public enum ValidationStage {
  /** Rejects requests that cannot be routed at all. */
  STRUCTURE,
  /** Rewrites acceptable input, e.g. truncation. */
  NORMALIZATION
}
