package com.example.fieldkb.router.model;

/** The four handling strategies a request can end up in. */
public enum Route {
  /** Strong coverage, answer directly from the knowledge store. */
  A_DIRECT("A"),
  /** Moderate or thin coverage, answer with specialist enrichment. */
  B_ENRICHED("B"),
  /** No usable coverage, generic fallback answer plus background repair. */
  C_FALLBACK("C"),
  /** Safety or urgency flag raised, escalate without generated advice. */
  D_ESCALATE("D");

  private final String code;

  Route(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
