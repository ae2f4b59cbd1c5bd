package com.example.fieldkb.router.model;

import java.util.List;

/** Output of a specialist handler, returned to the caller verbatim. */
public record HandlerResult(String text, List<Citation> citations, double confidence) {

  public HandlerResult {
    citations = citations == null ? List.of() : List.copyOf(citations);
  }
}
