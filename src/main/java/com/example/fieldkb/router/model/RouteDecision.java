package com.example.fieldkb.router.model;

import java.util.Objects;

public record RouteDecision(Route route, Coverage coverage, String reason) {

  public RouteDecision {
    Objects.requireNonNull(route, "route");
    Objects.requireNonNull(coverage, "coverage");
  }

  /** Route C always repairs; thin route B repairs when enabled. */
  public boolean requiresGapRepair(boolean triggerOnThin) {
    if (route == Route.C_FALLBACK) {
      return true;
    }
    return triggerOnThin && route == Route.B_ENRICHED && coverage.getLevel() == CoverageLevel.THIN;
  }
}
