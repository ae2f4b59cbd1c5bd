package com.example.fieldkb.router.service;

import com.example.fieldkb.router.model.Coverage;
import com.example.fieldkb.router.model.CoverageLevel;
import com.example.fieldkb.router.model.QueryRequest;
import com.example.fieldkb.router.model.Route;
import com.example.fieldkb.router.model.RouteDecision;
import org.springframework.stereotype.Component;

import java.util.Locale;

/** Pure mapping from (coverage level, safety flag) to a route. No I/O, no state. */
@Component
public class RouteDecisionEngine {

  public RouteDecision decide(Coverage coverage, QueryRequest request) {
    Coverage effective = coverage == null ? Coverage.none() : coverage;
    boolean flagged = request != null && request.isFlagged();
    Route route = route(effective.getLevel(), flagged);
    return new RouteDecision(route, effective, reason(effective.getLevel(), flagged, request));
  }

  public static Route route(CoverageLevel level, boolean flagged) {
    if (flagged) {
      return Route.D_ESCALATE;
    }
    CoverageLevel effective = level == null ? CoverageLevel.NONE : level;
    return switch (effective) {
      case STRONG -> Route.A_DIRECT;
      case MODERATE, THIN -> Route.B_ENRICHED;
      case NONE -> Route.C_FALLBACK;
    };
  }

  private static String reason(CoverageLevel level, boolean flagged, QueryRequest request) {
    if (flagged) {
      return "flag=" + request.getSafetyFlag().name().toLowerCase(Locale.ROOT) + ", coverage=" + level;
    }
    return "coverage=" + level;
  }
}
