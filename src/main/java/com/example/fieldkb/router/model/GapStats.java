package com.example.fieldkb.router.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GapStats(
    long totalGaps,
    long resolvedCount,
    long unresolvedCount,
    double resolutionRate,
    double avgFrequency,
    Double avgResolutionHours
) {

  public static GapStats empty() {
    return new GapStats(0, 0, 0, 0.0, 0.0, null);
  }
}
