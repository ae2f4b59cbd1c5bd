package com.example.fieldkb.router.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/** Structured hand-off for flagged requests; carries no generated advice. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EscalationPayload {
  String requestId;
  String channel;
  String userId;
  String reason;
  SafetyFlag safetyFlag;
  CoverageLevel coverageLevel;
  double confidence;
}
