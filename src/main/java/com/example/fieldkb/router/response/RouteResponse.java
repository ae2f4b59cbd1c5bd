package com.example.fieldkb.router.response;

import com.example.fieldkb.router.model.Citation;
import com.example.fieldkb.router.model.CoverageLevel;
import com.example.fieldkb.router.model.EscalationPayload;
import com.example.fieldkb.router.model.Route;
import com.example.fieldkb.router.model.StepLog;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteResponse {
  private String requestId;
  private Route route;
  private CoverageLevel coverageLevel;
  private Double confidence;

  private String text;
  private List<Citation> citations;
  private boolean escalated;
  private boolean degraded;
  private String reason;
  private String handler;
  private EscalationPayload escalation;

  private List<StepLog> steps;
  private List<String> notices;
  private List<String> errors;
}
