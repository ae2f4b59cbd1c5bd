package com.example.fieldkb.router.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@Accessors(chain = true, fluent = false)
public class RoutingContext {
  // input
  private QueryRequest request;
  private List<String> validationNotices = new ArrayList<>();

  // evaluation
  private Coverage coverage;
  private RouteDecision decision;

  // answer
  private String handlerKey;
  private HandlerResult result;
  private EscalationPayload escalation;
  private boolean degraded;

  // audit trail
  private Instant startedAt = Instant.now();
  private List<StepLog> steps = new ArrayList<>();

  public RoutingContext addStep(String name, String note) {
    steps.add(new StepLog().setName(name).setNote(note).setAt(Instant.now()));
    return this;
  }
}
