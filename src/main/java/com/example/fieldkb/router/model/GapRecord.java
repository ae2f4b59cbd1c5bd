package com.example.fieldkb.router.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Value
@Builder(toBuilder = true)
public class GapRecord {
  Long id;
  String queryFingerprint;
  String queryText;
  String vendor;
  String equipment;
  String symptom;
  int frequency;
  int priority;
  Instant firstSeenAt;
  Instant lastSeenAt;
  boolean resolved;
  Instant resolvedAt;
  @Builder.Default List<String> resolutionRefs = List.of();
  Instant researchQueuedAt;
  /** True when the store was unavailable and this record only lives in memory. */
  boolean synthetic;
}
