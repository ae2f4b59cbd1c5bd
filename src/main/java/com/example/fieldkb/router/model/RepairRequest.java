package com.example.fieldkb.router.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RepairRequest {
  String fingerprint;
  String queryText;
  String vendorHint;
  String equipmentHint;
  String symptomHint;
  @Builder.Default List<String> searchTerms = List.of();
  /** 0..100 */
  int priority;
}
