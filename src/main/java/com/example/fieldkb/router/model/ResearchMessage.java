package com.example.fieldkb.router.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/** Message handed to the ingestion pipeline's research queue. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResearchMessage(
    Long gapId,
    List<String> searchTerms,
    int priority,
    String vendorHint,
    String equipmentHint
) {

  public ResearchMessage {
    searchTerms = searchTerms == null ? List.of() : List.copyOf(searchTerms);
  }
}
