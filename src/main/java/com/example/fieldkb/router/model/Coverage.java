package com.example.fieldkb.router.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Coverage {

  private static final Coverage NONE = Coverage.builder()
      .level(CoverageLevel.NONE)
      .itemCount(0)
      .avgRelevance(0.0)
      .confidence(0.0)
      .matchedItems(List.of())
      .build();

  CoverageLevel level;
  int itemCount;
  double avgRelevance;
  double confidence;
  @Builder.Default List<MatchedItem> matchedItems = List.of();

  /** Coverage used when retrieval failed or returned nothing usable. */
  public static Coverage none() {
    return NONE;
  }
}
