package com.example.fieldkb.router.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MatchedItem {
  String itemId;
  /** Relevance in [0,1], higher is more relevant. */
  double relevance;
  String vendor;
  String equipmentType;
  String sourceRef;
  /** Optional quality metadata in [0,1]; null when the item carries none. */
  Double quality;
  String content;
}
