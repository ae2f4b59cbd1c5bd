package com.example.fieldkb.router.service;

import java.util.List;

/** Entity tokens pulled out of a request by {@link QueryEntityExtractor}. */
public record ExtractedEntities(
    List<String> modelTokens,
    List<String> faultCodes,
    String vendor,
    String equipmentType,
    String symptom
) {

  public ExtractedEntities {
    modelTokens = modelTokens == null ? List.of() : List.copyOf(modelTokens);
    faultCodes = faultCodes == null ? List.of() : List.copyOf(faultCodes);
  }

  public boolean isEmpty() {
    return modelTokens.isEmpty() && faultCodes.isEmpty() && vendor == null && equipmentType == null;
  }

  public boolean hasFaultCode() {
    return !faultCodes.isEmpty();
  }
}
