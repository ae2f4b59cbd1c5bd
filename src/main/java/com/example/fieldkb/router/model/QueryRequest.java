package com.example.fieldkb.router.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Inbound request as handed over by a front-end adapter. Attachments only carry text that was
 * already derived from the original payload (OCR, transcripts).
 */
@Value
@Builder(toBuilder = true)
public class QueryRequest {
  String id;
  String text;
  String channel;
  @Builder.Default List<String> attachments = List.of();
  String userId;
  @Builder.Default Instant receivedAt = Instant.now();
  @Builder.Default SafetyFlag safetyFlag = SafetyFlag.NONE;

  /** Request text followed by any attachment text, used for retrieval and gap analysis. */
  public String searchableText() {
    String base = text == null ? "" : text.strip();
    if (attachments == null || attachments.isEmpty()) {
      return base;
    }
    StringBuilder sb = new StringBuilder(base);
    for (String attachment : attachments) {
      if (attachment == null || attachment.isBlank()) continue;
      if (sb.length() > 0) sb.append(' ');
      sb.append(attachment.strip());
    }
    return sb.toString();
  }

  public boolean isFlagged() {
    return safetyFlag != null && safetyFlag.isRaised();
  }
}
