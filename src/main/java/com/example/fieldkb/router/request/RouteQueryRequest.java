package com.example.fieldkb.router.request;

import com.example.fieldkb.router.model.QueryRequest;
import com.example.fieldkb.router.model.SafetyFlag;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
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
public class RouteQueryRequest {
  private String requestId;
  private String text;
  private String channel;
  private String userId;
  private List<String> attachments;
  private SafetyFlag safetyFlag;

  /** Assigns an id when the caller did not send one. */
  public QueryRequest toQueryRequest() {
    return QueryRequest.builder()
        .id(requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId)
        .text(text)
        .channel(channel == null ? "api" : channel)
        .userId(userId)
        .attachments(attachments == null ? List.of() : List.copyOf(attachments))
        .safetyFlag(safetyFlag == null ? SafetyFlag.NONE : safetyFlag)
        .receivedAt(Instant.now())
        .build();
  }
}
