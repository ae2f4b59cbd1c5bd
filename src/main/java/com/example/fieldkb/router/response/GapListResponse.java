package com.example.fieldkb.router.response;

import com.example.fieldkb.router.model.GapRecord;
import java.util.List;

public record GapListResponse(int count, List<GapRecord> gaps) {

  public static GapListResponse of(List<GapRecord> gaps) {
    return new GapListResponse(gaps.size(), List.copyOf(gaps));
  }
}
