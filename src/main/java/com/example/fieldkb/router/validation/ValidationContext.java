package com.example.fieldkb.router.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Text of a routing request as it moves through the validators, plus the notices they attach for
 * the caller.
 */
public class ValidationContext {

  private final String rawText;
  private String processedText;
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(String rawText) {
    this.rawText = rawText;
    this.processedText = rawText;
  }

  public String getRawText() {
    return rawText;
  }

  public String getProcessedText() {
    return processedText;
  }

  public void setProcessedText(String processedText) {
    this.processedText = processedText;
  }

  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }
}
