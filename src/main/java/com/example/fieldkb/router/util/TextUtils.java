package com.example.fieldkb.router.util;

public final class TextUtils {

  private TextUtils() {}

  public static String safe(String s) {
    return s == null ? "" : s;
  }

  public static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  public static String clip(String text, int maxChars) {
    if (text == null) return null;
    String trimmed = text.strip();
    if (trimmed.length() <= maxChars) {
      return trimmed;
    }
    return trimmed.substring(0, maxChars) + "...";
  }

  public static String firstNonBlank(String... ss) {
    for (String s : ss) {
      if (!isBlank(s)) {
        return s;
      }
    }
    return null;
  }
}
