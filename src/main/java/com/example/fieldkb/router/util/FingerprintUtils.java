package com.example.fieldkb.router.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.regex.Pattern;

public final class FingerprintUtils {

  private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

  private FingerprintUtils() {}

  /** Lowercases and collapses whitespace. Null becomes the empty string. */
  public static String normalize(String text) {
    if (text == null) {
      return "";
    }
    return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
  }

  /**
   * Stable identity of a gap: normalized query text plus the vendor and equipment tokens that
   * were explicitly detected in it.
   */
  public static String fingerprint(String queryText, String vendor, String equipment) {
    String key = normalize(queryText)
        + "|v=" + normalize(vendor)
        + "|e=" + normalize(equipment);
    return sha256(key);
  }

  public static String sha256(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder(hash.length * 2);
      for (byte b : hash) {
        sb.append(String.format("%02x", b));
      }
      return sb.toString();
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
