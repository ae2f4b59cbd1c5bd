package com.example.fieldkb.router.service;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.model.MatchedItem;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Turns a ranked match list into a single confidence value in [0,1].
 *
 * <p>Four signals, each normalized to [0,1] before weighting:
 * <ul>
 *   <li>similarity: mean relevance of the top-k matches</li>
 *   <li>count: {@code min(n, k) / k}</li>
 *   <li>quality: mean quality metadata, neutral when absent</li>
 *   <li>breadth: how focused the matches are on one vendor/equipment, or on the query's own vendor</li>
 * </ul>
 * The score never decreases when similarity or count grows and the other signals stay fixed.
 */
@Component
public class ConfidenceScorer {

  private final RouterProperties.Scoring scoring;

  public ConfidenceScorer(RouterProperties properties) {
    this.scoring = properties.getScoring();
  }

  public double score(List<MatchedItem> matches) {
    return score(matches, null);
  }

  public double score(List<MatchedItem> matches, String vendorHint) {
    return breakdown(matches, vendorHint).confidence();
  }

  public Signals breakdown(List<MatchedItem> matches, String vendorHint) {
    List<MatchedItem> items = nonNull(matches);
    if (items.isEmpty()) {
      return Signals.ZERO;
    }
    double similarity = similarity(items);
    double count = count(items.size());
    double quality = quality(items);
    double breadth = breadth(items, vendorHint);
    double weighted = similarity * scoring.getSimilarityWeight()
        + count * scoring.getCountWeight()
        + quality * scoring.getQualityWeight()
        + breadth * scoring.getBreadthWeight();
    return new Signals(similarity, count, quality, breadth, clamp(weighted));
  }

  private double similarity(List<MatchedItem> items) {
    int k = Math.max(1, scoring.getTopK());
    return items.stream()
        .map(i -> clamp(i.getRelevance()))
        .sorted(Comparator.reverseOrder())
        .limit(k)
        .mapToDouble(Double::doubleValue)
        .average()
        .orElse(0.0);
  }

  private double count(int itemCount) {
    int k = Math.max(1, scoring.getTopK());
    return Math.min(itemCount, k) / (double) k;
  }

  private double quality(List<MatchedItem> items) {
    OptionalDouble mean = items.stream()
        .map(MatchedItem::getQuality)
        .filter(Objects::nonNull)
        .mapToDouble(ConfidenceScorer::clamp)
        .average();
    return mean.isPresent() ? mean.getAsDouble() : clamp(scoring.getNeutralQuality());
  }

  private double breadth(List<MatchedItem> items, String vendorHint) {
    if (vendorHint != null && !vendorHint.isBlank()) {
      String hint = vendorHint.trim().toLowerCase(Locale.ROOT);
      long aligned = items.stream()
          .filter(i -> i.getVendor() != null && hint.equals(i.getVendor().trim().toLowerCase(Locale.ROOT)))
          .count();
      return aligned / (double) items.size();
    }
    Set<String> groups = new HashSet<>();
    for (MatchedItem item : items) {
      String key = groupKey(item);
      if (key != null) {
        groups.add(key);
      }
    }
    if (groups.isEmpty()) {
      return clamp(scoring.getNeutralBreadth());
    }
    return 1.0 / groups.size();
  }

  private static String groupKey(MatchedItem item) {
    String vendor = item.getVendor() == null ? "" : item.getVendor().trim().toLowerCase(Locale.ROOT);
    String equipment = item.getEquipmentType() == null ? "" : item.getEquipmentType().trim().toLowerCase(Locale.ROOT);
    if (vendor.isEmpty() && equipment.isEmpty()) {
      return null;
    }
    return vendor + "|" + equipment;
  }

  private static List<MatchedItem> nonNull(List<MatchedItem> matches) {
    if (matches == null) {
      return List.of();
    }
    return matches.stream().filter(Objects::nonNull).toList();
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }

  public record Signals(double similarity, double count, double quality, double breadth, double confidence) {
    static final Signals ZERO = new Signals(0, 0, 0, 0, 0);

    @Override
    public String toString() {
      return String.format(Locale.ROOT, "sim=%.2f count=%.2f quality=%.2f breadth=%.2f -> %.3f",
          similarity, count, quality, breadth, confidence);
    }
  }
}
