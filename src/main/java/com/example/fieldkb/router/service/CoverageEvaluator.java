package com.example.fieldkb.router.service;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.model.Coverage;
import com.example.fieldkb.router.model.CoverageLevel;
import com.example.fieldkb.router.model.MatchedItem;
import com.example.fieldkb.router.model.QueryRequest;
import com.example.fieldkb.router.retrieval.RetrievalClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Calls retrieval once per request, scores the matches and classifies the coverage. The
 * returned Mono never errors: a failed or slow retrieval degrades to {@link Coverage#none()}.
 */
@Slf4j
@Service
public class CoverageEvaluator {

  private final RetrievalClient retrievalClient;
  private final ConfidenceScorer scorer;
  private final QueryEntityExtractor extractor;
  private final RouterProperties.Coverage thresholds;
  private final RouterProperties.Retrieval retrieval;
  private final Scheduler scheduler;

  public CoverageEvaluator(RetrievalClient retrievalClient,
                           ConfidenceScorer scorer,
                           QueryEntityExtractor extractor,
                           RouterProperties properties) {
    this(retrievalClient, scorer, extractor, properties, Schedulers.boundedElastic());
  }

  CoverageEvaluator(RetrievalClient retrievalClient,
                    ConfidenceScorer scorer,
                    QueryEntityExtractor extractor,
                    RouterProperties properties,
                    Scheduler scheduler) {
    this.retrievalClient = retrievalClient;
    this.scorer = scorer;
    this.extractor = extractor;
    this.thresholds = properties.getCoverage();
    this.retrieval = properties.getRetrieval();
    this.scheduler = scheduler;
  }

  public Mono<Coverage> evaluate(QueryRequest request) {
    String text = request.searchableText();
    Duration timeout = retrieval.getTimeout();
    return Mono.fromCallable(() -> retrievalClient.search(text, retrieval.getMaxResults(), timeout))
        .subscribeOn(scheduler)
        .timeout(timeout)
        .map(matches -> toCoverage(matches, extractor.detectVendor(text)))
        .onErrorResume(ex -> {
          log.warn("[coverage] Retrieval failed for request {}, degrading to NONE – {}",
              request.getId(), ex.toString());
          return Mono.just(Coverage.none());
        });
  }

  Coverage toCoverage(List<MatchedItem> matches, String vendorHint) {
    List<MatchedItem> items = matches == null ? List.of() : matches;
    if (items.isEmpty()) {
      return Coverage.none();
    }
    ConfidenceScorer.Signals signals = scorer.breakdown(items, vendorHint);
    double avgRelevance = items.stream().mapToDouble(MatchedItem::getRelevance).average().orElse(0.0);
    CoverageLevel level = classify(signals.confidence());
    log.debug("[coverage] items={} vendorHint={} {} level={}", items.size(), vendorHint, signals, level);
    return Coverage.builder()
        .level(level)
        .itemCount(items.size())
        .avgRelevance(avgRelevance)
        .confidence(signals.confidence())
        .matchedItems(List.copyOf(items))
        .build();
  }

  public CoverageLevel classify(double confidence) {
    if (confidence >= thresholds.getStrong()) {
      return CoverageLevel.STRONG;
    }
    if (confidence >= thresholds.getModerate()) {
      return CoverageLevel.MODERATE;
    }
    if (confidence >= thresholds.getThin()) {
      return CoverageLevel.THIN;
    }
    return CoverageLevel.NONE;
  }
}
