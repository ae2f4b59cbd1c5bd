package com.example.fieldkb.router.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.handler.HandlerRegistry;
import com.example.fieldkb.router.handler.SpecialistHandler;
import com.example.fieldkb.router.model.Coverage;
import com.example.fieldkb.router.model.CoverageLevel;
import com.example.fieldkb.router.model.EscalationPayload;
import com.example.fieldkb.router.model.HandlerResult;
import com.example.fieldkb.router.model.MatchedItem;
import com.example.fieldkb.router.model.QueryRequest;
import com.example.fieldkb.router.model.Route;
import com.example.fieldkb.router.model.RouteDecision;
import com.example.fieldkb.router.model.SafetyFlag;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class HandlerDispatcherTest {

  private final RouterProperties properties = new RouterProperties();
  private final Map<String, AtomicInteger> calls = new LinkedHashMap<>();
  private HandlerRegistry registry;

  @BeforeEach
  void setUp() {
    Map<String, SpecialistHandler> handlers = new LinkedHashMap<>();
    handlers.put("generic", counting("generic"));
    handlers.put("fallback", counting("fallback"));
    handlers.put("siemens", counting("siemens"));
    handlers.put("plc", counting("plc"));
    registry = new HandlerRegistry(handlers);
    properties.getHandler().setTimeout(Duration.ofMillis(200));
  }

  private SpecialistHandler counting(String name) {
    AtomicInteger counter = calls.computeIfAbsent(name, k -> new AtomicInteger());
    return (request, coverage) -> {
      counter.incrementAndGet();
      return new HandlerResult(name + " answer", List.of(), coverage.getConfidence());
    };
  }

  private static MatchedItem item(double relevance, String vendor, String equipment) {
    return MatchedItem.builder().itemId("kb").relevance(relevance).vendor(vendor).equipmentType(equipment).build();
  }

  private static RouteDecision decision(Route route, List<MatchedItem> items) {
    Coverage coverage = Coverage.builder()
        .level(CoverageLevel.MODERATE).itemCount(items.size()).avgRelevance(0.7).confidence(0.7)
        .matchedItems(items).build();
    return new RouteDecision(route, coverage, "test");
  }

  private static QueryRequest request() {
    return QueryRequest.builder().id("req-9").text("question").channel("whatsapp").userId("tech-1").build();
  }

  @Test
  void picksVendorWithHighestSummedRelevance() {
    HandlerDispatcher dispatcher = new HandlerDispatcher(registry, properties);
    RouteDecision decision = decision(Route.B_ENRICHED, List.of(
        item(0.9, "rockwell", "drive"),
        item(0.6, "siemens", "drive"),
        item(0.6, "siemens", "drive")));

    assertThat(dispatcher.selectHandlerKey(decision)).isEqualTo("siemens");
  }

  @Test
  void fallsBackToEquipmentThenGeneric() {
    HandlerDispatcher dispatcher = new HandlerDispatcher(registry, properties);

    assertThat(dispatcher.selectHandlerKey(decision(Route.A_DIRECT, List.of(item(0.9, "abb", "plc")))))
        .isEqualTo("plc");
    assertThat(dispatcher.selectHandlerKey(decision(Route.A_DIRECT, List.of(item(0.9, "abb", "motor")))))
        .isEqualTo("generic");
    assertThat(dispatcher.selectHandlerKey(decision(Route.A_DIRECT, List.of())))
        .isEqualTo("generic");
  }

  @Test
  void fallbackRouteUsesFallbackHandler() {
    HandlerDispatcher dispatcher = new HandlerDispatcher(registry, properties);

    HandlerDispatcher.Dispatch dispatch =
        dispatcher.dispatch(request(), decision(Route.C_FALLBACK, List.of(item(0.9, "siemens", "drive")))).block();

    assertThat(dispatch).isNotNull();
    assertThat(dispatch.handlerKey()).isEqualTo("fallback");
    assertThat(dispatch.result().text()).isEqualTo("fallback answer");
    assertThat(dispatch.degraded()).isFalse();
    assertThat(calls.get("fallback")).hasValue(1);
  }

  @Test
  void failingHandlerReturnsDegradedText() {
    Map<String, SpecialistHandler> handlers = Map.of("generic", (request, coverage) -> {
      throw new IllegalStateException("model unavailable");
    });
    HandlerDispatcher dispatcher = new HandlerDispatcher(new HandlerRegistry(handlers), properties);

    StepVerifier.create(dispatcher.dispatch(request(), decision(Route.A_DIRECT, List.of())))
        .expectNextMatches(d -> d.degraded()
            && d.result().text().equals(properties.getHandler().getDegradedText())
            && d.handlerKey().equals("generic"))
        .verifyComplete();
  }

  @Test
  void slowHandlerTimesOutToDegradedText() {
    Map<String, SpecialistHandler> handlers = Map.of("generic", (request, coverage) -> {
      try {
        Thread.sleep(2_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return new HandlerResult("too late", List.of(), 1.0);
    });
    HandlerDispatcher dispatcher = new HandlerDispatcher(new HandlerRegistry(handlers), properties);

    StepVerifier.create(dispatcher.dispatch(request(), decision(Route.B_ENRICHED, List.of())))
        .expectNextMatches(HandlerDispatcher.Dispatch::degraded)
        .verifyComplete();
  }

  @Test
  void escalationNeverInvokesHandler() {
    HandlerDispatcher dispatcher = new HandlerDispatcher(registry, properties);
    QueryRequest flagged = request().toBuilder().safetyFlag(SafetyFlag.SAFETY).build();
    RouteDecision decision = decision(Route.D_ESCALATE, List.of(item(0.9, "siemens", "drive")));

    EscalationPayload payload = dispatcher.escalate(flagged, decision);

    assertThat(payload.getRequestId()).isEqualTo("req-9");
    assertThat(payload.getChannel()).isEqualTo("whatsapp");
    assertThat(payload.getUserId()).isEqualTo("tech-1");
    assertThat(payload.getSafetyFlag()).isEqualTo(SafetyFlag.SAFETY);
    assertThat(payload.getCoverageLevel()).isEqualTo(CoverageLevel.MODERATE);
    StepVerifier.create(dispatcher.dispatch(flagged, decision))
        .expectError(IllegalArgumentException.class)
        .verify();
    assertThat(calls.values()).allMatch(c -> c.get() == 0);
  }
}
