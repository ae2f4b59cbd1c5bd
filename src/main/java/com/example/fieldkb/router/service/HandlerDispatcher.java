package com.example.fieldkb.router.service;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.error.HandlerFailureException;
import com.example.fieldkb.router.handler.HandlerRegistry;
import com.example.fieldkb.router.handler.SpecialistHandler;
import com.example.fieldkb.router.model.Coverage;
import com.example.fieldkb.router.model.EscalationPayload;
import com.example.fieldkb.router.model.HandlerResult;
import com.example.fieldkb.router.model.MatchedItem;
import com.example.fieldkb.router.model.QueryRequest;
import com.example.fieldkb.router.model.Route;
import com.example.fieldkb.router.model.RouteDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Picks the handler for a route and invokes it under the configured timeout. Route D is never
 * dispatched; it produces an {@link EscalationPayload} instead.
 */
@Slf4j
@Service
public class HandlerDispatcher {

    private final HandlerRegistry registry;
    private final RouterProperties.Handler config;
    private final Scheduler scheduler;

    public HandlerDispatcher(HandlerRegistry registry, RouterProperties properties) {
        this(registry, properties, Schedulers.boundedElastic());
    }

    HandlerDispatcher(HandlerRegistry registry, RouterProperties properties, Scheduler scheduler) {
        this.registry = registry;
        this.config = properties.getHandler();
        this.scheduler = scheduler;
    }

    /** Outcome of one dispatch; {@code degraded} is set when the handler failed or timed out. */
    public record Dispatch(String handlerKey, HandlerResult result, boolean degraded) {
    }

    public Mono<Dispatch> dispatch(QueryRequest request, RouteDecision decision) {
        if (decision.route() == Route.D_ESCALATE) {
            return Mono.error(new IllegalArgumentException("Escalated requests are not dispatched to handlers"));
        }
        String key = selectHandlerKey(decision);
        SpecialistHandler handler = resolve(key);
        Coverage coverage = decision.coverage();

        return Mono.fromCallable(() -> handler.handle(request, coverage))
                .subscribeOn(scheduler)
                .timeout(config.getTimeout())
                .map(result -> new Dispatch(key, result, false))
                .onErrorMap(ex -> !(ex instanceof HandlerFailureException), ex -> toFailure(key, ex))
                .onErrorResume(HandlerFailureException.class, ex -> {
                    log.warn("[dispatch] {} for request {}, returning degraded answer", ex.getMessage(), request.getId());
                    HandlerResult degraded = new HandlerResult(config.getDegradedText(), List.of(), coverage.getConfidence());
                    return Mono.just(new Dispatch(key, degraded, true));
                });
    }

    /**
     * Route C uses the fallback handler. Routes A and B use the handler of the vendor, then the
     * equipment type, with the highest summed relevance, if one is registered; otherwise generic.
     */
    public String selectHandlerKey(RouteDecision decision) {
        if (decision.route() == Route.C_FALLBACK) {
            return HandlerRegistry.FALLBACK;
        }
        List<MatchedItem> items = decision.coverage().getMatchedItems();
        String vendor = dominant(items, MatchedItem::getVendor);
        if (vendor != null && registry.contains(vendor)) {
            return vendor;
        }
        String equipment = dominant(items, MatchedItem::getEquipmentType);
        if (equipment != null && registry.contains(equipment)) {
            return equipment;
        }
        return HandlerRegistry.GENERIC;
    }

    public EscalationPayload escalate(QueryRequest request, RouteDecision decision) {
        Coverage coverage = decision.coverage();
        return EscalationPayload.builder()
                .requestId(request.getId())
                .channel(request.getChannel())
                .userId(request.getUserId())
                .reason(decision.reason())
                .safetyFlag(request.getSafetyFlag())
                .coverageLevel(coverage.getLevel())
                .confidence(coverage.getConfidence())
                .build();
    }

    private SpecialistHandler resolve(String key) {
        return registry.find(key).orElseGet(registry::generic);
    }

    private static HandlerFailureException toFailure(String key, Throwable ex) {
        if (ex instanceof TimeoutException) {
            return new HandlerFailureException("Handler '" + key + "' timed out", ex);
        }
        return new HandlerFailureException("Handler '" + key + "' failed: " + ex.getMessage(), ex);
    }

    static String dominant(List<MatchedItem> items, Function<MatchedItem, String> attribute) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (MatchedItem item : items) {
            String value = attribute.apply(item);
            if (value == null || value.isBlank()) continue;
            double relevance = Double.isNaN(item.getRelevance()) ? 0.0 : item.getRelevance();
            totals.merge(value.strip().toLowerCase(Locale.ROOT), relevance, Double::sum);
        }
        String best = null;
        double bestTotal = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> e : totals.entrySet()) {
            if (e.getValue() > bestTotal) {
                best = e.getKey();
                bestTotal = e.getValue();
            }
        }
        return best;
    }
}
