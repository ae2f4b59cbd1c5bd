package com.example.fieldkb.router.service;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.model.Coverage;
import com.example.fieldkb.router.model.HandlerResult;
import com.example.fieldkb.router.model.QueryRequest;
import com.example.fieldkb.router.model.Route;
import com.example.fieldkb.router.model.RouteDecision;
import com.example.fieldkb.router.model.RoutingContext;
import com.example.fieldkb.router.response.RouteResponse;
import com.example.fieldkb.router.validation.ValidationContext;
import com.example.fieldkb.router.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

/**
 * Entry point for routing: validate, evaluate coverage, decide, then answer or escalate.
 *
 * <p>When the decision calls for gap repair, the repair pipeline is handed to the background
 * scheduler once the response is ready, or when the caller cancels after the decision was made.
 * The response never waits for it.
 */
@Slf4j
@Service
public class QueryRouter {

    private final ValidationService validationService;
    private final CoverageEvaluator coverageEvaluator;
    private final RouteDecisionEngine decisionEngine;
    private final HandlerDispatcher dispatcher;
    private final GapRepairPipeline gapRepairPipeline;
    private final Scheduler gapRepairScheduler;
    private final RouterProperties properties;

    public QueryRouter(ValidationService validationService,
                       CoverageEvaluator coverageEvaluator,
                       RouteDecisionEngine decisionEngine,
                       HandlerDispatcher dispatcher,
                       GapRepairPipeline gapRepairPipeline,
                       @Qualifier("gapRepairScheduler") Scheduler gapRepairScheduler,
                       RouterProperties properties) {
        this.validationService = validationService;
        this.coverageEvaluator = coverageEvaluator;
        this.decisionEngine = decisionEngine;
        this.dispatcher = dispatcher;
        this.gapRepairPipeline = gapRepairPipeline;
        this.gapRepairScheduler = gapRepairScheduler;
        this.properties = properties;
    }

    public Mono<RouteResponse> route(QueryRequest request) {
        return Mono.defer(() -> {
            RoutingContext ctx = new RoutingContext();
            ValidationContext validation = validationService.validate(request.getText());
            QueryRequest validated = request.toBuilder().text(validation.getProcessedText()).build();
            ctx.setRequest(validated);
            ctx.getValidationNotices().addAll(validation.getNotices());
            ctx.addStep("validate", validation.getNotices().isEmpty() ? "ok" : String.join("; ", validation.getNotices()));

            return coverageEvaluator.evaluate(validated)
                    .map(coverage -> decide(ctx, coverage))
                    .flatMap(this::answer)
                    .map(QueryRouter::toResponse)
                    .doFinally(signal -> scheduleGapRepair(ctx));
        });
    }

    private RoutingContext decide(RoutingContext ctx, Coverage coverage) {
        RouteDecision decision = decisionEngine.decide(coverage, ctx.getRequest());
        ctx.setCoverage(coverage).setDecision(decision);
        ctx.addStep("coverage", String.format("level=%s, items=%d, confidence=%.3f",
                coverage.getLevel(), coverage.getItemCount(), coverage.getConfidence()));
        ctx.addStep("decide", decision.route() + " (" + decision.reason() + ")");
        log.debug("[router] request={} route={} reason={}", ctx.getRequest().getId(), decision.route(), decision.reason());
        return ctx;
    }

    private Mono<RoutingContext> answer(RoutingContext ctx) {
        RouteDecision decision = ctx.getDecision();
        if (decision.route() == Route.D_ESCALATE) {
            ctx.setEscalation(dispatcher.escalate(ctx.getRequest(), decision));
            ctx.setResult(new HandlerResult(
                    properties.getHandler().getEscalationNotice(), List.of(), decision.coverage().getConfidence()));
            ctx.addStep("escalate", "escalation payload emitted");
            return Mono.just(ctx);
        }
        return dispatcher.dispatch(ctx.getRequest(), decision)
                .map(dispatch -> {
                    ctx.setHandlerKey(dispatch.handlerKey())
                            .setResult(dispatch.result())
                            .setDegraded(dispatch.degraded());
                    return ctx.addStep("dispatch", dispatch.handlerKey() + (dispatch.degraded() ? " (degraded)" : ""));
                });
    }

    private void scheduleGapRepair(RoutingContext ctx) {
        RouteDecision decision = ctx.getDecision();
        if (decision == null || !decision.requiresGapRepair(properties.getGap().isTriggerOnThin())) {
            return;
        }
        QueryRequest request = ctx.getRequest();
        try {
            gapRepairScheduler.schedule(() -> gapRepairPipeline.run(request, decision));
        } catch (RuntimeException ex) {
            log.warn("[router] Could not schedule gap repair for request {} – {}", request.getId(), ex.getMessage());
        }
    }

    static RouteResponse toResponse(RoutingContext ctx) {
        RouteDecision decision = ctx.getDecision();
        Coverage coverage = decision.coverage();
        HandlerResult result = ctx.getResult();
        return RouteResponse.builder()
                .requestId(ctx.getRequest().getId())
                .route(decision.route())
                .coverageLevel(coverage.getLevel())
                .confidence(coverage.getConfidence())
                .text(result == null ? null : result.text())
                .citations(result == null ? List.of() : result.citations())
                .escalated(decision.route() == Route.D_ESCALATE)
                .degraded(ctx.isDegraded())
                .reason(decision.reason())
                .handler(ctx.getHandlerKey())
                .escalation(ctx.getEscalation())
                .steps(List.copyOf(ctx.getSteps()))
                .notices(List.copyOf(ctx.getValidationNotices()))
                .errors(List.of())
                .build();
    }
}
