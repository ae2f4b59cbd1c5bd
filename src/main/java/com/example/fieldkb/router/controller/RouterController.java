package com.example.fieldkb.router.controller;

import com.example.fieldkb.router.request.RouteQueryRequest;
import com.example.fieldkb.router.response.RouteResponse;
import com.example.fieldkb.router.service.QueryRouter;
import com.example.fieldkb.router.validation.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/v1/route")
@Tag(name = "Routing API", description = "Coverage-aware routing of field requests")
@RequiredArgsConstructor
public class RouterController {

    private final QueryRouter queryRouter;

    @PostMapping
    @Operation(
            summary = "Route one request",
            description = "Evaluates knowledge base coverage, picks a route and returns the answer or an escalation."
    )
    public Mono<ResponseEntity<RouteResponse>> route(@RequestBody RouteQueryRequest req) {
        return Mono.fromSupplier(req::toQueryRequest)
                .flatMap(queryRouter::route)
                .map(ResponseEntity::ok)
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(toErrorResponse(ex.getReasons()))))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while routing request", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(toUnexpectedErrorResponse(ex)));
                });
    }

    private RouteResponse toErrorResponse(List<String> reasons) {
        return RouteResponse.builder()
                .notices(List.of())
                .errors(List.copyOf(reasons))
                .build();
    }

    private RouteResponse toUnexpectedErrorResponse(Throwable ex) {
        String detail = ex.getMessage();
        String message = (detail == null || detail.isBlank())
                ? "Unexpected error occurred."
                : "Unexpected error: " + detail;
        return toErrorResponse(List.of(message));
    }
}
