package com.example.fieldkb.router.controller;

import com.example.fieldkb.router.error.StoreFailureException;
import com.example.fieldkb.router.model.GapRecord;
import com.example.fieldkb.router.model.GapStats;
import com.example.fieldkb.router.request.GapResolveRequest;
import com.example.fieldkb.router.response.GapListResponse;
import com.example.fieldkb.router.service.GapLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/v1/gaps")
@Tag(name = "Knowledge Gaps", description = "Inspect and reconcile recorded knowledge base gaps")
@RequiredArgsConstructor
public class GapController {

    static final int MAX_LIMIT = 100;

    private final GapLogService gapLogService;

    @GetMapping("/top")
    @Operation(summary = "Most frequent gaps", description = "Ordered by frequency, then most recently seen.")
    public Mono<ResponseEntity<GapListResponse>> top(
            @RequestParam(value = "limit", defaultValue = "10") int limit,
            @RequestParam(value = "resolved", defaultValue = "false") boolean resolved) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return Mono.fromCallable(() -> gapLogService.topGaps(bounded, resolved))
                .subscribeOn(Schedulers.boundedElastic())
                .map(gaps -> ResponseEntity.ok(GapListResponse.of(gaps)))
                .onErrorResume(StoreFailureException.class, ex -> unavailable(ex));
    }

    @GetMapping("/stats")
    @Operation(summary = "Gap statistics")
    public Mono<ResponseEntity<GapStats>> stats() {
        return Mono.fromCallable(gapLogService::stats)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok)
                .onErrorResume(StoreFailureException.class, ex -> unavailable(ex));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Mark a gap resolved", description = "Idempotent; the first resolution time is kept.")
    public Mono<ResponseEntity<GapRecord>> resolve(@PathVariable("id") long id,
                                                   @RequestBody(required = false) GapResolveRequest body) {
        List<String> refs = body == null || body.getResolutionRefs() == null ? List.of() : body.getResolutionRefs();
        return Mono.fromCallable(() -> gapLogService.markResolved(id, refs))
                .subscribeOn(Schedulers.boundedElastic())
                .map(resolved -> resolved
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .onErrorResume(StoreFailureException.class, ex -> unavailable(ex));
    }

    private static <T> Mono<ResponseEntity<T>> unavailable(StoreFailureException ex) {
        log.warn("Gap store unavailable – {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
    }
}
