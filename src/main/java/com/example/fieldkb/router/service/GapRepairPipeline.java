package com.example.fieldkb.router.service;

import com.example.fieldkb.router.config.RouterProperties;
import com.example.fieldkb.router.model.GapRecord;
import com.example.fieldkb.router.model.QueryRequest;
import com.example.fieldkb.router.model.RepairRequest;
import com.example.fieldkb.router.model.RouteDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Background half of routing: detect, record, claim and enqueue. The gap is recorded before
 * research is requested. Nothing here propagates to the caller.
 */
@Slf4j
@Service
public class GapRepairPipeline {

    private final GapDetector detector;
    private final GapLogService gapLogService;
    private final ResearchTrigger researchTrigger;
    private final Duration requeueAfter;

    public GapRepairPipeline(GapDetector detector,
                             GapLogService gapLogService,
                             ResearchTrigger researchTrigger,
                             RouterProperties properties) {
        this.detector = detector;
        this.gapLogService = gapLogService;
        this.researchTrigger = researchTrigger;
        this.requeueAfter = properties.getGap().getRequeueAfter();
    }

    public void run(QueryRequest request, RouteDecision decision) {
        try {
            RepairRequest repair = detector.detect(request, decision.coverage());
            GapRecord gap = gapLogService.record(repair);
            if (!gapLogService.claimResearch(gap, requeueAfter)) {
                log.debug("[gap] research already queued for gap {}", gap.getId());
                return;
            }
            researchTrigger.enqueue(repair, gap);
        } catch (RuntimeException ex) {
            log.warn("[gap] Gap repair failed for request {}", request.getId(), ex);
        }
    }
}
