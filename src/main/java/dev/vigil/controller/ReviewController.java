package dev.vigil.controller;

import dev.vigil.dto.response.ReviewStatusResponse;
import dev.vigil.review.ShadowReviewScheduler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/review")
public class ReviewController {
    private final ShadowReviewScheduler scheduler;
    public ReviewController(ShadowReviewScheduler scheduler) { this.scheduler = scheduler; }

    @GetMapping("/status")
    public ResponseEntity<ReviewStatusResponse> status() {
        return ResponseEntity.ok(ReviewStatusResponse.of(scheduler.status()));
    }

    @PostMapping("/enable")
    public ResponseEntity<ReviewStatusResponse> enable() {
        scheduler.enable();
        return status();
    }

    @PostMapping("/disable")
    public ResponseEntity<ReviewStatusResponse> disable() {
        scheduler.disable();
        return status();
    }

    /** Runs a review now, skipping the cooldown. 204 when a gate made it a no-op. */
    @PostMapping("/run")
    public ResponseEntity<ReviewStatusResponse.ResultSummary> run() {
        return scheduler.runNow()
                .map(result -> ResponseEntity.ok(ReviewStatusResponse.ResultSummary.of(result)))
                .orElse(ResponseEntity.noContent().build());
    }
}
