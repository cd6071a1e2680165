package dev.vigil.review;

import dev.vigil.domain.valueobject.ReviewResult;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the shadow review: gates, the latest result (any severity) and the
 * activity log of surfaced results, newest first.
 */
public record ShadowReviewStatus(boolean enabled, boolean reviewing, Instant lastAttempt,
                                 ReviewResult lastResult, List<ReviewResult> activity) {}
