package dev.vigil.dto.response;

import dev.vigil.domain.enums.Severity;
import dev.vigil.domain.valueobject.ReviewResult;
import dev.vigil.review.ShadowReviewStatus;

import java.time.Instant;
import java.util.List;

public record ReviewStatusResponse(
        boolean enabled, boolean reviewing, Instant lastAttempt,
        ResultSummary lastResult, List<ResultSummary> activity
) {
    public record ResultSummary(Severity severity, String message, Instant reviewedAt) {
        public static ResultSummary of(ReviewResult result) {
            return result == null ? null : new ResultSummary(result.severity(), result.message(), result.reviewedAt());
        }
    }

    public static ReviewStatusResponse of(ShadowReviewStatus status) {
        return new ReviewStatusResponse(status.enabled(), status.reviewing(), status.lastAttempt(),
                ResultSummary.of(status.lastResult()),
                status.activity().stream().map(ResultSummary::of).toList());
    }
}
