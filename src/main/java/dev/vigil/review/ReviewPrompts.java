package dev.vigil.review;

/**
 * Instructions sent with every shadow review. The severity tag at the start of the answer
 * is what {@link dev.vigil.domain.valueobject.ReviewResult#classify} reads.
 */
final class ReviewPrompts {

    private ReviewPrompts() {}

    static final String SHADOW_REVIEW = """
            You are reviewing an uncommitted git diff. Flag only:
            - hardcoded secrets, API keys, passwords or other credentials
            - SQL injection, command injection or unsanitized input reaching a shell or query
            - obvious bugs (null dereferences, inverted conditions, off-by-one errors)
            - leftover debug code (print statements, commented-out blocks, TODO hacks)
            Be terse: one line per finding, no praise, no summary.
            Start your answer with exactly one of [CRITICAL], [WARNING] or [SAFE].""";
}
