package dev.vigil.review;

import dev.vigil.config.ReviewProperties;
import dev.vigil.domain.enums.Severity;
import dev.vigil.domain.valueobject.ChangeSet;
import dev.vigil.domain.valueobject.ReviewResult;
import dev.vigil.infrastructure.gateway.ChatRequest;
import dev.vigil.infrastructure.gateway.ChatResult;
import dev.vigil.infrastructure.gateway.GatewayClient;
import dev.vigil.infrastructure.git.DiffProvider;
import dev.vigil.service.ModelSelectionService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides when the working tree gets an unattended review, runs it and classifies the answer.
 *
 * <p>The review flow:
 *
 * <pre>
 *  1. Skip when disabled, already reviewing, disconnected or without a selected model
 *  2. Subject = unstaged diff, else staged diff; skip when both are empty
 *  3. Skip when the subject is identical to the last reviewed one
 *  4. Ask the model with the review prompt
 *  5. Classify by severity tag and report
 * </pre>
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>Cooldown per attempt</b>: poll ticks only attempt a review once the cooldown since the
 *       previous attempt has elapsed. Changes seen during the cooldown are remembered and
 *       reviewed on the first tick after it, so a burst of saves ends in one review of the
 *       final state. They also stay pending while the gateway is down, no model is selected
 *       or another review holds the slot.</li>
 *   <li><b>Dedup by content</b>: touching a file without changing the diff costs nothing. The
 *       hash is stored before the call, so a failing review is not retried until the diff
 *       changes.</li>
 *   <li><b>Failures as results</b>: gateway errors and unexpected exceptions become an ERROR
 *       result. Enablement is never changed by a failure.</li>
 * </ul>
 */
@Component
public class ShadowReviewScheduler {

    private static final Logger log = LoggerFactory.getLogger(ShadowReviewScheduler.class);
    private static final int ACTIVITY_LIMIT = 50;
    static final String MDC_REVIEW_RUN = "reviewRun";

    private final GatewayClient gateway;
    private final ModelSelectionService modelSelection;
    private final DiffProvider diffProvider;
    private final Duration cooldown;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Timer reviewTimer;
    private final ReviewState state;
    private final AtomicLong runCounter = new AtomicLong();
    private final Deque<ReviewResult> activity = new ArrayDeque<>();
    private volatile ReviewResult lastResult;

    public ShadowReviewScheduler(GatewayClient gateway,
                                 ModelSelectionService modelSelection,
                                 DiffProvider diffProvider,
                                 ReviewProperties properties,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        this.gateway = gateway;
        this.modelSelection = modelSelection;
        this.diffProvider = diffProvider;
        this.cooldown = properties.cooldown();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.reviewTimer = Timer.builder("vigil.review.duration")
                .description("Shadow review round trip time")
                .register(meterRegistry);
        this.state = new ReviewState(properties.enabled());
    }

    /**
     * Poll-driven entry point. Attempts a review when changes are pending and the cooldown
     * since the previous attempt has elapsed.
     */
    public Optional<ReviewResult> onTick(ChangeSet changes) {
        if (!state.isEnabled()) {
            state.setPendingChanges(false);
            return Optional.empty();
        }
        if (changes.changed()) {
            state.setPendingChanges(true);
        }
        if (!state.hasPendingChanges()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Instant lastAttempt = state.lastAttempt();
        if (lastAttempt != null && Duration.between(lastAttempt, now).compareTo(cooldown) < 0) {
            log.trace("Changes pending, cooldown active until {}", lastAttempt.plus(cooldown));
            return Optional.empty();
        }
        state.markAttempt(now);
        return consumePending(attempt());
    }

    /** Manual trigger: skips the cooldown, keeps every other gate. */
    public Optional<ReviewResult> runNow() {
        state.markAttempt(clock.instant());
        return consumePending(attempt());
    }

    /**
     * Runs one review if every gate passes. Returns the classified result, or empty when a
     * gate turned the call into a no-op.
     */
    public Optional<ReviewResult> runShadowReview() {
        return attempt().result();
    }

    public void enable() {
        state.setEnabled(true);
        log.info("Shadow review enabled");
    }

    public void disable() {
        state.setEnabled(false);
        state.setPendingChanges(false);
        log.info("Shadow review disabled");
    }

    public boolean isEnabled() {
        return state.isEnabled();
    }

    public ShadowReviewStatus status() {
        List<ReviewResult> recent;
        synchronized (activity) {
            recent = List.copyOf(activity);
        }
        return new ShadowReviewStatus(state.isEnabled(), state.isReviewing(), state.lastAttempt(),
                lastResult, recent);
    }

    // ── Internal ─────────────────────────────────────────────────────

    /**
     * Outcome of one pass through the gates. {@code deferred} means the working tree was never
     * looked at, so pending changes must survive for a later tick.
     */
    private record Attempt(boolean deferred, Optional<ReviewResult> result) {

        static Attempt defer() {
            return new Attempt(true, Optional.empty());
        }

        static Attempt skipped() {
            return new Attempt(false, Optional.empty());
        }

        static Attempt reviewed(ReviewResult result) {
            return new Attempt(false, Optional.of(result));
        }
    }

    private Optional<ReviewResult> consumePending(Attempt attempt) {
        if (!attempt.deferred()) {
            state.setPendingChanges(false);
        }
        return attempt.result();
    }

    private Attempt attempt() {
        if (!state.isEnabled()) return Attempt.skipped();
        if (!state.tryBegin()) {
            log.debug("Review already in progress, keeping changes pending");
            return Attempt.defer();
        }
        try {
            if (!gateway.isConnected()) return Attempt.defer();
            Optional<String> model = modelSelection.selectedModel();
            if (model.isEmpty()) return Attempt.defer();

            String subject = reviewSubject();
            if (subject == null) return Attempt.skipped();

            int diffHash = subject.hashCode();
            if (state.isLastReviewed(diffHash)) {
                log.debug("Diff unchanged since last review, skipping");
                return Attempt.skipped();
            }
            state.markReviewed(diffHash);
            return Attempt.reviewed(review(subject, model.get()));
        } finally {
            state.end();
        }
    }

    private String reviewSubject() {
        String unstaged = diffProvider.unstagedDiff();
        if (DiffProvider.hasChanges(unstaged)) return unstaged;
        String staged = diffProvider.stagedDiff();
        if (DiffProvider.hasChanges(staged)) return staged;
        return null;
    }

    private ReviewResult review(String subject, String model) {
        MDC.put(MDC_REVIEW_RUN, Long.toString(runCounter.incrementAndGet()));
        Timer.Sample sample = Timer.start(meterRegistry);
        ReviewResult result;
        try {
            log.info("Reviewing {} chars of diff with {}", subject.length(), model);
            ChatResult answer = gateway.chat(new ChatRequest(ReviewPrompts.SHADOW_REVIEW, subject, model));
            result = ReviewResult.classify(answer.text(), clock.instant());
        } catch (RuntimeException e) {
            log.error("Shadow review failed unexpectedly", e);
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            result = ReviewResult.error(ChatResult.ERROR_PREFIX + detail, clock.instant());
        } finally {
            sample.stop(reviewTimer);
        }
        try {
            report(result);
        } finally {
            MDC.remove(MDC_REVIEW_RUN);
        }
        return result;
    }

    private void report(ReviewResult result) {
        lastResult = result;
        Counter.builder("vigil.review.results")
                .tag("severity", result.severity().name())
                .register(meterRegistry)
                .increment();
        if (result.severity().isSurfaced()) {
            synchronized (activity) {
                activity.addFirst(result);
                while (activity.size() > ACTIVITY_LIMIT) activity.removeLast();
            }
        }
        if (result.severity() == Severity.CRITICAL) {
            log.error("Shadow review CRITICAL: {}", result.message());
        } else if (result.severity() == Severity.SAFE) {
            log.debug("Shadow review SAFE");
        } else {
            log.warn("Shadow review {}: {}", result.severity(), result.message());
        }
    }
}
