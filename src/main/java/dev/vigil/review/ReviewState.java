package dev.vigil.review;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable gates of the shadow review. Only {@link ShadowReviewScheduler} writes to it.
 */
class ReviewState {

    private volatile boolean enabled;
    private final AtomicBoolean reviewing = new AtomicBoolean();
    private volatile Integer lastDiffHash;
    private volatile Instant lastAttempt;
    private volatile boolean pendingChanges;

    ReviewState(boolean enabled) {
        this.enabled = enabled;
    }

    boolean isEnabled() { return enabled; }
    void setEnabled(boolean enabled) { this.enabled = enabled; }

    /** Claims the reentrancy guard; false when a review is already running. */
    boolean tryBegin() { return reviewing.compareAndSet(false, true); }
    void end() { reviewing.set(false); }
    boolean isReviewing() { return reviewing.get(); }

    boolean isLastReviewed(int diffHash) {
        Integer last = lastDiffHash;
        return last != null && last == diffHash;
    }
    void markReviewed(int diffHash) { this.lastDiffHash = diffHash; }

    Instant lastAttempt() { return lastAttempt; }
    void markAttempt(Instant at) { this.lastAttempt = at; }

    boolean hasPendingChanges() { return pendingChanges; }
    void setPendingChanges(boolean pending) { this.pendingChanges = pending; }
}
