package dev.vigil.review;

import dev.vigil.domain.valueobject.ChangeSet;
import dev.vigil.infrastructure.fs.ChangeDetector;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-delay tick that feeds working tree changes into the shadow review.
 * The tree is scanned even while reviews are disabled so that enabling them does not
 * report everything edited in the meantime as one burst.
 */
@Component
public class ShadowReviewPoller {

    private final ChangeDetector changeDetector;
    private final ShadowReviewScheduler scheduler;

    public ShadowReviewPoller(ChangeDetector changeDetector, ShadowReviewScheduler scheduler) {
        this.changeDetector = changeDetector;
        this.scheduler = scheduler;
    }

    @Scheduled(fixedDelayString = "${vigil.review.poll-interval:PT5S}")
    public void poll() {
        ChangeSet changes = changeDetector.checkForChanges();
        scheduler.onTick(changes);
    }
}
