package dev.vigil.review;

import dev.vigil.config.ReviewProperties;
import dev.vigil.domain.enums.Severity;
import dev.vigil.domain.valueobject.ChangeSet;
import dev.vigil.domain.valueobject.ReviewResult;
import dev.vigil.infrastructure.gateway.ChatRequest;
import dev.vigil.infrastructure.gateway.ChatResult;
import dev.vigil.infrastructure.gateway.GatewayClient;
import dev.vigil.infrastructure.gateway.GatewayFailure;
import dev.vigil.infrastructure.git.DiffProvider;
import dev.vigil.service.ModelSelectionService;
import dev.vigil.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ShadowReviewSchedulerTest {

    private static final String DIFF = "diff --git a/app.py b/app.py\n+API_KEY = 'sk-live-123'";

    private GatewayClient gateway;
    private ModelSelectionService modelSelection;
    private DiffProvider diffProvider;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private ShadowReviewScheduler scheduler;

    @BeforeEach
    void setUp() {
        gateway = mock(GatewayClient.class);
        modelSelection = mock(ModelSelectionService.class);
        diffProvider = mock(DiffProvider.class);
        clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();

        when(gateway.isConnected()).thenReturn(true);
        when(modelSelection.selectedModel()).thenReturn(Optional.of("qwen2.5-7b"));
        when(diffProvider.unstagedDiff()).thenReturn(DIFF);
        when(diffProvider.stagedDiff()).thenReturn(DiffProvider.NOTHING_STAGED);
        when(gateway.chat(any())).thenReturn(ChatResult.success("[SAFE] Nothing to flag."));

        scheduler = new ShadowReviewScheduler(gateway, modelSelection, diffProvider,
                new ReviewProperties(true, Path.of("."), Duration.ofSeconds(5), Duration.ofSeconds(30)),
                clock, meterRegistry);
    }

    private static ChangeSet someChange() {
        return new ChangeSet(true, Set.of(), Set.of(Path.of("app.py")), Set.of());
    }

    @Nested
    @DisplayName("gates")
    class Gates {

        @Test
        @DisplayName("disabled review does nothing")
        void disabled() {
            scheduler.disable();

            assertThat(scheduler.runShadowReview()).isEmpty();
            verifyNoInteractions(diffProvider);
            verify(gateway, never()).chat(any());
        }

        @Test
        @DisplayName("disconnected gateway does nothing")
        void disconnected() {
            when(gateway.isConnected()).thenReturn(false);

            assertThat(scheduler.runShadowReview()).isEmpty();
            verify(gateway, never()).chat(any());
        }

        @Test
        @DisplayName("no selected model does nothing")
        void noModel() {
            when(modelSelection.selectedModel()).thenReturn(Optional.empty());

            assertThat(scheduler.runShadowReview()).isEmpty();
            verify(gateway, never()).chat(any());
        }

        @Test
        @DisplayName("clean tree does nothing")
        void cleanTree() {
            when(diffProvider.unstagedDiff()).thenReturn(DiffProvider.NO_UNSTAGED_CHANGES);

            assertThat(scheduler.runShadowReview()).isEmpty();
            verify(gateway, never()).chat(any());
        }

        @Test
        @DisplayName("diff errors are not reviewed")
        void diffError() {
            when(diffProvider.unstagedDiff()).thenReturn("Error: not a git repository");
            when(diffProvider.stagedDiff()).thenReturn("Error: not a git repository");

            assertThat(scheduler.runShadowReview()).isEmpty();
            verify(gateway, never()).chat(any());
        }

        @Test
        @DisplayName("unchanged diff is reviewed once")
        void dedup() {
            scheduler.runShadowReview();
            scheduler.runShadowReview();
            verify(gateway, times(1)).chat(any());

            when(diffProvider.unstagedDiff()).thenReturn(DIFF + "\n+print('debug')");
            scheduler.runShadowReview();
            verify(gateway, times(2)).chat(any());
        }

        @Test
        @DisplayName("a running review blocks a second one")
        void reentrancy() throws Exception {
            CountDownLatch inChat = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(gateway.chat(any())).thenAnswer(invocation -> {
                inChat.countDown();
                release.await(5, TimeUnit.SECONDS);
                return ChatResult.success("[SAFE]");
            });

            CompletableFuture<Optional<ReviewResult>> first = CompletableFuture.supplyAsync(scheduler::runShadowReview);
            assertThat(inChat.await(5, TimeUnit.SECONDS)).isTrue();

            when(diffProvider.unstagedDiff()).thenReturn(DIFF + "\n+x = 1");
            assertThat(scheduler.runShadowReview()).isEmpty();
            assertThat(scheduler.status().reviewing()).isTrue();

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS)).isPresent();
            assertThat(scheduler.status().reviewing()).isFalse();
        }
    }

    @Nested
    @DisplayName("review")
    class Review {

        @Test
        @DisplayName("prefers the unstaged diff and sends it with the review prompt")
        void reviewsUnstagedDiff() {
            scheduler.runShadowReview();

            ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
            verify(gateway).chat(request.capture());
            assertThat(request.getValue().context()).isEqualTo(DIFF);
            assertThat(request.getValue().model()).isEqualTo("qwen2.5-7b");
            assertThat(request.getValue().prompt()).contains("[CRITICAL]", "[WARNING]", "[SAFE]");
            verify(diffProvider, never()).stagedDiff();
        }

        @Test
        @DisplayName("falls back to the staged diff")
        void reviewsStagedDiff() {
            when(diffProvider.unstagedDiff()).thenReturn(DiffProvider.NO_UNSTAGED_CHANGES);
            when(diffProvider.stagedDiff()).thenReturn("diff --git a/b b/b\n+staged");

            scheduler.runShadowReview();

            ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
            verify(gateway).chat(request.capture());
            assertThat(request.getValue().context()).contains("+staged");
        }

        @Test
        @DisplayName("critical finding is surfaced and counted")
        void criticalSurfaced() {
            when(gateway.chat(any())).thenReturn(ChatResult.success("[CRITICAL] Hardcoded API key in app.py"));

            ReviewResult result = scheduler.runShadowReview().orElseThrow();

            assertThat(result.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(scheduler.status().activity()).containsExactly(result);
            assertThat(meterRegistry.counter("vigil.review.results", "severity", "CRITICAL").count()).isEqualTo(1.0);
            assertThat(meterRegistry.timer("vigil.review.duration").count()).isEqualTo(1);
        }

        @Test
        @DisplayName("safe result only updates the latest result")
        void safeNotSurfaced() {
            ReviewResult result = scheduler.runShadowReview().orElseThrow();

            assertThat(result.severity()).isEqualTo(Severity.SAFE);
            assertThat(scheduler.status().lastResult()).isEqualTo(result);
            assertThat(scheduler.status().activity()).isEmpty();
        }

        @Test
        @DisplayName("gateway error string becomes an ERROR result")
        void gatewayError() {
            when(gateway.chat(any())).thenReturn(ChatResult.failure(
                    new GatewayFailure(GatewayFailure.Kind.CONNECT, "Can't connect")));

            assertThat(scheduler.runShadowReview().orElseThrow().severity()).isEqualTo(Severity.ERROR);
        }

        @Test
        @DisplayName("unexpected exception degrades to ERROR and keeps the review enabled")
        void exceptionDegrades() {
            when(gateway.chat(any())).thenThrow(new IllegalStateException("boom"));

            ReviewResult result = scheduler.runShadowReview().orElseThrow();

            assertThat(result.severity()).isEqualTo(Severity.ERROR);
            assertThat(result.message()).isEqualTo("Error: boom");
            assertThat(scheduler.isEnabled()).isTrue();
            assertThat(scheduler.status().reviewing()).isFalse();
        }

        @Test
        @DisplayName("exception without a message is reported by its type")
        void exceptionWithoutMessage() {
            when(gateway.chat(any())).thenThrow(new IllegalStateException());

            ReviewResult result = scheduler.runShadowReview().orElseThrow();

            assertThat(result.severity()).isEqualTo(Severity.ERROR);
            assertThat(result.message()).isEqualTo("Error: IllegalStateException");
        }
    }

    @Nested
    @DisplayName("poll ticks")
    class Ticks {

        @Test
        @DisplayName("no change means no review")
        void noChange() {
            assertThat(scheduler.onTick(ChangeSet.none())).isEmpty();
            verify(gateway, never()).chat(any());
        }

        @Test
        @DisplayName("changes during the cooldown are reviewed once it has elapsed")
        void cooldown() {
            assertThat(scheduler.onTick(someChange())).isPresent();

            when(diffProvider.unstagedDiff()).thenReturn(DIFF + "\n+more");
            clock.advance(Duration.ofSeconds(10));
            assertThat(scheduler.onTick(someChange())).isEmpty();
            verify(gateway, times(1)).chat(any());

            clock.advance(Duration.ofSeconds(21));
            assertThat(scheduler.onTick(ChangeSet.none())).isPresent();
            verify(gateway, times(2)).chat(any());
        }

        @Test
        @DisplayName("manual run ignores the cooldown but not dedup")
        void manualRun() {
            scheduler.onTick(someChange());

            assertThat(scheduler.runNow()).isEmpty();

            when(diffProvider.unstagedDiff()).thenReturn(DIFF + "\n+fix");
            assertThat(scheduler.runNow()).isPresent();
            verify(gateway, times(2)).chat(any());
        }

        @Test
        @DisplayName("changes seen while disabled are not replayed after enabling")
        void disabledDropsPending() {
            scheduler.disable();
            scheduler.onTick(someChange());
            scheduler.enable();

            assertThat(scheduler.onTick(ChangeSet.none())).isEmpty();
            verify(gateway, never()).chat(any());
        }

        @Test
        @DisplayName("changes seen while disconnected are reviewed after reconnecting")
        void disconnectedKeepsPending() {
            when(gateway.isConnected()).thenReturn(false);
            assertThat(scheduler.onTick(someChange())).isEmpty();

            when(gateway.isConnected()).thenReturn(true);
            clock.advance(Duration.ofSeconds(31));

            assertThat(scheduler.onTick(ChangeSet.none())).isPresent();
            verify(gateway, times(1)).chat(any());
        }

        @Test
        @DisplayName("changes seen without a selected model are reviewed once one is chosen")
        void noModelKeepsPending() {
            when(modelSelection.selectedModel()).thenReturn(Optional.empty());
            assertThat(scheduler.onTick(someChange())).isEmpty();

            when(modelSelection.selectedModel()).thenReturn(Optional.of("qwen2.5-7b"));
            clock.advance(Duration.ofSeconds(31));

            assertThat(scheduler.onTick(ChangeSet.none())).isPresent();
        }

        @Test
        @DisplayName("changes seen during a running review are reviewed on a later tick")
        void busyKeepsPending() throws Exception {
            CountDownLatch inChat = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(gateway.chat(any())).thenAnswer(invocation -> {
                inChat.countDown();
                release.await(5, TimeUnit.SECONDS);
                return ChatResult.success("[SAFE]");
            });
            CompletableFuture<Optional<ReviewResult>> manual = CompletableFuture.supplyAsync(scheduler::runShadowReview);
            assertThat(inChat.await(5, TimeUnit.SECONDS)).isTrue();

            when(diffProvider.unstagedDiff()).thenReturn(DIFF + "\n+during");
            assertThat(scheduler.onTick(someChange())).isEmpty();

            release.countDown();
            assertThat(manual.get(5, TimeUnit.SECONDS)).isPresent();
            clock.advance(Duration.ofSeconds(31));

            assertThat(scheduler.onTick(ChangeSet.none())).isPresent();
            verify(gateway, times(2)).chat(any());
        }

        @Test
        @DisplayName("clean tree consumes pending changes")
        void cleanTreeConsumesPending() {
            when(diffProvider.unstagedDiff()).thenReturn(DiffProvider.NO_UNSTAGED_CHANGES);
            assertThat(scheduler.onTick(someChange())).isEmpty();

            when(diffProvider.unstagedDiff()).thenReturn(DIFF);
            clock.advance(Duration.ofSeconds(31));

            assertThat(scheduler.onTick(ChangeSet.none())).isEmpty();
            verify(gateway, never()).chat(any());
        }
    }
}
