package org.carball.nplusone.tracking;

import org.carball.nplusone.config.TrackerSettings;
import org.carball.nplusone.fingerprint.FingerprintEngine;
import org.carball.nplusone.model.AggregationResult;
import org.carball.nplusone.model.Dialect;
import org.carball.nplusone.model.QueryEvent;
import org.carball.nplusone.model.QueryMatcher;
import org.carball.nplusone.model.StackMatcher;
import org.carball.nplusone.output.NPlusOneQueriesException;
import org.carball.nplusone.output.NotificationDispatcher;
import org.carball.nplusone.output.StackCleaner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryTrackerTest {

    private static final List<String> LOOP_STACK = List.of(
            "app.CommentRepository.findByPost(CommentRepository.java:12)",
            "app.PostService.loadComments(PostService.java:30)");
    private static final List<String> OTHER_STACK = List.of(
            "app.AuthorRepository.findById(AuthorRepository.java:8)",
            "app.PostService.loadAuthor(PostService.java:44)");

    private final List<AggregationResult> reported = new ArrayList<>();

    private QueryTracker tracker(TrackerSettings settings) {
        NotificationDispatcher dispatcher = NotificationDispatcher.fromSettings(
                settings, StackCleaner.identity(), (result, report) -> reported.add(result));
        return new QueryTracker(settings, FingerprintEngine.defaults(), dispatcher);
    }

    private QueryTracker tracker() {
        return tracker(TrackerSettings.defaults());
    }

    private static QueryEvent select(String sql, List<String> stack) {
        return QueryEvent.of(sql, stack);
    }

    @Test
    void shouldReportRepeatedShapeFromOneCallSite() {
        // Given
        QueryTracker tracker = tracker();

        // When
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 3", LOOP_STACK));
        AggregationResult result = tracker.finish();

        // Then
        assertThat(result.detections()).hasSize(1);
        assertThat(result.detections().get(0).queries()).containsExactly(
                "SELECT * FROM comments WHERE post_id = 1",
                "SELECT * FROM comments WHERE post_id = 2",
                "SELECT * FROM comments WHERE post_id = 3");
        assertThat(result.detections().get(0).callStack()).isEqualTo(LOOP_STACK);
        assertThat(reported).containsExactly(result);
    }

    @Test
    void shouldNotReportDifferentShapesFromOneCallSite() {
        // Given
        QueryTracker tracker = tracker();

        // When
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        tracker.onQueryObserved(select("SELECT * FROM authors WHERE id = 1", LOOP_STACK));
        AggregationResult result = tracker.finish();

        // Then
        assertThat(result.isEmpty()).isTrue();
        assertThat(reported).isEmpty();
    }

    @Test
    void shouldSkipCallSiteMatchingDefaultAllowList() {
        // Given
        List<String> batchStack = List.of(
                "org.hibernate.loader.ast.internal.EntityBatchLoaderArrayParam.load(EntityBatchLoaderArrayParam.java:90)",
                "app.PostService.loadComments(PostService.java:30)");
        QueryTracker tracker = tracker();

        // When
        tracker.scan();
        for (int i = 1; i <= 3; i++) {
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = " + i, batchStack));
        }

        // Then
        assertThat(tracker.finish().isEmpty()).isTrue();
    }

    @Test
    void shouldRespectHigherThreshold() {
        // Given
        QueryTracker tracker = tracker(TrackerSettings.builder().minNQueries(5).build());

        // When
        tracker.scan();
        for (int i = 1; i <= 3; i++) {
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = " + i, LOOP_STACK));
        }

        // Then
        assertThat(tracker.finish().isEmpty()).isTrue();
    }

    @Test
    void shouldIgnoreEverythingWhenNeverStarted() {
        // Given
        QueryTracker tracker = tracker();

        // When
        tracker.recordQuery("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK);
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));
        AggregationResult result = tracker.finish();

        // Then
        assertThat(result.isEmpty()).isTrue();
        assertThat(tracker.state()).isEqualTo(SessionState.UNINITIALIZED);
        assertThat(tracker.isTracking()).isFalse();
    }

    @Test
    void shouldNotRecordWhilePaused() {
        // Given
        QueryTracker tracker = tracker();

        // When
        tracker.scan();
        tracker.pause();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));
        tracker.resume();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 3", LOOP_STACK));

        // Then
        assertThat(tracker.session().counters().values()).containsExactly(1);
        assertThat(tracker.finish().isEmpty()).isTrue();
    }

    @Test
    void shouldKeepTrackingInsidePauseWhenPausesIgnored() {
        // Given
        QueryTracker tracker = tracker(TrackerSettings.builder().ignorePauses(true).build());

        // When
        tracker.scan();
        tracker.pause(() -> {
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));
        });

        // Then
        assertThat(tracker.finish().size()).isEqualTo(1);
    }

    @Test
    void shouldRestoreStateAfterScopedPauseThrows() {
        // Given
        QueryTracker tracker = tracker();
        tracker.scan();

        // When
        assertThatThrownBy(() -> tracker.pause(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        // Then
        assertThat(tracker.state()).isEqualTo(SessionState.ACTIVE);
        assertThat(tracker.isScanning()).isTrue();
        tracker.finish();
    }

    @Test
    void shouldKeepPausedStateAfterNestedScopedPause() {
        // Given
        QueryTracker tracker = tracker();
        tracker.scan();
        tracker.pause();

        // When
        tracker.pause(() -> {
        });

        // Then
        assertThat(tracker.state()).isEqualTo(SessionState.PAUSED);
        tracker.finish();
    }

    @Test
    void shouldReturnValueFromScopedPause() {
        // Given
        QueryTracker tracker = tracker();
        tracker.scan();

        // When
        String value = tracker.pause(() -> {
            assertThat(tracker.isScanning()).isFalse();
            return "done";
        });

        // Then
        assertThat(value).isEqualTo("done");
        assertThat(tracker.isScanning()).isTrue();
        tracker.finish();
    }

    @Test
    void shouldReportWhenScanBlockCompletes() {
        // Given
        QueryTracker tracker = tracker();

        // When
        tracker.scan(() -> {
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));
        });

        // Then
        assertThat(reported).hasSize(1);
        assertThat(tracker.isTracking()).isFalse();
    }

    @Test
    void shouldReturnValueFromScanBlock() {
        // Given
        QueryTracker tracker = tracker();

        // When
        int value = tracker.scan(() -> 42);

        // Then
        assertThat(value).isEqualTo(42);
        assertThat(reported).isEmpty();
    }

    @Test
    void shouldDiscardObservationsWhenScanBlockThrows() {
        // Given
        QueryTracker tracker = tracker();

        // When
        assertThatThrownBy(() -> tracker.scan(() -> {
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        // Then
        assertThat(reported).isEmpty();
        assertThat(tracker.state()).isEqualTo(SessionState.UNINITIALIZED);
    }

    @Test
    void shouldShareStateAcrossNestedScopes() {
        // Given
        QueryTracker tracker = tracker();

        // When
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));
        AggregationResult inner = tracker.finish();

        // Then
        assertThat(inner.isEmpty()).isTrue();
        assertThat(tracker.isScanning()).isTrue();
        assertThat(tracker.finish().size()).isEqualTo(1);
        assertThat(tracker.isTracking()).isFalse();
    }

    @Test
    void shouldRunNestedScanBlockInsideOuterScope() {
        // Given
        QueryTracker tracker = tracker();

        // When
        tracker.scan();
        tracker.scan(() -> {
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));
        });

        // Then - nothing reported until the outer scope ends
        assertThat(reported).isEmpty();
        assertThat(tracker.finish().size()).isEqualTo(1);
    }

    @Test
    void shouldFilterNonSelectSchemaCachedAndIgnoredQueries() {
        // Given
        TrackerSettings settings = TrackerSettings.builder()
                .ignoreQueries(List.of(QueryMatcher.pattern("FROM audit_log")))
                .build();
        QueryTracker tracker = tracker(settings);

        // When
        tracker.scan();
        for (int i = 0; i < 2; i++) {
            tracker.onQueryObserved(select("UPDATE comments SET seen = 1 WHERE id = " + i, LOOP_STACK));
            tracker.onQueryObserved(new QueryEvent("SELECT * FROM pg_tables WHERE id = " + i, null, false,
                    QueryEvent.SCHEMA_OPERATION, LOOP_STACK));
            tracker.onQueryObserved(new QueryEvent("SELECT * FROM comments WHERE id = " + i, null, true, null, LOOP_STACK));
            tracker.onQueryObserved(select("SELECT * FROM audit_log WHERE id = " + i, LOOP_STACK));
        }

        // Then
        assertThat(tracker.session().counters()).isEmpty();
        assertThat(tracker.finish().isEmpty()).isTrue();
    }

    @Test
    void shouldRecordWithoutFiltersThroughRecordQuery() {
        // Given
        QueryTracker tracker = tracker(TrackerSettings.builder().defaultDialect(Dialect.MYSQL).build());

        // When
        tracker.scan();
        tracker.recordQuery("select * from comments where post_id = 1", LOOP_STACK);
        tracker.recordQuery("select * from comments where post_id = 2", LOOP_STACK);

        // Then
        assertThat(tracker.finish().detections().get(0).fingerprint())
                .isEqualTo("select * from comments where post_id = ?");
    }

    @Test
    void shouldSeparateCallSites() {
        // Given
        QueryTracker tracker = tracker();

        // When
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", OTHER_STACK));

        // Then
        assertThat(tracker.session().counters()).hasSize(2);
        assertThat(tracker.finish().isEmpty()).isTrue();
    }

    @Test
    void shouldCaptureCallStackOnSecondOccurrence() {
        // Given
        QueryTracker tracker = tracker();
        tracker.scan();

        // When
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        String key = tracker.session().counters().keySet().iterator().next();
        boolean capturedAfterFirst = tracker.session().hasCallStack(key);
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));

        // Then
        assertThat(capturedAfterFirst).isFalse();
        assertThat(tracker.session().hasCallStack(key)).isTrue();
        assertThat(tracker.session().queries(key)).hasSize(tracker.session().counters().get(key));
        tracker.finish();
    }

    @Test
    void shouldApplyPerThreadAllowList() {
        // Given
        QueryTracker tracker = tracker();
        tracker.setAllowStackPaths(List.of(StackMatcher.contains("PostService.loadComments")));

        // When
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));

        // Then
        assertThat(tracker.finish().isEmpty()).isTrue();
        assertThat(tracker.getAllowStackPaths()).hasSize(1);
    }

    @Test
    void shouldApplyConfiguredAllowList() {
        // Given
        QueryTracker tracker = tracker(TrackerSettings.builder()
                .allowStackPaths(List.of(StackMatcher.pattern("CommentRepository\\.find\\w+")))
                .build());

        // When
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));

        // Then
        assertThat(tracker.finish().isEmpty()).isTrue();
    }

    @Test
    void shouldIsolateThreads() throws InterruptedException {
        // Given
        QueryTracker tracker = tracker();
        tracker.scan();
        AtomicReference<Boolean> otherThreadScanning = new AtomicReference<>();

        // When
        Thread other = new Thread(() -> {
            otherThreadScanning.set(tracker.isScanning());
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
            tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));
        });
        other.start();
        other.join();

        // Then
        assertThat(otherThreadScanning.get()).isFalse();
        assertThat(tracker.session().counters()).isEmpty();
        assertThat(tracker.finish().isEmpty()).isTrue();
    }

    @Test
    void shouldDoNothingWhenDisabled() {
        // Given
        QueryTracker tracker = tracker(TrackerSettings.builder().enabled(false).build());

        // When
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        boolean ran = tracker.scan(() -> true);

        // Then
        assertThat(ran).isTrue();
        assertThat(tracker.isTracking()).isFalse();
        assertThat(tracker.finish().isEmpty()).isTrue();
    }

    @Test
    void shouldRaiseAfterReportingWhenConfigured() {
        // Given
        QueryTracker tracker = tracker(TrackerSettings.builder().raiseOnDetection(true).build());
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));

        // When / Then
        assertThatThrownBy(tracker::finish)
                .isInstanceOf(NPlusOneQueriesException.class)
                .hasMessageContaining("N+1 queries detected:")
                .hasMessageContaining("SELECT * FROM comments WHERE post_id = 2");
        assertThat(reported).hasSize(1);
        assertThat(tracker.isTracking()).isFalse();
    }

    @Test
    void shouldReportSingleQueryWhenMinimumIsOne() {
        // Given
        QueryTracker tracker = tracker(TrackerSettings.builder().minNQueries(1).build());

        // When
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        AggregationResult result = tracker.finish();

        // Then - single occurrence never captured a stack
        assertThat(result.size()).isEqualTo(1);
        assertThat(result.detections().get(0).callStack()).isEmpty();
    }

    @Test
    void shouldToleratePartialCallStacks() {
        // Given
        QueryTracker tracker = tracker();
        List<String> partialStack = Arrays.asList("app.CommentRepository.findByPost(CommentRepository.java:12)", null);
        tracker.scan();

        // When
        tracker.recordQuery("SELECT * FROM comments WHERE post_id = 1", partialStack);
        tracker.recordQuery("SELECT * FROM comments WHERE post_id = 2", partialStack);
        String key = tracker.session().counters().keySet().iterator().next();

        // Then
        assertThat(tracker.session().counters()).containsEntry(key, 2);
        assertThat(tracker.session().queries(key)).hasSize(2);
        assertThat(tracker.session().hasCallStack(key)).isTrue();
        assertThat(tracker.session().callStack(key)).containsExactly(
                "app.CommentRepository.findByPost(CommentRepository.java:12)", null);

        AggregationResult result = tracker.finish();
        assertThat(result.detections()).hasSize(1);
        assertThat(result.detections().get(0).callStack()).hasSize(2);
    }

    @Test
    void shouldObserveEventsWithPartialCallStacks() {
        // Given
        QueryTracker tracker = tracker();
        List<String> partialStack = Arrays.asList(null, "app.PostService.loadComments(PostService.java:30)");

        // When
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", partialStack));
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", partialStack));
        AggregationResult result = tracker.finish();

        // Then
        assertThat(result.detections()).hasSize(1);
        assertThat(result.detections().get(0).callStack())
                .containsExactly(null, "app.PostService.loadComments(PostService.java:30)");
    }

    @Test
    void shouldAggregateQueriesRecordedBeforePauseWhenFinishing() {
        // Given
        QueryTracker tracker = tracker();
        tracker.scan();
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 1", LOOP_STACK));
        tracker.onQueryObserved(select("SELECT * FROM comments WHERE post_id = 2", LOOP_STACK));

        // When
        tracker.pause();
        AggregationResult result = tracker.finish();

        // Then
        assertThat(result.detections()).hasSize(1);
        assertThat(reported).containsExactly(result);
        assertThat(tracker.state()).isEqualTo(SessionState.UNINITIALIZED);
    }

    @Test
    void shouldReleaseThreadSessionAfterFinish() {
        // Given
        QueryTracker tracker = tracker();
        tracker.scan();
        TrackingSession during = tracker.session();

        // When
        tracker.finish();

        // Then
        assertThat(tracker.session()).isNotSameAs(during);
        assertThat(tracker.state()).isEqualTo(SessionState.UNINITIALIZED);
    }

    @Test
    void shouldReleaseThreadSessionWhenScanBlockThrows() {
        // Given
        QueryTracker tracker = tracker();
        AtomicReference<TrackingSession> during = new AtomicReference<>();

        // When
        assertThatThrownBy(() -> tracker.scan(() -> {
            during.set(tracker.session());
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        // Then
        assertThat(tracker.session()).isNotSameAs(during.get());
    }

    @Test
    void shouldKeepThreadSessionHoldingAllowList() {
        // Given
        QueryTracker tracker = tracker();
        tracker.setAllowStackPaths(List.of(StackMatcher.contains("PostService.loadComments")));
        tracker.scan();
        TrackingSession during = tracker.session();

        // When
        tracker.finish();

        // Then
        assertThat(tracker.session()).isSameAs(during);
        assertThat(tracker.getAllowStackPaths()).hasSize(1);
    }
}
