package com.farmsentinel.core.feedback;

import com.farmsentinel.core.error.NotFoundException;
import com.farmsentinel.core.model.AnomalyRecord;
import com.farmsentinel.core.model.AnomalyType;
import com.farmsentinel.core.model.ConfirmationState;
import com.farmsentinel.core.model.FeedbackEntry;
import com.farmsentinel.core.model.Severity;
import com.farmsentinel.core.port.InMemoryAnomalySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FeedbackRecorder}.
 */
class FeedbackRecorderTest {

    private static final Instant NOW = Instant.parse("2024-04-02T08:30:00Z");

    private InMemoryAnomalySink sink;
    private FeedbackRecorder recorder;
    private long id;

    @BeforeEach
    void setUp() {
        sink = new InMemoryAnomalySink(Clock.fixed(NOW, ZoneOffset.UTC));
        recorder = new FeedbackRecorder(sink);
        id = sink.persist(createRecord());
    }

    @Test
    @DisplayName("Should confirm a detected anomaly")
    void shouldConfirm() {
        AnomalyRecord updated = recorder.recordFeedback(id, true, "heater stuck on");

        assertThat(updated.getConfirmationState()).isEqualTo(ConfirmationState.CONFIRMED);
        assertThat(updated.getFeedbackNotes()).isEqualTo("heater stuck on");
        assertThat(updated.getUpdatedAt()).isEqualTo(NOW);
        assertThat(updated.isFeedbackProvided()).isTrue();
        assertThat(recorder.find(id)).isEqualTo(updated);
    }

    @Test
    @DisplayName("Should end in the same state when the same feedback is given twice")
    void shouldBeIdempotentInState() {
        recorder.recordFeedback(id, false, "sensor wiped");
        AnomalyRecord again = recorder.recordFeedback(id, false, "sensor wiped");

        assertThat(again.getConfirmationState()).isEqualTo(ConfirmationState.DISMISSED);
        assertThat(again.getFeedbackHistory()).hasSize(2);
        assertThat(again.getFeedbackHistory().get(1).getPreviousState()).isEqualTo(ConfirmationState.DISMISSED);
    }

    @Test
    @DisplayName("Should allow a dismissed anomaly to be confirmed later")
    void shouldAllowRelabelling() {
        recorder.recordFeedback(id, false, null);
        AnomalyRecord relabelled = recorder.recordFeedback(id, true, "it was real after all");

        assertThat(relabelled.getConfirmationState()).isEqualTo(ConfirmationState.CONFIRMED);
        assertThat(relabelled.getFeedbackHistory()).extracting(e -> e.getState())
                .containsExactly(ConfirmationState.DISMISSED, ConfirmationState.CONFIRMED);
        // detection fields are never touched by feedback
        assertThat(relabelled.getCombinedScore()).isEqualTo(0.93);
        assertThat(relabelled.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Should chain each state change onto the one before it under concurrent feedback")
    void shouldChainConcurrentFeedback() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AnomalyRecord>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                boolean real = i % 2 == 0;
                results.add(pool.submit(() -> {
                    start.await();
                    return recorder.recordFeedback(id, real, null);
                }));
            }
            start.countDown();
            for (Future<AnomalyRecord> result : results) {
                AnomalyRecord returned = result.get(10, TimeUnit.SECONDS);
                FeedbackEntry last = returned.getFeedbackHistory().get(returned.getFeedbackHistory().size() - 1);
                assertThat(last.getState()).isEqualTo(returned.getConfirmationState());
            }
        } finally {
            pool.shutdownNow();
        }

        List<FeedbackEntry> history = recorder.find(id).getFeedbackHistory();
        assertThat(history).hasSize(threads);
        assertThat(history.get(0).getPreviousState()).isEqualTo(ConfirmationState.DETECTED);
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).getPreviousState()).isEqualTo(history.get(i - 1).getState());
        }
    }

    @Test
    @DisplayName("Should throw NotFoundException for an unknown id")
    void shouldThrowForUnknownId() {
        assertThatThrownBy(() -> recorder.recordFeedback(404L, true, null))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("404");
        assertThatThrownBy(() -> recorder.find(404L))
                .isInstanceOf(NotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AnomalyRecord createRecord() {
        return AnomalyRecord.builder()
                .roomId("room-a")
                .farmId("farm-1")
                .timestamp(Instant.parse("2024-03-16T00:00:00Z"))
                .metricName("temperature")
                .value(45.0)
                .combinedScore(0.93)
                .anomalyType(AnomalyType.MULTIVARIATE)
                .severity(Severity.HIGH)
                .description("High multivariate anomaly in temperature (score 0.93)")
                .build();
    }
}
