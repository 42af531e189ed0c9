package org.carball.relinfer.progress;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

public class AsyncProgressSinkTest {

    @Test
    void shouldDeliverEventsInOrder() {
        // Given
        List<ProgressEvent> received = new CopyOnWriteArrayList<>();

        // When
        try (AsyncProgressSink sink = new AsyncProgressSink(received::add)) {
            sink.report(ProgressEvent.of(ProgressStage.DISCOVERY, "Discovered 2 tables"));
            sink.report(ProgressEvent.forTable(ProgressStage.PROFILING, "orders", "Profiled orders", 50.0));
            sink.report(ProgressEvent.of(ProgressStage.COMPLETE, "Done"));
        }

        // Then
        assertThat(received).extracting(ProgressEvent::stage)
                .containsExactly(ProgressStage.DISCOVERY, ProgressStage.PROFILING, ProgressStage.COMPLETE);
        assertThat(received.get(1).tableName()).isEqualTo("orders");
    }

    @Test
    void shouldDropEventsInsteadOfBlockingWhenFull() throws InterruptedException {
        // Given
        CountDownLatch delivering = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<ProgressEvent> received = new CopyOnWriteArrayList<>();
        ProgressSink slow = event -> {
            delivering.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            received.add(event);
        };

        try (AsyncProgressSink sink = new AsyncProgressSink(slow, 1)) {
            sink.report(ProgressEvent.of(ProgressStage.ANALYSIS, "first"));
            assertThat(delivering.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            sink.report(ProgressEvent.of(ProgressStage.ANALYSIS, "queued"));
            sink.report(ProgressEvent.of(ProgressStage.ANALYSIS, "dropped"));

            // Then
            assertThat(sink.getDroppedCount()).isEqualTo(1);
            release.countDown();
        }

        assertThat(received).extracting(ProgressEvent::message).containsExactly("first", "queued");
    }

    @Test
    void shouldKeepDeliveringAfterDelegateFailure() {
        // Given
        List<ProgressEvent> received = new CopyOnWriteArrayList<>();
        ProgressSink flaky = event -> {
            if (event.message().equals("boom")) {
                throw new IllegalStateException("listener failed");
            }
            received.add(event);
        };

        // When
        try (AsyncProgressSink sink = new AsyncProgressSink(flaky)) {
            sink.report(ProgressEvent.of(ProgressStage.ANALYSIS, "boom"));
            sink.report(ProgressEvent.of(ProgressStage.COMPLETE, "after"));
        }

        // Then
        assertThat(received).extracting(ProgressEvent::message).containsExactly("after");
    }

    @Test
    void shouldCountEventsReportedAfterClose() {
        // Given
        AsyncProgressSink sink = new AsyncProgressSink(ProgressSink.NO_OP);
        sink.close();

        // When
        sink.report(ProgressEvent.of(ProgressStage.COMPLETE, "late"));

        // Then
        assertThat(sink.getDroppedCount()).isEqualTo(1);
    }

    @Test
    void shouldComputePercentages() {
        assertThat(ProgressEvent.percent(1, 3)).isEqualTo(33.3);
        assertThat(ProgressEvent.percent(0, 0)).isEqualTo(100.0);
    }
}
