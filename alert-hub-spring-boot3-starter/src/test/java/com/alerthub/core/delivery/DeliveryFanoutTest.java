package com.alerthub.core.delivery;

import com.alerthub.core.metric.AlertMetrics;
import com.alerthub.core.spi.AlertChannel;
import com.alerthub.model.Alert;
import com.alerthub.model.AlertStatistics;
import com.alerthub.model.enums.AlertSeverity;
import com.alerthub.support.RecordingChannel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("DeliveryFanout")
class DeliveryFanoutTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    private final AlertMetrics metrics = AlertMetrics.create(new SimpleMeterRegistry());

    private final DeliveryFanout fanout = new DeliveryFanout(executor, metrics);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AlertStatistics stats() {
        return metrics.snapshot(0, 0, null);
    }

    @Nested
    @DisplayName("eligibility")
    class Eligibility {

        @Test
        @DisplayName("channel minimum severity gates delivery")
        void severityGated() {
            RecordingChannel errorOnly = new RecordingChannel("pager", AlertSeverity.ERROR);
            fanout.register(errorOnly);

            fanout.dispatch(Alert.create("w", AlertSeverity.WARNING, "svc")).join();
            fanout.dispatch(Alert.create("c", AlertSeverity.CRITICAL, "svc")).join();

            assertEquals(1, errorOnly.received().size());
            assertEquals(AlertSeverity.CRITICAL, errorOnly.received().get(0).getSeverity());
        }

        @Test
        void disabledAndUnhealthyChannelsAreSkipped() {
            RecordingChannel disabled = new RecordingChannel("disabled", AlertSeverity.DEBUG).enabled(false);
            RecordingChannel sick = new RecordingChannel("sick", AlertSeverity.DEBUG).healthy(false);
            fanout.register(disabled);
            fanout.register(sick);

            fanout.dispatch(Alert.create("x", AlertSeverity.CRITICAL, "svc")).join();

            assertTrue(disabled.received().isEmpty());
            assertTrue(sick.received().isEmpty());
        }

        @Test
        void duplicateNameRejected() {
            assertTrue(fanout.register(new RecordingChannel("a", AlertSeverity.INFO)));
            assertFalse(fanout.register(new RecordingChannel("a", AlertSeverity.INFO)));
            assertEquals(1, fanout.channels().size());
            assertTrue(fanout.unregister("a").isPresent());
            assertTrue(fanout.channels().isEmpty());
        }
    }

    @Nested
    @DisplayName("failure isolation")
    class Isolation {

        @Test
        @DisplayName("a throwing channel does not stop its siblings")
        void throwingChannelIsolated() {
            RecordingChannel broken = new RecordingChannel("broken", AlertSeverity.INFO).failing(true);
            RecordingChannel ok = new RecordingChannel("ok", AlertSeverity.INFO);
            fanout.register(broken);
            fanout.register(ok);

            CompletableFuture<Void> f = fanout.dispatch(Alert.create("x", AlertSeverity.ERROR, "svc"));

            assertDoesNotThrow(f::join);
            assertEquals(1, ok.received().size());
            assertEquals(1, stats().getDeliveriesSent());
            assertEquals(1, stats().getDeliveriesFailed());
        }

        @Test
        @DisplayName("exceptional and null futures count as failures")
        void exceptionalAndNullFutures() {
            AlertChannel exceptional = mockChannel("exceptional");
            when(exceptional.sendAsync(any(), anyString()))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
            AlertChannel nullFuture = mockChannel("null");
            when(nullFuture.sendAsync(any(), anyString())).thenReturn(null);
            fanout.register(exceptional);
            fanout.register(nullFuture);

            fanout.dispatch(Alert.create("x", AlertSeverity.ERROR, "svc")).join();

            assertEquals(2, stats().getDeliveriesFailed());
            assertEquals(0, stats().getDeliveriesSent());
        }

        @Test
        @DisplayName("fire and forget delivers without the caller waiting")
        void fireAndForget() {
            RecordingChannel ok = new RecordingChannel("ok", AlertSeverity.INFO);
            fanout.register(ok);

            fanout.fireAndForget(Alert.create("x", AlertSeverity.ERROR, "svc"));

            await().atMost(Duration.ofSeconds(2)).until(() -> ok.received().size() == 1);
        }
    }

    @Nested
    @DisplayName("flush")
    class Flush {

        @Test
        void flushesEveryChannel() {
            RecordingChannel a = new RecordingChannel("a", AlertSeverity.INFO);
            RecordingChannel b = new RecordingChannel("b", AlertSeverity.INFO);

            fanout.flush(List.of(a, b), "cid", () -> false).join();

            assertEquals(1, a.flushCount());
            assertEquals(1, b.flushCount());
        }

        @Test
        @DisplayName("cancellation is checked between channels")
        void cancellationBetweenChannels() {
            RecordingChannel a = new RecordingChannel("a", AlertSeverity.INFO);
            RecordingChannel b = new RecordingChannel("b", AlertSeverity.INFO);
            AtomicInteger checks = new AtomicInteger();

            CompletableFuture<Void> f = fanout.flush(List.of(a, b), "cid", () -> checks.incrementAndGet() > 1);

            CompletionException ex = assertThrows(CompletionException.class, f::join);
            assertInstanceOf(CancellationException.class, ex.getCause());
            assertEquals(1, a.flushCount());
            assertEquals(0, b.flushCount());
        }

        @Test
        void failingFlushIsIsolated() {
            AlertChannel broken = mockChannel("broken");
            when(broken.flushAsync(anyString())).thenThrow(new IllegalStateException("nope"));
            RecordingChannel ok = new RecordingChannel("ok", AlertSeverity.INFO);

            assertDoesNotThrow(() -> fanout.flush(List.of(broken, ok), "cid", () -> false).join());
            assertEquals(1, ok.flushCount());
        }
    }

    @Nested
    @DisplayName("escalation")
    class Escalation {

        @Test
        @DisplayName("every enabled channel receives the alert, healthy or not")
        void ignoresHealthAndThreshold() {
            RecordingChannel sick = new RecordingChannel("sick", AlertSeverity.CRITICAL).healthy(false);
            RecordingChannel off = new RecordingChannel("off", AlertSeverity.DEBUG).enabled(false);
            fanout.register(sick);
            fanout.register(off);
            Alert a = Alert.create("w", AlertSeverity.WARNING, "svc");

            fanout.escalate(a).join();

            assertEquals(List.of(a), sick.received());
            assertTrue(off.received().isEmpty());
            assertEquals(1, stats().getDeliveriesSent());
        }

        @Test
        void noEnabledChannelCompletesImmediately() {
            assertTrue(fanout.escalate(Alert.create("w", AlertSeverity.WARNING, "svc")).isDone());
        }
    }

    private AlertChannel mockChannel(String name) {
        AlertChannel c = mock(AlertChannel.class);
        when(c.name()).thenReturn(name);
        when(c.isEnabled()).thenReturn(true);
        when(c.isHealthy()).thenReturn(true);
        when(c.minimumSeverity()).thenReturn(AlertSeverity.DEBUG);
        return c;
    }
}
