package com.alerthub.core.metric;

import com.alerthub.model.AlertStatistics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlertMetricsTest {

    private final MeterRegistry registry = new SimpleMeterRegistry();

    private final AlertMetrics metrics = AlertMetrics.create(registry);

    @Test
    void snapshotFoldsCounters() {
        metrics.incRaised();
        metrics.incRaised();
        metrics.incFailed();
        metrics.incGated();
        metrics.incSuppressed(AlertMetrics.STAGE_FILTER, "noise");
        metrics.incSuppressed(AlertMetrics.STAGE_RULE, "rate-limit");
        metrics.incSuppressed(AlertMetrics.STAGE_RULE, "rate-limit");
        metrics.incDeliverySent("log");
        metrics.incDeliveryFailed("pager");
        metrics.incPublishFailed();
        metrics.incMaintenanceRemoved(3);
        Instant lastRun = Instant.parse("2024-05-01T10:00:00Z");

        AlertStatistics s = metrics.snapshot(5, 7, lastRun);

        assertEquals(2, s.getTotalRaised());
        assertEquals(1, s.getTotalFailed());
        assertEquals(1, s.getTotalGated());
        assertEquals(3, s.getTotalSuppressed());
        assertEquals(Map.of("noise", 1L, "rate-limit", 2L), s.getSuppressedBy());
        assertEquals(1, s.getDeliveriesSent());
        assertEquals(1, s.getDeliveriesFailed());
        assertEquals(1, s.getLifecyclePublishFailures());
        assertEquals(3, s.getMaintenanceRemoved());
        assertEquals(5, s.getActiveAlertCount());
        assertEquals(7, s.getHistoryCount());
        assertEquals(lastRun, s.getLastMaintenanceRun());
    }

    @Test
    void processingTimeAveragesBothOutcomes() {
        metrics.recordProcessNanos(Duration.ofMillis(10).toNanos(), true);
        metrics.recordProcessNanos(Duration.ofMillis(30).toNanos(), false);

        AlertStatistics s = metrics.snapshot(0, 0, null);

        assertEquals(Duration.ofMillis(20), s.getAverageProcessingTime());
        assertEquals(Duration.ofMillis(30), s.getMaxProcessingTime());
    }

    @Test
    void emptySnapshotHasZeroAverage() {
        assertEquals(Duration.ZERO, metrics.snapshot(0, 0, null).getAverageProcessingTime());
    }

    @Test
    void providerKeepsSimpleFallbackAndAddsDiscovered() {
        SimpleMeterRegistry external = new SimpleMeterRegistry();
        AlertMeterRegistryProvider provider = new AlertMeterRegistryProvider(List.of(external));
        AlertMetrics viaProvider = AlertMetrics.create(provider.getRegistry());

        viaProvider.incRaised();

        assertEquals(1, viaProvider.snapshot(0, 0, null).getTotalRaised());
        assertEquals(1.0, external.get("alert.raised").counter().count());
    }

    @Test
    void providerFlattensNestedCompositesOnce() {
        SimpleMeterRegistry leaf = new SimpleMeterRegistry();
        CompositeMeterRegistry nested = new CompositeMeterRegistry();
        nested.add(leaf);

        AlertMeterRegistryProvider provider = new AlertMeterRegistryProvider(List.of(nested, leaf));
        AlertMetrics.create(provider.getRegistry()).incGated();

        assertEquals(2, provider.attachedCount());
        assertEquals(1.0, leaf.get("alert.gated").counter().count());
    }

    @Test
    void resetMovesTheBaselineOnly() {
        metrics.incRaised();
        metrics.incSuppressed(AlertMetrics.STAGE_RULE, "rate-limit");
        metrics.incEscalated();
        metrics.recordProcessNanos(Duration.ofMillis(10).toNanos(), true);

        metrics.reset();
        metrics.incRaised();

        AlertStatistics s = metrics.snapshot(0, 0, null);
        assertEquals(1, s.getTotalRaised());
        assertEquals(0, s.getTotalSuppressed());
        assertTrue(s.getSuppressedBy().isEmpty());
        assertEquals(0, s.getEscalations());
        assertEquals(Duration.ZERO, s.getAverageProcessingTime());
        assertEquals(2.0, registry.get("alert.raised").counter().count());
    }

    @Test
    void nullTagValuesAreRecordedAsUnnamed() {
        metrics.incSuppressed(AlertMetrics.STAGE_FILTER, null);
        metrics.incDeliverySent(null);

        AlertStatistics s = metrics.snapshot(0, 0, null);
        assertEquals(Map.of("unnamed", 1L), s.getSuppressedBy());
        assertEquals(1, s.getDeliveriesSent());
    }
}
