package com.alerthub.core.metric;

import com.alerthub.model.AlertStatistics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * 告警管道指标, 同时作为统计快照的数据来源
 * reset 只移动快照的基线, 注册表中的计数器保持单调递增
 */
public final class AlertMetrics {

    static final String SUPPRESSED = "alert.suppressed";
    static final String DELIVERY_SENT = "alert.delivery.sent";
    static final String DELIVERY_FAILED = "alert.delivery.failed";

    public static final String STAGE_FILTER = "filter";
    public static final String STAGE_RULE = "rule";

    static final String UNNAMED = "unnamed";

    private static final String TIMED_COUNT = "timed.count";
    private static final String TIMED_NANOS = "timed.nanos";
    private static final String SUPPRESSED_BY = SUPPRESSED + ":";

    private final MeterRegistry reg;
    private final Counter raised;
    private final Counter failed;
    private final Counter gated;
    private final Counter publishFailed;
    private final Counter maintenanceRemoved;
    private final Counter escalated;
    private final Timer successTimer;
    private final Timer failureTimer;

    /** 上次 reset 时的原始读数 */
    private volatile Map<String, Double> baseline = Map.of();

    private AlertMetrics(MeterRegistry reg) {
        this.reg = reg;
        this.raised = Counter.builder("alert.raised").description("alerts accepted by pipeline").register(reg);
        this.failed = Counter.builder("alert.failed").description("alerts dropped by pipeline error").register(reg);
        this.gated  = Counter.builder("alert.gated").description("alerts below minimum severity").register(reg);
        this.publishFailed = Counter.builder("alert.lifecycle.publish.failed")
                .description("lifecycle event publish failed").register(reg);
        this.maintenanceRemoved = Counter.builder("alert.maintenance.removed")
                .description("resolved alerts purged by maintenance").register(reg);
        this.escalated = Counter.builder("alert.escalated")
                .description("emergency escalations").register(reg);
        this.successTimer = Timer.builder("alert.process.time").tag("outcome", "success")
                .description("pipeline pass time").register(reg);
        this.failureTimer = Timer.builder("alert.process.time").tag("outcome", "failure")
                .description("pipeline pass time").register(reg);
    }

    public static AlertMetrics create(MeterRegistry reg) { return new AlertMetrics(reg); }

    public void incRaised(){ raised.increment(); }
    public void incFailed(){ failed.increment(); }
    public void incGated(){  gated.increment(); }
    public void incPublishFailed(){ publishFailed.increment(); }
    public void incMaintenanceRemoved(int n){ maintenanceRemoved.increment(n); }
    public void incEscalated(){ escalated.increment(); }

    /**
     * 记录抑制, stage 为 filter 或 rule, by 为过滤器/规则名
     */
    public void incSuppressed(String stage, String by) {
        Counter.builder(SUPPRESSED).tag("stage", stage).tag("by", Objects.requireNonNullElse(by, UNNAMED))
                .description("alerts suppressed").register(reg).increment();
    }

    public void incDeliverySent(String channel) {
        Counter.builder(DELIVERY_SENT).tag("channel", Objects.requireNonNullElse(channel, UNNAMED)).register(reg).increment();
    }

    public void incDeliveryFailed(String channel) {
        Counter.builder(DELIVERY_FAILED).tag("channel", Objects.requireNonNullElse(channel, UNNAMED)).register(reg).increment();
    }

    public void recordProcessNanos(long nanos, boolean success) {
        (success ? successTimer : failureTimer).record(nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * 统计计数归零
     * 处理耗时最大值取自 Micrometer 的滑动窗口, 不随 reset 清零
     */
    public void reset() {
        baseline = readRaw();
    }

    /**
     * 统计快照, 计数为注册表读数减去 reset 基线
     */
    public AlertStatistics snapshot(int activeCount, int historyCount, Instant lastMaintenanceRun) {
        Map<String, Double> raw = readRaw();
        Map<String, Double> base = baseline;

        Map<String, Long> suppressedBy = new TreeMap<>();
        raw.forEach((k, v) -> {
            if (k.startsWith(SUPPRESSED_BY)) {
                long n = (long) (v - base.getOrDefault(k, 0.0));
                if (n > 0) {
                    suppressedBy.put(k.substring(SUPPRESSED_BY.length()), n);
                }
            }
        });

        long timed = delta(raw, base, TIMED_COUNT);
        double totalNanos = raw.get(TIMED_NANOS) - base.getOrDefault(TIMED_NANOS, 0.0);
        double maxNanos = Math.max(successTimer.max(TimeUnit.NANOSECONDS), failureTimer.max(TimeUnit.NANOSECONDS));

        return AlertStatistics.builder()
                .totalRaised(delta(raw, base, "alert.raised"))
                .totalFailed(delta(raw, base, "alert.failed"))
                .totalGated(delta(raw, base, "alert.gated"))
                .totalSuppressed(suppressedBy.values().stream().mapToLong(Long::longValue).sum())
                .suppressedBy(Map.copyOf(suppressedBy))
                .deliveriesSent(delta(raw, base, DELIVERY_SENT))
                .deliveriesFailed(delta(raw, base, DELIVERY_FAILED))
                .lifecyclePublishFailures(delta(raw, base, "alert.lifecycle.publish.failed"))
                .escalations(delta(raw, base, "alert.escalated"))
                .averageProcessingTime(timed <= 0 ? Duration.ZERO : Duration.ofNanos((long) (totalNanos / timed)))
                .maxProcessingTime(Duration.ofNanos((long) maxNanos))
                .activeAlertCount(activeCount)
                .historyCount(historyCount)
                .maintenanceRemoved(delta(raw, base, "alert.maintenance.removed"))
                .lastMaintenanceRun(lastMaintenanceRun)
                .build();
    }

    private Map<String, Double> readRaw() {
        Map<String, Double> raw = new HashMap<>();
        raw.put("alert.raised", raised.count());
        raw.put("alert.failed", failed.count());
        raw.put("alert.gated", gated.count());
        raw.put("alert.lifecycle.publish.failed", publishFailed.count());
        raw.put("alert.maintenance.removed", maintenanceRemoved.count());
        raw.put("alert.escalated", escalated.count());
        raw.put(DELIVERY_SENT, sum(DELIVERY_SENT));
        raw.put(DELIVERY_FAILED, sum(DELIVERY_FAILED));
        raw.put(TIMED_COUNT, (double) (successTimer.count() + failureTimer.count()));
        raw.put(TIMED_NANOS, successTimer.totalTime(TimeUnit.NANOSECONDS) + failureTimer.totalTime(TimeUnit.NANOSECONDS));
        reg.find(SUPPRESSED).counters().forEach(c ->
                raw.merge(SUPPRESSED_BY + c.getId().getTag("by"), c.count(), Double::sum));
        return raw;
    }

    private static long delta(Map<String, Double> raw, Map<String, Double> base, String key) {
        return (long) (raw.getOrDefault(key, 0.0) - base.getOrDefault(key, 0.0));
    }

    private double sum(String name) {
        return reg.find(name).counters().stream().mapToDouble(Counter::count).sum();
    }
}
