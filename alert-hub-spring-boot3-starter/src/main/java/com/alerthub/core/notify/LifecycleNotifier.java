package com.alerthub.core.notify;

import com.alerthub.core.metric.AlertMetrics;
import com.alerthub.core.spi.notify.AlertLifecyclePublisher;
import com.alerthub.model.Alert;
import com.alerthub.model.enums.LifecycleEventType;
import com.alerthub.model.event.AlertLifecycleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * 生命周期事件通知
 * 尽力而为：未配置发布器时直接跳过, 发布失败只记录日志与指标
 */
public class LifecycleNotifier {

    private static final Logger log = LoggerFactory.getLogger(LifecycleNotifier.class);

    static final String SOURCE = "AlertPipeline";

    /** 未启用通知则为 null */
    private final AlertLifecyclePublisher publisher;

    private final AlertMetrics metrics;

    private final Clock clock;

    public LifecycleNotifier(AlertLifecyclePublisher publisher, AlertMetrics metrics, Clock clock) {
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void fireRaised(Alert alert) {
        fire(LifecycleEventType.RAISED, alert, alert.getCorrelationId());
    }

    public void fireAcknowledged(Alert alert, String correlationId) {
        fire(LifecycleEventType.ACKNOWLEDGED, alert, correlationId);
    }

    public void fireResolved(Alert alert, String correlationId) {
        fire(LifecycleEventType.RESOLVED, alert, correlationId);
    }

    private void fire(LifecycleEventType type, Alert alert, String correlationId) {
        if (publisher == null) {
            return;
        }
        String cid = correlationId == null ? alert.getCorrelationId() : correlationId;
        try {
            publisher.publish(new AlertLifecycleEvent(type, alert, cid, SOURCE, Instant.now(clock)));
        } catch (Exception e) {
            metrics.incPublishFailed();
            log.warn("[Notify] publish {} failed, alert={}, correlationId={}", type, alert.getId(), cid, e);
        }
    }
}
