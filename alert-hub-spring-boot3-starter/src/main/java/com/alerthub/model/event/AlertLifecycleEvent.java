package com.alerthub.model.event;

import com.alerthub.model.Alert;
import com.alerthub.model.enums.LifecycleEventType;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 告警生命周期事件, 交给外部传输层 (Spring 事件/消息总线) 发布
 */
@Getter
@ToString
public class AlertLifecycleEvent {

    private final LifecycleEventType type;

    private final Alert alert;

    private final String correlationId;

    /** 事件发起组件 */
    private final String source;

    private final Instant occurredAt;

    public AlertLifecycleEvent(LifecycleEventType type, Alert alert, String correlationId,
                               String source, Instant occurredAt) {
        this.type = type;
        this.alert = alert;
        this.correlationId = correlationId;
        this.source = source;
        this.occurredAt = occurredAt;
    }
}
