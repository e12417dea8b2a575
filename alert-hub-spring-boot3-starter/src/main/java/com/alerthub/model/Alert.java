package com.alerthub.model;

import com.alerthub.model.enums.AlertSeverity;
import com.alerthub.model.enums.AlertState;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * 告警
 * 不可变对象, 状态流转均返回新实例, id 在整个生命周期内保持不变
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
public final class Alert {

    public static final int MAX_MESSAGE_LEN = 512;

    private static final UUID NIL_ID = new UUID(0L, 0L);

    /** 告警唯一标识 */
    private final UUID id;

    private final String message;

    private final AlertSeverity severity;

    /** 告警来源, 例如 disk-monitor */
    private final String source;

    /** 分类标签 */
    private final String tag;

    /** 跨系统追踪用的关联id */
    private final String correlationId;

    /** 创建时间 */
    private final Instant timestamp;

    /** 重复触发次数 */
    @Builder.Default
    private final int count = 1;

    @Builder.Default
    private final AlertState state = AlertState.ACTIVE;

    private final Instant acknowledgedAt;

    private final String acknowledgedBy;

    private final Instant resolvedAt;

    private final String resolvedBy;

    public static Alert create(String message, AlertSeverity severity, String source) {
        return create(message, severity, source, null, null, Clock.systemUTC());
    }

    public static Alert create(String message, AlertSeverity severity, String source,
                               String tag, String correlationId, Clock clock) {
        return Alert.builder()
                .id(UUID.randomUUID())
                .message(truncate(message))
                .severity(severity == null ? AlertSeverity.INFO : severity)
                .source(source)
                .tag(tag)
                .correlationId(isBlank(correlationId) ? UUID.randomUUID().toString() : correlationId)
                .timestamp(Instant.now(clock))
                .build();
    }

    /**
     * 重复触发, 计数 +1, 其余字段保持不变
     */
    public Alert incrementCount() {
        return toBuilder().count(count + 1).build();
    }

    public Alert acknowledge(String actor, Instant at) {
        return toBuilder()
                .state(AlertState.ACKNOWLEDGED)
                .acknowledgedAt(at)
                .acknowledgedBy(actor)
                .build();
    }

    /**
     * 解决告警, 未确认过的告警同时补齐确认信息
     */
    public Alert resolve(String actor, Instant at) {
        return toBuilder()
                .state(AlertState.RESOLVED)
                .resolvedAt(at)
                .resolvedBy(actor)
                .acknowledgedAt(acknowledgedAt == null ? at : acknowledgedAt)
                .acknowledgedBy(isBlank(acknowledgedBy) ? actor : acknowledgedBy)
                .build();
    }

    public boolean isActive() {
        return state == AlertState.ACTIVE;
    }

    /** RESOLVED 也视为已确认 */
    public boolean isAcknowledged() {
        return state == AlertState.ACKNOWLEDGED || state == AlertState.RESOLVED;
    }

    public boolean isResolved() {
        return state == AlertState.RESOLVED;
    }

    /**
     * id 为空或为全零 UUID 视为无效告警
     */
    public boolean hasIdentity() {
        return id != null && !NIL_ID.equals(id);
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() > MAX_MESSAGE_LEN ? s.substring(0, MAX_MESSAGE_LEN) : s;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
