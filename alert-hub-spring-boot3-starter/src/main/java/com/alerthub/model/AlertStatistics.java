package com.alerthub.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 管道统计快照
 */
@Getter
@Builder
@ToString
public class AlertStatistics {

    /** 成功通过管道的告警数 */
    private final long totalRaised;

    /** 处理异常被丢弃的告警数 */
    private final long totalFailed;

    /** 低于最小级别被拦截的告警数 */
    private final long totalGated;

    /** 被过滤器或抑制规则丢弃的告警数 */
    private final long totalSuppressed;

    /** 按过滤器/规则名统计的抑制次数 */
    private final Map<String, Long> suppressedBy;

    private final long deliveriesSent;

    private final long deliveriesFailed;

    private final long lifecyclePublishFailures;

    /** 紧急升级次数 */
    private final long escalations;

    /** 单次处理平均耗时 */
    private final Duration averageProcessingTime;

    private final Duration maxProcessingTime;

    private final int activeAlertCount;

    private final int historyCount;

    private final long maintenanceRemoved;

    private final Instant lastMaintenanceRun;
}
