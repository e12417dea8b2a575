package com.alerthub.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 健康检查报告
 */
@Getter
@Builder
@ToString
public class AlertHealthReport {

    private final Instant timestamp;

    /** 管道可用且连续失败数低于阈值 */
    private final boolean healthy;

    private final boolean enabled;

    private final boolean emergencyModeActive;

    private final int consecutiveFailures;

    /** 本次之前的检查时间 */
    private final Instant previousHealthCheck;

    private final int channelCount;

    private final int healthyChannelCount;
}
