package com.alerthub.model;

import com.alerthub.model.enums.AlertSeverity;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 管道诊断信息：运行状态与当前注册的组件
 */
@Getter
@Builder
@ToString
public class AlertDiagnostics {

    private final boolean enabled;

    private final boolean healthy;

    private final boolean emergencyModeActive;

    private final String emergencyModeReason;

    private final AlertSeverity minimumSeverity;

    /** 按来源覆盖的最小级别 */
    private final Map<String, AlertSeverity> sourceMinimumSeverity;

    private final List<String> channels;

    private final List<String> filters;

    private final List<String> suppressionRules;

    /** 登记表条目数, 含已确认/已解决 */
    private final int registeredAlertCount;

    private final int historyCount;

    private final int consecutiveFailures;

    private final int failureThreshold;

    private final Instant lastMaintenanceRun;

    private final Instant lastHealthCheck;
}
