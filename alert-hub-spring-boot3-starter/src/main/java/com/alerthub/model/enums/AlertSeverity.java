package com.alerthub.model.enums;

/**
 * 告警级别, 声明顺序即严重程度 (DEBUG 最低, CRITICAL 最高)
 */
public enum AlertSeverity {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * 当前级别是否不低于给定阈值
     */
    public boolean isAtLeast(AlertSeverity threshold) {
        return threshold == null || this.compareTo(threshold) >= 0;
    }
}
