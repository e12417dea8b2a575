package com.alerthub.model.enums;

/**
 * 告警生命周期状态
 * ACTIVE -> ACKNOWLEDGED -> RESOLVED, 或 ACTIVE -> RESOLVED
 */
public enum AlertState {
    /** 已触发, 未处理 */
    ACTIVE,

    /** 已确认 */
    ACKNOWLEDGED,

    /** 已解决, 终态 */
    RESOLVED
}
