package com.alerthub.model.enums;

/**
 * 告警生命周期事件
 */
public enum LifecycleEventType {
    /** 告警通过管道 */
    RAISED,

    /** 告警被确认 */
    ACKNOWLEDGED,

    /** 告警被解决 */
    RESOLVED
}
