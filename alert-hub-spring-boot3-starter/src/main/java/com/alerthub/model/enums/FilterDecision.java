package com.alerthub.model.enums;

/**
 * 过滤器决策
 */
public enum FilterDecision {
    /** 放行, 进入下一个过滤器 */
    ALLOW,

    /** 抑制, 立即终止并丢弃告警 */
    SUPPRESS,

    /** 改写告警后继续 */
    MODIFY,

    /** 延迟处理, 目前按 ALLOW 处理 */
    DEFER
}
