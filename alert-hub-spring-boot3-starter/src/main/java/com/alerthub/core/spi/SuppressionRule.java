package com.alerthub.core.spi;

import com.alerthub.model.Alert;

/**
 * 抑制规则：去重、限流等
 */
public interface SuppressionRule extends AutoCloseable {

    String name();

    default boolean isEnabled() {
        return true;
    }

    boolean matches(Alert alert);

    /**
     * 返回 null 表示抑制, 否则返回 (可能被改写的) 告警
     */
    Alert applyActions(Alert alert);

    @Override
    default void close() {
    }
}
