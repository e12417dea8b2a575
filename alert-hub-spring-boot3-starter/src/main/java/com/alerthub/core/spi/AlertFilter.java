package com.alerthub.core.spi;

import com.alerthub.model.Alert;
import com.alerthub.model.FilterResult;
import com.alerthub.model.ctx.FilterContext;

/**
 * 告警过滤器：按来源过滤、改写、丢弃等
 */
public interface AlertFilter extends AutoCloseable {

    String name();

    /**
     * 优先级, 越小越先执行
     */
    default int priority() {
        return 100;
    }

    default boolean isEnabled() {
        return true;
    }

    /**
     * 能否处理此告警, 粗粒度过滤
     */
    default boolean canHandle(Alert alert) {
        return true;
    }

    FilterResult evaluate(Alert alert, FilterContext ctx);

    @Override
    default void close() {
    }
}
