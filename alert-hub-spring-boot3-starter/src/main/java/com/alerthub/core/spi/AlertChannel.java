package com.alerthub.core.spi;

import com.alerthub.model.Alert;
import com.alerthub.model.enums.AlertSeverity;

import java.util.concurrent.CompletableFuture;

/**
 * 告警投递渠道
 * 重试/退避由渠道自行负责, 管道只投递一次
 */
public interface AlertChannel extends AutoCloseable {

    /**
     * 渠道名称, 全局唯一, 用于注册/注销及日志与指标维度
     */
    String name();

    boolean isEnabled();

    boolean isHealthy();

    /**
     * 低于该级别的告警不会投递到此渠道
     */
    AlertSeverity minimumSeverity();

    /**
     * 异步发送, 框架层在投递线程池中调用
     */
    CompletableFuture<Void> sendAsync(Alert alert, String correlationId);

    /**
     * 刷出渠道内缓冲的告警
     */
    default CompletableFuture<Void> flushAsync(String correlationId) {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * 管道关闭时调用
     */
    @Override
    default void close() {
    }
}
