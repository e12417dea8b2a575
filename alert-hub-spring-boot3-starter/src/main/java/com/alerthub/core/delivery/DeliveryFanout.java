package com.alerthub.core.delivery;

import com.alerthub.core.metric.AlertMetrics;
import com.alerthub.core.spi.AlertChannel;
import com.alerthub.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * 并发投递
 * 每个渠道在投递线程池中独立发送, 单个渠道失败不影响其他渠道
 * 不做重试, 不设超时：渠道返回的 future 永不完成时该投递任务会一直挂起
 */
public class DeliveryFanout {

    private static final Logger log = LoggerFactory.getLogger(DeliveryFanout.class);

    private final Executor deliveryExecutor;

    private final AlertMetrics metrics;

    /** 渠道快照, 写操作由管道写锁串行化 */
    private volatile List<AlertChannel> channels = List.of();

    public DeliveryFanout(Executor deliveryExecutor, AlertMetrics metrics) {
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * 注册渠道, 重名返回 false
     */
    public boolean register(AlertChannel channel) {
        if (find(channel.name()).isPresent()) {
            return false;
        }
        List<AlertChannel> next = new ArrayList<>(channels);
        next.add(channel);
        channels = List.copyOf(next);
        return true;
    }

    public Optional<AlertChannel> unregister(String name) {
        Optional<AlertChannel> found = find(name);
        found.ifPresent(c -> {
            List<AlertChannel> next = new ArrayList<>(channels);
            next.remove(c);
            channels = List.copyOf(next);
        });
        return found;
    }

    public List<AlertChannel> channels() {
        return channels;
    }

    /**
     * 可投递渠道：启用、健康且告警级别不低于渠道最小级别
     */
    public List<AlertChannel> eligible(Alert alert) {
        return channels.stream()
                .filter(c -> c.isEnabled() && c.isHealthy() && alert.getSeverity().isAtLeast(c.minimumSeverity()))
                .toList();
    }

    /**
     * 投递到全部可投递渠道
     * 返回的 future 在所有渠道结果确定后完成, 且不会异常完成
     */
    public CompletableFuture<Void> dispatch(Alert alert) {
        List<AlertChannel> targets = eligible(alert);
        if (targets.isEmpty()) {
            log.debug("[Delivery] no eligible channel for alert {}, severity={}", alert.getId(), alert.getSeverity());
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<?>[] sends = targets.stream()
                .map(c -> deliver(c, alert))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(sends);
    }

    /**
     * 紧急升级投递：全部启用的渠道, 不看渠道健康与最小级别
     */
    public CompletableFuture<Void> escalate(Alert alert) {
        List<AlertChannel> targets = channels.stream().filter(AlertChannel::isEnabled).toList();
        if (targets.isEmpty()) {
            log.warn("[Delivery] no enabled channel for escalation of alert {}", alert.getId());
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.allOf(targets.stream()
                .map(c -> deliver(c, alert))
                .toArray(CompletableFuture[]::new));
    }

    /**
     * 脱离调用方的投递, 调用方不等待结果
     * 未预期的失败进入本组件的失败处理 (指标 + 日志), 不会被静默吞掉
     */
    public void fireAndForget(Alert alert) {
        CompletableFuture<Void> f;
        try {
            f = dispatch(alert);
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        f.whenComplete((v, ex) -> {
            if (ex != null) {
                metrics.incDeliveryFailed("fanout");
                log.error("[Delivery] detached delivery failed, alert={}, correlationId={}",
                        alert.getId(), alert.getCorrelationId(), ex);
            }
        });
    }

    /**
     * 刷出给定渠道, 每个渠道之间检查取消信号, 已发起的刷出不会被中断
     */
    public CompletableFuture<Void> flush(List<AlertChannel> targets, String correlationId, BooleanSupplier cancelled) {
        List<CompletableFuture<Void>> started = new ArrayList<>(targets.size());
        boolean cancel = false;
        for (AlertChannel c : targets) {
            if (cancelled.getAsBoolean()) {
                cancel = true;
                break;
            }
            started.add(invoke(c, () -> c.flushAsync(correlationId))
                    .handle((v, ex) -> {
                        if (ex != null) {
                            log.warn("[Delivery] channel={} flush failed, correlationId={}", c.name(), correlationId, ex);
                        }
                        return null;
                    }));
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(started.toArray(CompletableFuture[]::new));
        if (cancel) {
            log.info("[Delivery] flush cancelled after {}/{} channels, correlationId={}",
                    started.size(), targets.size(), correlationId);
            return all.thenCompose(v -> CompletableFuture.failedFuture(new CancellationException("flush cancelled")));
        }
        return all;
    }

    private CompletableFuture<Void> deliver(AlertChannel channel, Alert alert) {
        return invoke(channel, () -> channel.sendAsync(alert, alert.getCorrelationId()))
                .handle((v, ex) -> {
                    if (ex == null) {
                        metrics.incDeliverySent(channel.name());
                    } else {
                        metrics.incDeliveryFailed(channel.name());
                        log.warn("[Delivery] channel={} alert={} failed, correlationId={}",
                                channel.name(), alert.getId(), alert.getCorrelationId(), ex);
                    }
                    return null;
                });
    }

    /**
     * 在投递线程池中调用渠道, 同步抛出/线程池拒绝/返回 null 均转为失败的 future
     */
    private CompletableFuture<Void> invoke(AlertChannel channel, Supplier<CompletableFuture<Void>> call) {
        try {
            return CompletableFuture.supplyAsync(call, deliveryExecutor)
                    .thenCompose(f -> f != null ? f : CompletableFuture.<Void>failedFuture(
                            new IllegalStateException("channel " + channel.name() + " returned null future")));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Optional<AlertChannel> find(String name) {
        return channels.stream().filter(c -> c.name().equals(name)).findFirst();
    }
}
