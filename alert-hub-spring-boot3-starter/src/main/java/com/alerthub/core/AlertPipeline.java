package com.alerthub.core;

import com.alerthub.core.delivery.DeliveryFanout;
import com.alerthub.core.filter.FilterChain;
import com.alerthub.core.gate.SeverityGate;
import com.alerthub.core.history.HistoryBuffer;
import com.alerthub.core.metric.AlertMetrics;
import com.alerthub.core.notify.LifecycleNotifier;
import com.alerthub.core.registry.ActiveAlertRegistry;
import com.alerthub.core.spi.AlertChannel;
import com.alerthub.core.spi.AlertFilter;
import com.alerthub.core.spi.SuppressionRule;
import com.alerthub.core.spi.notify.AlertLifecyclePublisher;
import com.alerthub.core.suppression.SuppressionEngine;
import com.alerthub.model.Alert;
import com.alerthub.model.AlertDiagnostics;
import com.alerthub.model.AlertHealthReport;
import com.alerthub.model.AlertStatistics;
import com.alerthub.model.ValidationError;
import com.alerthub.model.ValidationResult;
import com.alerthub.model.ctx.FilterContext;
import com.alerthub.model.enums.AlertSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * 告警处理管道
 * raise -> 级别门限 -> 过滤链 -> 抑制规则 -> 登记 + 历史 (同一把锁) -> 并发投递 + 生命周期事件
 * 调用方永远不会从 raise 收到异常
 */
public class AlertPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AlertPipeline.class);

    public static final String COMPONENT = "AlertPipeline";

    public static final String DEFAULT_ACTOR = "system";

    /** 连续处理失败达到该值即视为不健康 */
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;

    static final String DEFAULT_EMERGENCY_REASON = "Emergency mode enabled";

    private static final BooleanSupplier NEVER = () -> false;

    private final SeverityGate gate;

    private final FilterChain filterChain = new FilterChain();

    private final SuppressionEngine suppressionEngine = new SuppressionEngine();

    private final ActiveAlertRegistry registry = new ActiveAlertRegistry();

    private final HistoryBuffer history;

    private final DeliveryFanout fanout;

    private final LifecycleNotifier notifier;

    private final AlertMetrics metrics;

    private final Executor dispatchExecutor;

    private final Clock clock;

    private final Duration maintenanceInterval;

    private final Duration retention;

    /** 登记表/历史/注册列表的唯一同步边界 */
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Instant lastMaintenanceRun;

    private volatile Instant lastHealthCheck;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    private volatile int failureThreshold = DEFAULT_FAILURE_THRESHOLD;

    /** 紧急模式下跳过过滤链与抑制规则, 级别闸门仍然生效 */
    private volatile boolean emergencyMode;

    private volatile String emergencyModeReason;

    public AlertPipeline(AlertSeverity minimumSeverity,
                         int historyCapacity,
                         Duration maintenanceInterval,
                         Duration retention,
                         Executor dispatchExecutor,
                         Executor deliveryExecutor,
                         AlertMetrics metrics,
                         AlertLifecyclePublisher publisher,
                         Clock clock) {
        this.gate = new SeverityGate(minimumSeverity == null ? AlertSeverity.INFO : minimumSeverity);
        this.history = new HistoryBuffer(historyCapacity);
        this.maintenanceInterval = Objects.requireNonNull(maintenanceInterval, "maintenanceInterval");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fanout = new DeliveryFanout(deliveryExecutor, metrics);
        this.notifier = new LifecycleNotifier(publisher, metrics, clock);
        this.lastMaintenanceRun = Instant.now(clock);
        this.lastHealthCheck = this.lastMaintenanceRun;
    }

    // ---------------------------------------------------------------- raise

    public void raise(String message, AlertSeverity severity, String source) {
        raise(message, severity, source, null, null);
    }

    public void raise(String message, AlertSeverity severity, String source, String tag, String correlationId) {
        raise(Alert.create(message, severity, source, tag, correlationId, clock));
    }

    public void raise(Alert alert) {
        if (alert == null || !alert.hasIdentity()) {
            return;
        }
        if (closed.get()) {
            log.debug("[Alert-Pipeline] closed, alert {} ignored", alert.getId());
            return;
        }
        long start = System.nanoTime();
        String cid = alert.getCorrelationId();
        try {
            if (!gate.passes(alert)) {
                metrics.incGated();
                log.debug("[Alert-Pipeline] alert {} below minimum severity, severity={}, source={}, correlationId={}",
                        alert.getId(), alert.getSeverity(), alert.getSource(), cid);
                return;
            }

            Alert current = alert;
            if (emergencyMode) {
                log.debug("[Alert-Pipeline] emergency mode, filters and rules bypassed for alert {}, correlationId={}",
                        alert.getId(), cid);
            } else {
                StageOutcome filtered = filterChain.apply(alert, new FilterContext(cid, Instant.now(clock)));
                if (filtered.isSuppressed()) {
                    metrics.incSuppressed(AlertMetrics.STAGE_FILTER, filtered.getSuppressedBy());
                    return;
                }
                StageOutcome ruled = suppressionEngine.apply(filtered.getAlert());
                if (ruled.isSuppressed()) {
                    metrics.incSuppressed(AlertMetrics.STAGE_RULE, ruled.getSuppressedBy());
                    return;
                }
                current = ruled.getAlert();
            }

            // 重复 id 时登记表返回合并后的告警, 历史与投递都使用它
            Alert stored;
            lock.writeLock().lock();
            try {
                stored = registry.upsert(current);
                history.append(stored);
            } finally {
                lock.writeLock().unlock();
            }

            fanout.fireAndForget(stored);
            notifier.fireRaised(stored);

            consecutiveFailures.set(0);
            metrics.incRaised();
            metrics.recordProcessNanos(System.nanoTime() - start, true);
            log.debug("[Alert-Pipeline] raised alert {}, severity={}, source={}, count={}, correlationId={}",
                    stored.getId(), stored.getSeverity(), stored.getSource(), stored.getCount(), cid);
        } catch (Exception e) {
            int failures = consecutiveFailures.incrementAndGet();
            metrics.incFailed();
            metrics.recordProcessNanos(System.nanoTime() - start, false);
            log.error("[Alert-Pipeline] raise failed, alert={}, source={}, consecutiveFailures={}, correlationId={}",
                    alert.getId(), alert.getSource(), failures, cid, e);
        }
    }

    public CompletableFuture<Void> raiseAsync(Alert alert) {
        return raiseAsync(alert, NEVER);
    }

    /**
     * 同步阶段在分发线程池执行, future 在同步阶段结束时完成, 不等待投递
     */
    public CompletableFuture<Void> raiseAsync(Alert alert, BooleanSupplier cancellation) {
        return runOnDispatch(cancellation, cancelled -> {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("raise cancelled");
            }
            raise(alert);
        });
    }

    public CompletableFuture<Void> raiseAllAsync(Collection<Alert> alerts, BooleanSupplier cancellation) {
        return forEachAsync(alerts, cancellation, this::raise, "raise");
    }

    // ---------------------------------------------------------------- lifecycle

    public void acknowledge(UUID alertId) {
        acknowledge(alertId, DEFAULT_ACTOR, null);
    }

    public void acknowledge(UUID alertId, String correlationId) {
        acknowledge(alertId, DEFAULT_ACTOR, correlationId);
    }

    public void acknowledge(UUID alertId, String actor, String correlationId) {
        if (alertId == null || closed.get()) {
            return;
        }
        Optional<Alert> updated;
        lock.writeLock().lock();
        try {
            updated = registry.acknowledge(alertId, actorOrDefault(actor), Instant.now(clock));
        } finally {
            lock.writeLock().unlock();
        }
        updated.ifPresent(a -> {
            log.info("[Alert-Pipeline] alert {} acknowledged by {}, correlationId={}", a.getId(), a.getAcknowledgedBy(), correlationId);
            notifier.fireAcknowledged(a, correlationId);
        });
    }

    public void resolve(UUID alertId) {
        resolve(alertId, DEFAULT_ACTOR, null);
    }

    public void resolve(UUID alertId, String correlationId) {
        resolve(alertId, DEFAULT_ACTOR, correlationId);
    }

    public void resolve(UUID alertId, String actor, String correlationId) {
        if (alertId == null || closed.get()) {
            return;
        }
        Optional<Alert> updated;
        lock.writeLock().lock();
        try {
            updated = registry.resolve(alertId, actorOrDefault(actor), Instant.now(clock));
        } finally {
            lock.writeLock().unlock();
        }
        updated.ifPresent(a -> {
            log.info("[Alert-Pipeline] alert {} resolved by {}, correlationId={}", a.getId(), a.getResolvedBy(), correlationId);
            notifier.fireResolved(a, correlationId);
        });
    }

    public CompletableFuture<Void> acknowledgeAllAsync(Collection<UUID> alertIds, String correlationId, BooleanSupplier cancellation) {
        return forEachAsync(alertIds, cancellation, id -> acknowledge(id, correlationId), "acknowledge");
    }

    public CompletableFuture<Void> resolveAllAsync(Collection<UUID> alertIds, String correlationId, BooleanSupplier cancellation) {
        return forEachAsync(alertIds, cancellation, id -> resolve(id, correlationId), "resolve");
    }

    // ---------------------------------------------------------------- queries

    /**
     * 处于 ACTIVE 状态的告警, 已确认/已解决的告警仍可通过 {@link #getAlert(UUID)} 查到
     */
    public List<Alert> getActiveAlerts() {
        if (closed.get()) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            return registry.getActive();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Alert> getAlert(UUID alertId) {
        if (alertId == null || closed.get()) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return registry.get(alertId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Alert> getHistory(Duration period) {
        if (period == null || closed.get()) {
            return List.of();
        }
        Instant since = Instant.now(clock).minus(period);
        lock.readLock().lock();
        try {
            return history.query(since);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------- severity

    public void setMinimumSeverity(AlertSeverity severity) {
        if (severity == null) {
            return;
        }
        gate.setMinimumSeverity(severity);
        log.info("[Alert-Pipeline] global minimum severity set to {}", severity);
    }

    public void setMinimumSeverity(String source, AlertSeverity severity) {
        if (severity == null) {
            return;
        }
        gate.setMinimumSeverity(source, severity);
        log.info("[Alert-Pipeline] minimum severity for source={} set to {}", source, severity);
    }

    /**
     * 移除来源级别覆盖, 该来源回落到全局最小级别
     */
    public boolean clearMinimumSeverity(String source) {
        boolean removed = gate.clearMinimumSeverity(source);
        if (removed) {
            log.info("[Alert-Pipeline] minimum severity override for source={} cleared", source);
        }
        return removed;
    }

    public AlertSeverity getMinimumSeverity() {
        return gate.getMinimumSeverity();
    }

    public AlertSeverity getMinimumSeverity(String source) {
        return gate.getMinimumSeverity(source);
    }

    // ---------------------------------------------------------------- registration

    public void registerChannel(AlertChannel channel) {
        registerChannel(channel, null);
    }

    public void registerChannel(AlertChannel channel, String correlationId) {
        if (channel == null) {
            log.debug("[Alert-Pipeline] null channel ignored, correlationId={}", correlationId);
            return;
        }
        boolean added = underWriteLock(() -> fanout.register(channel));
        if (added) {
            log.info("[Alert-Pipeline] channel {} registered, minimumSeverity={}, correlationId={}",
                    channel.name(), channel.minimumSeverity(), correlationId);
        } else {
            log.warn("[Alert-Pipeline] channel {} already registered, correlationId={}", channel.name(), correlationId);
        }
    }

    public boolean unregisterChannel(String name) {
        return unregisterChannel(name, null);
    }

    public boolean unregisterChannel(String name, String correlationId) {
        if (name == null) {
            return false;
        }
        boolean removed = underWriteLock(() -> fanout.unregister(name).isPresent());
        if (removed) {
            log.info("[Alert-Pipeline] channel {} unregistered, correlationId={}", name, correlationId);
        }
        return removed;
    }

    public List<AlertChannel> getRegisteredChannels() {
        lock.readLock().lock();
        try {
            return List.copyOf(fanout.channels());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void addFilter(AlertFilter filter) {
        addFilter(filter, null);
    }

    public void addFilter(AlertFilter filter, String correlationId) {
        if (filter == null) {
            log.debug("[Alert-Pipeline] null filter ignored, correlationId={}", correlationId);
            return;
        }
        boolean added = underWriteLock(() -> filterChain.add(filter));
        if (added) {
            log.info("[Alert-Pipeline] filter {} added, priority={}, correlationId={}", filter.name(), filter.priority(), correlationId);
        } else {
            log.warn("[Alert-Pipeline] filter {} already present, correlationId={}", filter.name(), correlationId);
        }
    }

    public boolean removeFilter(String name) {
        return removeFilter(name, null);
    }

    public boolean removeFilter(String name, String correlationId) {
        if (name == null) {
            return false;
        }
        boolean removed = underWriteLock(() -> filterChain.remove(name).isPresent());
        if (removed) {
            log.info("[Alert-Pipeline] filter {} removed, correlationId={}", name, correlationId);
        }
        return removed;
    }

    public List<AlertFilter> getFilters() {
        return filterChain.filters();
    }

    public void addSuppressionRule(SuppressionRule rule) {
        addSuppressionRule(rule, null);
    }

    public void addSuppressionRule(SuppressionRule rule, String correlationId) {
        if (rule == null) {
            log.debug("[Alert-Pipeline] null suppression rule ignored, correlationId={}", correlationId);
            return;
        }
        boolean added = underWriteLock(() -> suppressionEngine.add(rule));
        if (added) {
            log.info("[Alert-Pipeline] suppression rule {} added, correlationId={}", rule.name(), correlationId);
        } else {
            log.warn("[Alert-Pipeline] suppression rule {} already present, correlationId={}", rule.name(), correlationId);
        }
    }

    public boolean removeSuppressionRule(String name) {
        return removeSuppressionRule(name, null);
    }

    public boolean removeSuppressionRule(String name, String correlationId) {
        if (name == null) {
            return false;
        }
        boolean removed = underWriteLock(() -> suppressionEngine.remove(name).isPresent());
        if (removed) {
            log.info("[Alert-Pipeline] suppression rule {} removed, correlationId={}", name, correlationId);
        }
        return removed;
    }

    public List<SuppressionRule> getSuppressionRules() {
        return suppressionEngine.rules();
    }

    // ---------------------------------------------------------------- ops

    public AlertStatistics getStatistics() {
        int active;
        int historyCount;
        lock.readLock().lock();
        try {
            active = registry.size();
            historyCount = history.size();
        } finally {
            lock.readLock().unlock();
        }
        return metrics.snapshot(active, historyCount, lastMaintenanceRun);
    }

    public void resetMetrics() {
        resetMetrics(null);
    }

    /**
     * 统计计数归零, 已导出到外部注册表的指标不受影响
     */
    public void resetMetrics(String correlationId) {
        metrics.reset();
        log.info("[Alert-Pipeline] metrics reset, correlationId={}", correlationId);
    }

    public boolean isHealthy() {
        return !closed.get() && consecutiveFailures.get() < failureThreshold;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public void setFailureThreshold(int failureThreshold) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
    }

    public AlertHealthReport performHealthCheck() {
        return performHealthCheck(null);
    }

    /**
     * 逐个探测渠道健康, 探测抛异常的渠道计为不健康
     */
    public AlertHealthReport performHealthCheck(String correlationId) {
        Instant now = Instant.now(clock);
        List<AlertChannel> channels = getRegisteredChannels();
        int healthyChannels = 0;
        for (AlertChannel c : channels) {
            try {
                if (c.isHealthy()) {
                    healthyChannels++;
                }
            } catch (Exception e) {
                log.warn("[Health] channel={} health probe failed, correlationId={}", c.name(), correlationId, e);
            }
        }
        AlertHealthReport report = AlertHealthReport.builder()
                .timestamp(now)
                .healthy(isHealthy())
                .enabled(isEnabled())
                .emergencyModeActive(emergencyMode)
                .consecutiveFailures(consecutiveFailures.get())
                .previousHealthCheck(lastHealthCheck)
                .channelCount(channels.size())
                .healthyChannelCount(healthyChannels)
                .build();
        lastHealthCheck = now;
        log.info("[Health] health check completed, healthy={}, channels={}/{}, correlationId={}",
                report.isHealthy(), healthyChannels, channels.size(), correlationId);
        return report;
    }

    public AlertDiagnostics getDiagnostics() {
        int active;
        int historyCount;
        lock.readLock().lock();
        try {
            active = registry.size();
            historyCount = history.size();
        } finally {
            lock.readLock().unlock();
        }
        return AlertDiagnostics.builder()
                .enabled(isEnabled())
                .healthy(isHealthy())
                .emergencyModeActive(emergencyMode)
                .emergencyModeReason(emergencyModeReason)
                .minimumSeverity(gate.getMinimumSeverity())
                .sourceMinimumSeverity(gate.getSourceOverrides())
                .channels(fanout.channels().stream().map(AlertChannel::name).toList())
                .filters(filterChain.filters().stream().map(AlertFilter::name).toList())
                .suppressionRules(suppressionEngine.rules().stream().map(SuppressionRule::name).toList())
                .registeredAlertCount(active)
                .historyCount(historyCount)
                .consecutiveFailures(consecutiveFailures.get())
                .failureThreshold(failureThreshold)
                .lastMaintenanceRun(lastMaintenanceRun)
                .lastHealthCheck(lastHealthCheck)
                .build();
    }

    // ---------------------------------------------------------------- emergency

    public void enableEmergencyMode(String reason) {
        enableEmergencyMode(reason, null);
    }

    public void enableEmergencyMode(String reason, String correlationId) {
        emergencyModeReason = reason == null || reason.isBlank() ? DEFAULT_EMERGENCY_REASON : reason;
        emergencyMode = true;
        log.warn("[Emergency] emergency mode enabled: {}, correlationId={}", emergencyModeReason, correlationId);
    }

    public void disableEmergencyMode() {
        disableEmergencyMode(null);
    }

    public void disableEmergencyMode(String correlationId) {
        emergencyMode = false;
        emergencyModeReason = null;
        log.info("[Emergency] emergency mode disabled, correlationId={}", correlationId);
    }

    public boolean isEmergencyModeActive() {
        return emergencyMode;
    }

    public String getEmergencyModeReason() {
        return emergencyModeReason;
    }

    /**
     * 紧急升级：不经过管道, 直接投递到全部启用的渠道 (忽略渠道健康与最小级别)
     * future 在全部渠道结果确定后完成, 不会异常完成
     */
    public CompletableFuture<Void> escalate(Alert alert, String correlationId) {
        if (alert == null || !alert.hasIdentity() || closed.get()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> sent;
        try {
            sent = fanout.escalate(alert);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        metrics.incEscalated();
        return sent.handle((v, ex) -> {
            if (ex != null) {
                log.error("[Emergency] escalation failed, alert={}, correlationId={}", alert.getId(), correlationId, ex);
            } else {
                log.info("[Emergency] escalation completed, alert={}, correlationId={}", alert.getId(), correlationId);
            }
            return null;
        });
    }

    public ValidationResult validateConfiguration() {
        return validateConfiguration(null);
    }

    public ValidationResult validateConfiguration(String correlationId) {
        Instant now = Instant.now(clock);
        List<ValidationError> errors = new ArrayList<>();
        lock.readLock().lock();
        try {
            List<AlertChannel> channels = fanout.channels();
            if (channels.isEmpty()) {
                errors.add(new ValidationError(ValidationError.NO_CHANNELS, "No alert channels registered"));
            }
            for (AlertChannel c : channels) {
                if (!c.isHealthy()) {
                    errors.add(new ValidationError(ValidationError.CHANNEL_UNHEALTHY, "Channel " + c.name() + " is unhealthy"));
                }
            }
            if (filterChain.size() == 0) {
                errors.add(new ValidationError(ValidationError.NO_FILTERS, "No alert filters configured"));
            }
        } catch (Exception e) {
            log.error("[Alert-Pipeline] validation failed, correlationId={}", correlationId, e);
            errors.add(new ValidationError(ValidationError.VALIDATION_FAILED, "Validation error: " + e.getMessage()));
        } finally {
            lock.readLock().unlock();
        }
        if (errors.isEmpty()) {
            return ValidationResult.success(COMPONENT, now);
        }
        log.debug("[Alert-Pipeline] validation found {} error(s), correlationId={}", errors.size(), correlationId);
        return ValidationResult.failure(errors, COMPONENT, now);
    }

    public int performMaintenance() {
        return performMaintenance(null);
    }

    /**
     * 距上次执行不足一个间隔时直接跳过并返回 0
     */
    public int performMaintenance(String correlationId) {
        if (closed.get()) {
            return 0;
        }
        Instant now = Instant.now(clock);
        int removed;
        lock.writeLock().lock();
        try {
            if (now.isBefore(lastMaintenanceRun.plus(maintenanceInterval))) {
                return 0;
            }
            removed = registry.sweep(now.minus(retention));
            lastMaintenanceRun = now;
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            metrics.incMaintenanceRemoved(removed);
            log.info("[Maintenance] removed {} resolved alert(s), correlationId={}", removed, correlationId);
        } else {
            log.debug("[Maintenance] nothing to remove, correlationId={}", correlationId);
        }
        return removed;
    }

    public CompletableFuture<Void> flush() {
        return flush(null, NEVER);
    }

    public CompletableFuture<Void> flush(String correlationId) {
        return flush(correlationId, NEVER);
    }

    public CompletableFuture<Void> flush(String correlationId, BooleanSupplier cancellation) {
        return fanout.flush(fanout.channels(), correlationId, cancellation == null ? NEVER : cancellation);
    }

    public boolean isEnabled() {
        return !closed.get();
    }

    /**
     * 释放渠道/过滤器/规则并清空状态, 单个资源释放失败不影响其他资源
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<AutoCloseable> resources = new ArrayList<>();
        lock.writeLock().lock();
        try {
            resources.addAll(fanout.channels());
            resources.addAll(filterChain.filters());
            resources.addAll(suppressionEngine.rules());
            fanout.channels().forEach(c -> fanout.unregister(c.name()));
            filterChain.filters().forEach(f -> filterChain.remove(f.name()));
            suppressionEngine.rules().forEach(r -> suppressionEngine.remove(r.name()));
            registry.clear();
            history.clear();
        } finally {
            lock.writeLock().unlock();
        }
        for (AutoCloseable r : resources) {
            try {
                r.close();
            } catch (Exception e) {
                log.warn("[Alert-Pipeline] dispose {} failed", r.getClass().getSimpleName(), e);
            }
        }
        log.info("[Alert-Pipeline] closed, {} resource(s) disposed", resources.size());
    }

    private <T> CompletableFuture<Void> forEachAsync(Collection<T> items, BooleanSupplier cancellation,
                                                     Consumer<T> action, String op) {
        if (items == null || items.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        List<T> snapshot = List.copyOf(items);
        return runOnDispatch(cancellation, cancelled -> {
            int done = 0;
            for (T item : snapshot) {
                if (cancelled.getAsBoolean()) {
                    log.info("[Alert-Pipeline] bulk {} cancelled after {}/{} item(s)", op, done, snapshot.size());
                    throw new CancellationException("bulk " + op + " cancelled");
                }
                action.accept(item);
                done++;
            }
        });
    }

    /**
     * 在分发线程池执行, 取消时 future 以 CancellationException 结束 (isCancelled 为 true)
     */
    private CompletableFuture<Void> runOnDispatch(BooleanSupplier cancellation, Consumer<BooleanSupplier> body) {
        BooleanSupplier cancelled = cancellation == null ? NEVER : cancellation;
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (cancelled.getAsBoolean()) {
            result.completeExceptionally(new CancellationException("cancelled before start"));
            return result;
        }
        try {
            dispatchExecutor.execute(() -> {
                try {
                    body.accept(cancelled);
                    result.complete(null);
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Alert-Pipeline] dispatch executor rejected task", e);
            result.completeExceptionally(e);
        }
        return result;
    }

    private static String actorOrDefault(String actor) {
        return actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor;
    }

    private boolean underWriteLock(BooleanSupplier op) {
        lock.writeLock().lock();
        try {
            return op.getAsBoolean();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
