package com.alerthub.core;

import com.alerthub.config.AlertHubProperties;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

public class AlertPipelineLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AlertPipelineLifecycle.class);

    private final AlertPipeline pipeline;

    private final AlertHubProperties props;

    private final ExecutorService dispatchExecutor;

    private final ExecutorService deliveryExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService maintenanceScheduler;

    public AlertPipelineLifecycle(AlertPipeline pipeline, AlertHubProperties props,
                                  ExecutorService dispatchExecutor, ExecutorService deliveryExecutor) {
        this.pipeline = pipeline;
        this.props = props;
        this.dispatchExecutor = dispatchExecutor;
        this.deliveryExecutor = deliveryExecutor;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ AlertPipeline starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ minimumSeverity       : {}", pipeline.getMinimumSeverity());
            log.info("│ sourceOverrides       : {}", props.getSourceMinimumSeverity());
            log.info("│ history.capacity      : {}", props.getHistory().getCapacity());
            log.info("│ channels              : {}", pipeline.getRegisteredChannels().size());
            log.info("│ filters               : {}", pipeline.getFilters().size());
            log.info("│ suppressionRules      : {}", pipeline.getSuppressionRules().size());
            log.info("│ delivery.core/max     : {}/{}", props.getDelivery().getCorePoolSize(), props.getDelivery().getMaxPoolSize());
            log.info("│ maintenance.enabled   : {}", props.getMaintenance().isEnabled());
            if (props.getMaintenance().isEnabled()) {
                log.info("│ maintenance.interval  : {} ms", props.getMaintenance().getInterval().toMillis());
                log.info("│ maintenance.retention : {} ms", props.getMaintenance().getRetention().toMillis());
            }
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            log.warn("[Alert-Pipeline] failed to render startup banner: {}", t.toString());
        }

        if (props.getMaintenance().isEnabled()) {
            long periodMs = props.getMaintenance().getInterval().toMillis();
            maintenanceScheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("alert-maintenance"));
            maintenanceScheduler.scheduleWithFixedDelay(this::runMaintenance, periodMs, periodMs, TimeUnit.MILLISECONDS);
            log.info("[Maintenance] scheduled every {} ms", periodMs);
        }

        pipeline.validateConfiguration().getErrors()
                .forEach(e -> log.warn("[Alert-Pipeline] configuration: {}", e.getMessage()));
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Alert-Pipeline] stop skipped: already stopped");
            return;
        }
        log.info("[Alert-Pipeline] stopping...");
        long awaitMs = Math.max(1, props.getShutdown().getAwait().toMillis());
        if (maintenanceScheduler != null) {
            maintenanceScheduler.shutdownNow();
        }
        try {
            pipeline.flush("shutdown").get(awaitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[Alert-Pipeline] flush not finished within {} ms", awaitMs);
        } catch (ExecutionException e) {
            log.warn("[Alert-Pipeline] flush failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        pipeline.close();

        dispatchExecutor.shutdown();
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(awaitMs, TimeUnit.MILLISECONDS)) {
                deliveryExecutor.shutdownNow();
                log.warn("[Alert-Pipeline] deliveryExecutor forced shutdown after {} ms", awaitMs);
            }
            if (!dispatchExecutor.awaitTermination(Math.min(2000, awaitMs), TimeUnit.MILLISECONDS)) {
                dispatchExecutor.shutdownNow();
                log.warn("[Alert-Pipeline] dispatchExecutor forced shutdown");
            }
        } catch (InterruptedException ie) {
            deliveryExecutor.shutdownNow();
            dispatchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Alert-Pipeline] stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }

    /**
     * 调度线程中的异常会终止后续调度, 这里只记录
     */
    private void runMaintenance() {
        String cid = UUID.randomUUID().toString();
        try {
            pipeline.performMaintenance(cid);
        } catch (RuntimeException e) {
            log.error("[Maintenance] run failed, correlationId={}", cid, e);
        }
    }
}
