package com.alerthub.core.channel;

import com.alerthub.core.spi.AlertChannel;
import com.alerthub.core.spi.AlertSerializer;
import com.alerthub.model.Alert;
import com.alerthub.model.enums.AlertSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * 日志渠道, 默认启用
 */
public class LoggingAlertChannel implements AlertChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertChannel.class);

    private final AlertSeverity minimumSeverity;

    /** 非 null 时以 JSON 输出整条告警 */
    private final AlertSerializer serializer;

    private volatile boolean enabled = true;

    public LoggingAlertChannel(AlertSeverity minimumSeverity, AlertSerializer serializer) {
        this.minimumSeverity = minimumSeverity;
        this.serializer = serializer;
    }

    @Override
    public String name() {
        return "log";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    @Override
    public AlertSeverity minimumSeverity() {
        return minimumSeverity;
    }

    @Override
    public CompletableFuture<Void> sendAsync(Alert alert, String correlationId) {
        if (serializer != null) {
            write(alert.getSeverity(), "[Alert] {} correlationId={}", serializer.serialize(alert), correlationId);
            return CompletableFuture.completedFuture(null);
        }
        switch (alert.getSeverity()) {
            case CRITICAL, ERROR -> log.error("[Alert-{}] source={}, tag={}, id={}, count={}, msg={}, correlationId={}",
                    alert.getSeverity(), alert.getSource(), alert.getTag(), alert.getId(), alert.getCount(),
                    truncate(alert.getMessage()), correlationId);
            case WARNING -> log.warn("[Alert-{}] source={}, tag={}, id={}, count={}, msg={}",
                    alert.getSeverity(), alert.getSource(), alert.getTag(), alert.getId(), alert.getCount(), alert.getMessage());
            case INFO -> log.info("[Alert-{}] source={}, id={}, msg={}",
                    alert.getSeverity(), alert.getSource(), alert.getId(), alert.getMessage());
            default -> log.debug("[Alert-{}] source={}, id={}, msg={}",
                    alert.getSeverity(), alert.getSource(), alert.getId(), alert.getMessage());
        }
        return CompletableFuture.completedFuture(null);
    }

    private void write(AlertSeverity severity, String format, Object... args) {
        switch (severity) {
            case CRITICAL, ERROR -> log.error(format, args);
            case WARNING -> log.warn(format, args);
            case INFO -> log.info(format, args);
            default -> log.debug(format, args);
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
