package com.alerthub.core.gate;

import com.alerthub.model.Alert;
import com.alerthub.model.enums.AlertSeverity;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 级别闸门
 * 来源级别覆盖优先, 否则使用全局最小级别
 */
public class SeverityGate {

    private volatile AlertSeverity globalMinimum;

    private final Map<String, AlertSeverity> sourceMinimums = new ConcurrentHashMap<>();

    public SeverityGate(AlertSeverity globalMinimum) {
        this.globalMinimum = Objects.requireNonNull(globalMinimum, "globalMinimum");
    }

    public boolean passes(Alert alert) {
        return alert.getSeverity().isAtLeast(getMinimumSeverity(alert.getSource()));
    }

    public void setMinimumSeverity(AlertSeverity severity) {
        this.globalMinimum = Objects.requireNonNull(severity, "severity");
    }

    public void setMinimumSeverity(String source, AlertSeverity severity) {
        Objects.requireNonNull(severity, "severity");
        if (source == null || source.isBlank()) {
            setMinimumSeverity(severity);
            return;
        }
        sourceMinimums.put(source, severity);
    }

    /**
     * 移除来源级别覆盖
     */
    public boolean clearMinimumSeverity(String source) {
        return source != null && sourceMinimums.remove(source) != null;
    }

    public Map<String, AlertSeverity> getSourceOverrides() {
        return Map.copyOf(sourceMinimums);
    }

    public AlertSeverity getMinimumSeverity() {
        return globalMinimum;
    }

    public AlertSeverity getMinimumSeverity(String source) {
        if (source == null || source.isBlank()) {
            return globalMinimum;
        }
        return sourceMinimums.getOrDefault(source, globalMinimum);
    }
}
