package com.alerthub.core.suppression;

import com.alerthub.core.spi.SuppressionRule;
import com.alerthub.model.Alert;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存窗口限流
 * 同一窗口内 来源+级别 超过阈值的告警被抑制
 */
public class RateLimitSuppressionRule implements SuppressionRule {

    private final String name;

    private final long windowMs;

    private final int threshold;

    private final Clock clock;

    private volatile long windowStart;

    private final ConcurrentHashMap<String, AtomicInteger> counter = new ConcurrentHashMap<>();

    public RateLimitSuppressionRule(String name, Duration window, int threshold, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        this.name = name;
        this.windowMs = window.toMillis();
        this.threshold = threshold;
        this.clock = clock;
        this.windowStart = clock.millis();
    }

    public RateLimitSuppressionRule(Duration window, int threshold) {
        this("rate-limit", window, threshold, Clock.systemUTC());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean matches(Alert alert) {
        return true;
    }

    @Override
    public Alert applyActions(Alert alert) {
        long now = clock.millis();
        // 重置窗口
        if (now - windowStart > windowMs) {
            windowStart = now;
            counter.clear();
        }
        String key = String.format("%s_%s", alert.getSource(), alert.getSeverity().name());
        int c = counter.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        return c <= threshold ? alert : null;
    }

    @Override
    public void close() {
        counter.clear();
    }
}
